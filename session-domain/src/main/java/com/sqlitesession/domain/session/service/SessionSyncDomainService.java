package com.sqlitesession.domain.session.service;

import com.sqlitesession.domain.session.adapter.repository.ISessionRepository;
import com.sqlitesession.domain.session.model.entity.SessionAgentEntity;
import com.sqlitesession.domain.session.model.entity.SessionEntity;
import com.sqlitesession.domain.session.model.entity.SessionMessageEntity;
import com.sqlitesession.types.enums.SessionTypeEnum;
import com.sqlitesession.types.exception.DuplicateEntityException;
import com.sqlitesession.types.exception.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话同步领域服务：封装会话引导/恢复、Agent 初始化、消息追加、脱敏与 Multi-agent 状态同步等规则。
 * <p>
 * 仅依赖 {@link ISessionRepository}，不持有任何内存状态；下一条消息 ID 始终由已存储的消息推导。
 * </p>
 */
@Slf4j
@Service
public class SessionSyncDomainService {

    private final ISessionRepository sessionRepository;

    public SessionSyncDomainService(ISessionRepository sessionRepository) {
        this.sessionRepository = sessionRepository;
    }

    /**
     * 会话存在则恢复，否则创建。
     */
    public SessionEntity openSession(String sessionId, SessionTypeEnum sessionType) {
        SessionEntity existing = sessionRepository.readSession(sessionId).orElse(null);
        if (existing != null) {
            return existing;
        }
        SessionEntity session = SessionEntity.create(sessionId, sessionType);
        try {
            sessionRepository.createSession(session);
            log.info("Session created. sessionId={}, type={}", sessionId, sessionType);
            return session;
        } catch (DuplicateEntityException ex) {
            // 并发创建，以已落库的为准
            return sessionRepository.readSession(sessionId).orElseThrow(() -> ex);
        }
    }

    /**
     * Agent 已存在时恢复其状态与消息；否则创建 Agent 并按顺序写入初始消息。
     */
    public AgentRestoreResult initializeAgent(String sessionId,
                                              SessionAgentEntity agent,
                                              List<Map<String, Object>> initialMessages) {
        if (agent == null) {
            throw new IllegalStateException("Agent cannot be null");
        }
        agent.validate();
        SessionAgentEntity existing = sessionRepository.readAgent(sessionId, agent.getAgentId()).orElse(null);
        if (existing != null) {
            List<SessionMessageEntity> messages = sessionRepository.listMessages(sessionId, existing.getAgentId());
            log.info("Agent restored. sessionId={}, agentId={}, messages={}",
                    sessionId, existing.getAgentId(), messages.size());
            return AgentRestoreResult.restored(existing, messages);
        }

        sessionRepository.createAgent(sessionId, agent);
        List<SessionMessageEntity> created = new ArrayList<>();
        if (initialMessages != null) {
            int messageId = 0;
            for (Map<String, Object> message : initialMessages) {
                SessionMessageEntity entity = SessionMessageEntity.create(messageId++, message);
                sessionRepository.createMessage(sessionId, agent.getAgentId(), entity);
                created.add(entity);
            }
        }
        return AgentRestoreResult.created(agent, created);
    }

    /**
     * 以下一个连续 messageId 追加消息。
     */
    public SessionMessageEntity appendMessage(String sessionId, String agentId, Map<String, Object> message) {
        if (message == null) {
            throw new IllegalStateException("Message payload cannot be null");
        }
        SessionMessageEntity latest = latestMessage(sessionId, agentId);
        int nextId = latest == null ? 0 : latest.getMessageId() + 1;
        SessionMessageEntity entity = SessionMessageEntity.create(nextId, message);
        sessionRepository.createMessage(sessionId, agentId, entity);
        return entity;
    }

    /**
     * 将 Agent 当前状态写回存储。
     */
    public void syncAgent(String sessionId, SessionAgentEntity agent) {
        if (agent == null) {
            throw new IllegalStateException("Agent cannot be null");
        }
        agent.setUpdatedAt(LocalDateTime.now());
        sessionRepository.updateAgent(sessionId, agent);
    }

    /**
     * 为最近一条消息写入脱敏内容。
     */
    public SessionMessageEntity redactLatestMessage(String sessionId, String agentId, Map<String, Object> redactMessage) {
        SessionMessageEntity latest = latestMessage(sessionId, agentId);
        if (latest == null) {
            throw new IllegalStateException("No message to redact for agent " + agentId + " in session " + sessionId);
        }
        latest.redact(redactMessage);
        sessionRepository.updateMessage(sessionId, agentId, latest);
        return latest;
    }

    /**
     * Multi-agent 状态存在则恢复，否则以初始状态创建。
     */
    public Map<String, Object> initializeMultiAgent(String sessionId,
                                                    String multiAgentId,
                                                    Map<String, Object> initialState) {
        try {
            return sessionRepository.readMultiAgent(sessionId, multiAgentId);
        } catch (EntityNotFoundException ex) {
            Map<String, Object> state = initialState == null ? new HashMap<>() : new HashMap<>(initialState);
            sessionRepository.createMultiAgent(sessionId, multiAgentId, state);
            return state;
        }
    }

    public void syncMultiAgent(String sessionId, String multiAgentId, Map<String, Object> state) {
        sessionRepository.updateMultiAgent(sessionId, multiAgentId, state == null ? new HashMap<>() : state);
    }

    private SessionMessageEntity latestMessage(String sessionId, String agentId) {
        List<SessionMessageEntity> messages = sessionRepository.listMessages(sessionId, agentId);
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    public record AgentRestoreResult(SessionAgentEntity agent,
                                     List<SessionMessageEntity> messages,
                                     boolean restored) {

        public static AgentRestoreResult restored(SessionAgentEntity agent, List<SessionMessageEntity> messages) {
            return new AgentRestoreResult(agent, messages, true);
        }

        public static AgentRestoreResult created(SessionAgentEntity agent, List<SessionMessageEntity> messages) {
            return new AgentRestoreResult(agent, messages, false);
        }
    }
}
