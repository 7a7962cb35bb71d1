package com.sqlitesession.domain.session.model.entity;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 会话内 Agent 状态实体。
 * <p>
 * 标识为 (sessionId, agentId)，sessionId 由仓储调用方传入，不属于文档本身。
 * </p>
 */
@Data
public class SessionAgentEntity {

    private String agentId;

    /** Agent 自身状态 */
    private Map<String, Object> state;

    /** 对话管理器状态（如滑动窗口位置） */
    private Map<String, Object> conversationManagerState;

    /** 框架内部状态 */
    private Map<String, Object> internalState;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public void validate() {
        if (agentId == null || agentId.trim().isEmpty()) {
            throw new IllegalStateException("Agent ID cannot be empty");
        }
    }

    public void updateState(Map<String, Object> state, Map<String, Object> conversationManagerState) {
        this.state = state == null ? new HashMap<>() : new HashMap<>(state);
        this.conversationManagerState = conversationManagerState == null
                ? new HashMap<>()
                : new HashMap<>(conversationManagerState);
        this.updatedAt = LocalDateTime.now();
    }

    public static SessionAgentEntity create(String agentId,
                                            Map<String, Object> state,
                                            Map<String, Object> conversationManagerState) {
        LocalDateTime now = LocalDateTime.now();
        SessionAgentEntity entity = new SessionAgentEntity();
        entity.setAgentId(agentId);
        entity.setState(state == null ? new HashMap<>() : new HashMap<>(state));
        entity.setConversationManagerState(conversationManagerState == null
                ? new HashMap<>()
                : new HashMap<>(conversationManagerState));
        entity.setInternalState(new HashMap<>());
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }
}
