package com.sqlitesession.infrastructure.repository.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.sqlitesession.domain.session.adapter.repository.ISessionRepository;
import com.sqlitesession.domain.session.model.entity.SessionAgentEntity;
import com.sqlitesession.domain.session.model.entity.SessionEntity;
import com.sqlitesession.domain.session.model.entity.SessionMessageEntity;
import com.sqlitesession.infrastructure.dao.MultiAgentStateDao;
import com.sqlitesession.infrastructure.dao.SessionAgentDao;
import com.sqlitesession.infrastructure.dao.SessionDao;
import com.sqlitesession.infrastructure.dao.SessionMessageDao;
import com.sqlitesession.infrastructure.dao.po.MultiAgentStatePO;
import com.sqlitesession.infrastructure.dao.po.SessionAgentPO;
import com.sqlitesession.infrastructure.dao.po.SessionMessagePO;
import com.sqlitesession.infrastructure.dao.po.SessionPO;
import com.sqlitesession.infrastructure.sqlite.SessionStoreLocation;
import com.sqlitesession.infrastructure.sqlite.SqliteConstraintClassifier;
import com.sqlitesession.infrastructure.sqlite.SqliteConstraintClassifier.ConstraintViolation;
import com.sqlitesession.infrastructure.sqlite.SqliteStoreSupport;
import com.sqlitesession.infrastructure.util.JsonCodec;
import com.sqlitesession.types.enums.EntityKindEnum;
import com.sqlitesession.types.exception.DuplicateEntityException;
import com.sqlitesession.types.exception.EntityException;
import com.sqlitesession.types.exception.EntityNotFoundException;
import com.sqlitesession.types.exception.StorageFailureException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * 基于 SQLite 的会话状态仓储实现。
 * <p>
 * 负责会话层级数据的持久化操作，包括：
 * <ul>
 *   <li>Session / Agent / Message / Multi-agent 四类实体的增删改查</li>
 *   <li>Entity 与 PO 之间的相互转换，data 列为实体的 JSON 文档</li>
 *   <li>约束违例到 DuplicateEntity / NotFound / StorageFailure 的映射</li>
 * </ul>
 * 实例独占一个连接，使用完毕须调用 {@link #close()}。
 * </p>
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Slf4j
public class SessionRepositoryImpl implements ISessionRepository, AutoCloseable {

    private static final TypeReference<Map<String, Object>> STATE_REF = new TypeReference<Map<String, Object>>() {};

    private final SqliteStoreSupport storeSupport;
    private final JsonCodec jsonCodec;

    /**
     * 创建 SessionRepositoryImpl。
     */
    public SessionRepositoryImpl(SqliteStoreSupport storeSupport, JsonCodec jsonCodec) {
        this.storeSupport = storeSupport;
        this.jsonCodec = jsonCodec;
    }

    /**
     * 打开指定位置的存储。
     */
    public static SessionRepositoryImpl open(SessionStoreLocation location, JsonCodec jsonCodec) {
        return new SessionRepositoryImpl(SqliteStoreSupport.open(location), jsonCodec);
    }

    // ------------------------------------------------------------------ session

    @Override
    public void createSession(SessionEntity session) {
        session.validate();
        String sessionId = session.getSessionId();
        String identity = sessionIdentity(sessionId);
        SessionPO po = SessionPO.builder()
                .sessionId(sessionId)
                .data(encode(session, "create session", EntityKindEnum.SESSION, identity))
                .build();
        insert("create session", EntityKindEnum.SESSION, identity,
                () -> storeSupport.execute(SessionDao.class, dao -> dao.insert(po)),
                null);
        log.debug("Session created. sessionId={}", sessionId);
    }

    @Override
    public Optional<SessionEntity> readSession(String sessionId) {
        String identity = sessionIdentity(sessionId);
        SessionPO po = query("read session", EntityKindEnum.SESSION, identity,
                () -> storeSupport.execute(SessionDao.class, dao -> dao.selectById(sessionId)));
        if (po == null) {
            return Optional.empty();
        }
        return Optional.of(decode(po.getData(), SessionEntity.class, "read session", EntityKindEnum.SESSION, identity));
    }

    @Override
    public void deleteSession(String sessionId) {
        String identity = sessionIdentity(sessionId);
        int affected = query("delete session", EntityKindEnum.SESSION, identity,
                () -> storeSupport.execute(SessionDao.class, dao -> dao.deleteById(sessionId)));
        if (affected == 0) {
            throw new EntityNotFoundException(EntityKindEnum.SESSION, identity);
        }
        log.debug("Session deleted with dependents. sessionId={}", sessionId);
    }

    // ------------------------------------------------------------------ agent

    @Override
    public void createAgent(String sessionId, SessionAgentEntity agent) {
        agent.validate();
        String identity = agentIdentity(sessionId, agent.getAgentId());
        SessionAgentPO po = SessionAgentPO.builder()
                .sessionId(sessionId)
                .agentId(agent.getAgentId())
                .data(encode(agent, "create agent", EntityKindEnum.AGENT, identity))
                .build();
        insert("create agent", EntityKindEnum.AGENT, identity,
                () -> storeSupport.execute(SessionAgentDao.class, dao -> dao.insert(po)),
                new ParentRef(EntityKindEnum.SESSION, sessionIdentity(sessionId), () -> sessionExists(sessionId)));
        log.debug("Agent created. sessionId={}, agentId={}", sessionId, agent.getAgentId());
    }

    @Override
    public Optional<SessionAgentEntity> readAgent(String sessionId, String agentId) {
        String identity = agentIdentity(sessionId, agentId);
        SessionAgentPO po = query("read agent", EntityKindEnum.AGENT, identity,
                () -> storeSupport.execute(SessionAgentDao.class, dao -> dao.selectById(sessionId, agentId)));
        if (po == null) {
            return Optional.empty();
        }
        return Optional.of(decode(po.getData(), SessionAgentEntity.class, "read agent", EntityKindEnum.AGENT, identity));
    }

    @Override
    public void updateAgent(String sessionId, SessionAgentEntity agent) {
        agent.validate();
        String agentId = agent.getAgentId();
        String identity = agentIdentity(sessionId, agentId);
        requireExisting(EntityKindEnum.AGENT, identity, "update agent",
                () -> storeSupport.execute(SessionAgentDao.class, dao -> dao.countById(sessionId, agentId)));
        SessionAgentPO po = SessionAgentPO.builder()
                .sessionId(sessionId)
                .agentId(agentId)
                .data(encode(agent, "update agent", EntityKindEnum.AGENT, identity))
                .build();
        requireUpdated(EntityKindEnum.AGENT, identity, query("update agent", EntityKindEnum.AGENT, identity,
                () -> storeSupport.execute(SessionAgentDao.class, dao -> dao.update(po))));
    }

    // ------------------------------------------------------------------ message

    @Override
    public void createMessage(String sessionId, String agentId, SessionMessageEntity message) {
        message.validate();
        Integer messageId = message.getMessageId();
        String identity = messageIdentity(sessionId, agentId, messageId);
        SessionMessagePO po = SessionMessagePO.builder()
                .sessionId(sessionId)
                .agentId(agentId)
                .messageId(messageId)
                .data(encode(message, "create message", EntityKindEnum.MESSAGE, identity))
                .build();
        insert("create message", EntityKindEnum.MESSAGE, identity,
                () -> storeSupport.execute(SessionMessageDao.class, dao -> dao.insert(po)),
                new ParentRef(EntityKindEnum.AGENT, agentIdentity(sessionId, agentId), () -> agentExists(sessionId, agentId)));
    }

    @Override
    public SessionMessageEntity readMessage(String sessionId, String agentId, int messageId) {
        String identity = messageIdentity(sessionId, agentId, messageId);
        SessionMessagePO po = query("read message", EntityKindEnum.MESSAGE, identity,
                () -> storeSupport.execute(SessionMessageDao.class, dao -> dao.selectById(sessionId, agentId, messageId)));
        if (po == null) {
            throw new EntityNotFoundException(EntityKindEnum.MESSAGE, identity);
        }
        return decode(po.getData(), SessionMessageEntity.class, "read message", EntityKindEnum.MESSAGE, identity);
    }

    @Override
    public void updateMessage(String sessionId, String agentId, SessionMessageEntity message) {
        message.validate();
        Integer messageId = message.getMessageId();
        String identity = messageIdentity(sessionId, agentId, messageId);
        requireExisting(EntityKindEnum.MESSAGE, identity, "update message",
                () -> storeSupport.execute(SessionMessageDao.class, dao -> dao.countById(sessionId, agentId, messageId)));
        SessionMessagePO po = SessionMessagePO.builder()
                .sessionId(sessionId)
                .agentId(agentId)
                .messageId(messageId)
                .data(encode(message, "update message", EntityKindEnum.MESSAGE, identity))
                .build();
        requireUpdated(EntityKindEnum.MESSAGE, identity, query("update message", EntityKindEnum.MESSAGE, identity,
                () -> storeSupport.execute(SessionMessageDao.class, dao -> dao.update(po))));
    }

    @Override
    public List<SessionMessageEntity> listMessages(String sessionId, String agentId, Integer limit, int offset) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        String identity = agentIdentity(sessionId, agentId);
        List<SessionMessagePO> rows = query("list messages", EntityKindEnum.MESSAGE, identity,
                () -> storeSupport.execute(SessionMessageDao.class,
                        dao -> dao.selectByAgent(sessionId, agentId, limit, offset)));
        List<SessionMessageEntity> messages = new ArrayList<>(rows.size());
        for (SessionMessagePO row : rows) {
            messages.add(decode(row.getData(), SessionMessageEntity.class, "list messages", EntityKindEnum.MESSAGE,
                    messageIdentity(sessionId, agentId, row.getMessageId())));
        }
        return messages;
    }

    // ------------------------------------------------------------------ multi-agent

    @Override
    public void createMultiAgent(String sessionId, String multiAgentId, Map<String, Object> state) {
        requireState(state);
        String identity = multiAgentIdentity(sessionId, multiAgentId);
        MultiAgentStatePO po = MultiAgentStatePO.builder()
                .sessionId(sessionId)
                .multiAgentId(multiAgentId)
                .data(encode(state, "create multi-agent", EntityKindEnum.MULTI_AGENT, identity))
                .build();
        insert("create multi-agent", EntityKindEnum.MULTI_AGENT, identity,
                () -> storeSupport.execute(MultiAgentStateDao.class, dao -> dao.insert(po)),
                new ParentRef(EntityKindEnum.SESSION, sessionIdentity(sessionId), () -> sessionExists(sessionId)));
    }

    @Override
    public Map<String, Object> readMultiAgent(String sessionId, String multiAgentId) {
        String identity = multiAgentIdentity(sessionId, multiAgentId);
        MultiAgentStatePO po = query("read multi-agent", EntityKindEnum.MULTI_AGENT, identity,
                () -> storeSupport.execute(MultiAgentStateDao.class, dao -> dao.selectById(sessionId, multiAgentId)));
        if (po == null) {
            throw new EntityNotFoundException(EntityKindEnum.MULTI_AGENT, identity);
        }
        try {
            return jsonCodec.readValue(po.getData(), STATE_REF);
        } catch (RuntimeException ex) {
            throw storageFailure("read multi-agent", EntityKindEnum.MULTI_AGENT, identity, ex);
        }
    }

    @Override
    public void updateMultiAgent(String sessionId, String multiAgentId, Map<String, Object> state) {
        requireState(state);
        String identity = multiAgentIdentity(sessionId, multiAgentId);
        requireExisting(EntityKindEnum.MULTI_AGENT, identity, "update multi-agent",
                () -> storeSupport.execute(MultiAgentStateDao.class, dao -> dao.countById(sessionId, multiAgentId)));
        MultiAgentStatePO po = MultiAgentStatePO.builder()
                .sessionId(sessionId)
                .multiAgentId(multiAgentId)
                .data(encode(state, "update multi-agent", EntityKindEnum.MULTI_AGENT, identity))
                .build();
        requireUpdated(EntityKindEnum.MULTI_AGENT, identity, query("update multi-agent", EntityKindEnum.MULTI_AGENT, identity,
                () -> storeSupport.execute(MultiAgentStateDao.class, dao -> dao.update(po))));
    }

    // ------------------------------------------------------------------ lifecycle

    public SessionStoreLocation getLocation() {
        return storeSupport.getLocation();
    }

    @Override
    public void close() {
        storeSupport.close();
    }

    // ------------------------------------------------------------------ helpers

    /**
     * 执行插入并映射约束违例：唯一约束 → 重复，外键约束 → 父实体不存在。
     */
    private void insert(String operation, EntityKindEnum kind, String identity, Supplier<Integer> action, ParentRef parent) {
        try {
            action.get();
        } catch (EntityException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            ConstraintViolation violation = SqliteConstraintClassifier.classify(ex);
            if (violation == ConstraintViolation.UNIQUE) {
                throw new DuplicateEntityException(kind, identity, ex);
            }
            if (violation == ConstraintViolation.FOREIGN_KEY && parent != null) {
                throw new EntityNotFoundException(parent.kind(), parent.identity(), ex);
            }
            if (violation == ConstraintViolation.UNSPECIFIED) {
                if (parent != null && !parent.exists().getAsBoolean()) {
                    throw new EntityNotFoundException(parent.kind(), parent.identity(), ex);
                }
                throw new DuplicateEntityException(kind, identity, ex);
            }
            throw storageFailure(operation, kind, identity, ex);
        }
    }

    private <T> T query(String operation, EntityKindEnum kind, String identity, Supplier<T> action) {
        try {
            return action.get();
        } catch (EntityException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw storageFailure(operation, kind, identity, ex);
        }
    }

    /**
     * 写操作前的显式存在性探测，更新从不退化为 upsert。
     */
    private void requireExisting(EntityKindEnum kind, String identity, String operation, Supplier<Integer> counter) {
        Integer count = query(operation, kind, identity, counter);
        if (count == null || count == 0) {
            throw new EntityNotFoundException(kind, identity);
        }
    }

    /**
     * 探测与写入之间行可能已被其他实例删除，未命中任何行同样视为不存在。
     */
    private static void requireUpdated(EntityKindEnum kind, String identity, Integer affected) {
        if (affected == null || affected == 0) {
            throw new EntityNotFoundException(kind, identity);
        }
    }

    private static void requireState(Map<String, Object> state) {
        if (state == null) {
            throw new IllegalStateException("Multi-agent state cannot be null");
        }
    }

    private boolean sessionExists(String sessionId) {
        Integer count = query("probe session", EntityKindEnum.SESSION, sessionIdentity(sessionId),
                () -> storeSupport.execute(SessionDao.class, dao -> dao.countById(sessionId)));
        return count != null && count > 0;
    }

    private boolean agentExists(String sessionId, String agentId) {
        Integer count = query("probe agent", EntityKindEnum.AGENT, agentIdentity(sessionId, agentId),
                () -> storeSupport.execute(SessionAgentDao.class, dao -> dao.countById(sessionId, agentId)));
        return count != null && count > 0;
    }

    private String encode(Object value, String operation, EntityKindEnum kind, String identity) {
        try {
            return jsonCodec.writeValue(value);
        } catch (RuntimeException ex) {
            throw storageFailure(operation, kind, identity, ex);
        }
    }

    private <T> T decode(String data, Class<T> type, String operation, EntityKindEnum kind, String identity) {
        try {
            T value = jsonCodec.readValue(data, type);
            if (value == null) {
                throw new IllegalStateException("Stored document is empty");
            }
            return value;
        } catch (RuntimeException ex) {
            throw storageFailure(operation, kind, identity, ex);
        }
    }

    private StorageFailureException storageFailure(String operation, EntityKindEnum kind, String identity, Exception cause) {
        log.warn("Session store operation failed. operation={}, {}, error={}", operation, identity, cause.getMessage());
        return new StorageFailureException(operation, kind, identity, cause);
    }

    private static String sessionIdentity(String sessionId) {
        return "session=" + sessionId;
    }

    private static String agentIdentity(String sessionId, String agentId) {
        return "session=" + sessionId + ", agent=" + agentId;
    }

    private static String messageIdentity(String sessionId, String agentId, Integer messageId) {
        return "session=" + sessionId + ", agent=" + agentId + ", message=" + messageId;
    }

    private static String multiAgentIdentity(String sessionId, String multiAgentId) {
        return "session=" + sessionId + ", multiAgent=" + multiAgentId;
    }

    private record ParentRef(EntityKindEnum kind, String identity, BooleanSupplier exists) {
    }
}
