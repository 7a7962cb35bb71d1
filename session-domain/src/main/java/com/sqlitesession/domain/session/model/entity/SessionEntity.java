package com.sqlitesession.domain.session.model.entity;

import com.sqlitesession.types.enums.SessionTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 会话领域实体（根实体）。
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Data
public class SessionEntity {

    /**
     * 会话 ID
     */
    private String sessionId;

    /**
     * 会话类型
     */
    private SessionTypeEnum sessionType;

    /**
     * 扩展载荷（任意可序列化的键值文档）
     */
    private Map<String, Object> metadata;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    /**
     * 验证会话是否有效
     */
    public void validate() {
        if (sessionId == null || sessionId.trim().isEmpty()) {
            throw new IllegalStateException("Session ID cannot be empty");
        }
        if (sessionType == null) {
            throw new IllegalStateException("Session type cannot be null");
        }
    }

    /**
     * 更新扩展载荷并刷新更新时间
     */
    public void updateMetadata(Map<String, Object> metadata) {
        this.metadata = metadata == null ? new HashMap<>() : new HashMap<>(metadata);
        this.updatedAt = LocalDateTime.now();
    }

    public static SessionEntity create(String sessionId, SessionTypeEnum sessionType) {
        LocalDateTime now = LocalDateTime.now();
        SessionEntity entity = new SessionEntity();
        entity.setSessionId(sessionId);
        entity.setSessionType(sessionType);
        entity.setMetadata(new HashMap<>());
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }
}
