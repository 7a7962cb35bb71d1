package com.sqlitesession.domain.session.model.entity;

import com.sqlitesession.types.enums.MessageRoleEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话消息实体。
 * <p>
 * message 为 {"role": ..., "content": [...]} 文档，存储层不解析其内容。
 * 顺序由 messageId 决定，而非写入时间。
 * </p>
 */
@Data
public class SessionMessageEntity {

    private Integer messageId;
    private Map<String, Object> message;

    /** 脱敏后的替代消息，为空表示未脱敏 */
    private Map<String, Object> redactMessage;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public void validate() {
        if (messageId == null) {
            throw new IllegalStateException("Message ID cannot be null");
        }
        if (messageId < 0) {
            throw new IllegalStateException("Message ID cannot be negative");
        }
        if (message == null) {
            throw new IllegalStateException("Message payload cannot be null");
        }
    }

    public void redact(Map<String, Object> redactMessage) {
        if (redactMessage == null) {
            throw new IllegalStateException("Redact message cannot be null");
        }
        this.redactMessage = new LinkedHashMap<>(redactMessage);
        this.updatedAt = LocalDateTime.now();
    }

    public static SessionMessageEntity create(int messageId, Map<String, Object> message) {
        LocalDateTime now = LocalDateTime.now();
        SessionMessageEntity entity = new SessionMessageEntity();
        entity.setMessageId(messageId);
        entity.setMessage(new LinkedHashMap<>(message));
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    public static SessionMessageEntity textMessage(int messageId, MessageRoleEnum role, String text) {
        return create(messageId, messageDocument(role, List.<Map<String, Object>>of(Map.of("text", text))));
    }

    public static Map<String, Object> messageDocument(MessageRoleEnum role, List<Map<String, Object>> content) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("role", role.value());
        document.put("content", content == null ? new ArrayList<>() : new ArrayList<>(content));
        return document;
    }
}
