package com.sqlitesession.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话消息 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionMessagePO {

    private String sessionId;
    private String agentId;
    private Integer messageId;
    private String data;
}
