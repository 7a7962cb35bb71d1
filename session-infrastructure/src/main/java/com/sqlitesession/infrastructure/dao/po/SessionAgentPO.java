package com.sqlitesession.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent 状态 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionAgentPO {

    private String sessionId;
    private String agentId;
    private String data;
}
