package com.sqlitesession.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Multi-agent 状态 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MultiAgentStatePO {

    private String sessionId;
    private String multiAgentId;
    private String data;
}
