package com.sqlitesession.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionPO {

    private String sessionId;
    private String data;
}
