package com.sqlitesession.types.enums;

/**
 * 会话类型枚举。
 */
public enum SessionTypeEnum {
    AGENT,
    MULTI_AGENT
}
