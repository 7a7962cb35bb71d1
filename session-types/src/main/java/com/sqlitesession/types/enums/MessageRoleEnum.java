package com.sqlitesession.types.enums;

import java.util.Locale;

/**
 * 对话消息角色枚举。
 */
public enum MessageRoleEnum {
    USER,
    ASSISTANT,
    SYSTEM,
    TOOL;

    /**
     * 消息文档中的角色取值（小写）。
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
