package com.sqlitesession.types.enums;

import lombok.Getter;

/**
 * 持久化实体类型枚举。
 */
@Getter
public enum EntityKindEnum {

    SESSION("Session"),
    AGENT("Agent"),
    MESSAGE("Message"),
    MULTI_AGENT("Multi-agent");

    private final String label;

    EntityKindEnum(String label) {
        this.label = label;
    }
}
