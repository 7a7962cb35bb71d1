package com.sqlitesession.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义会话存储对外暴露的错误码和对应描述信息。
 * </p>
 *
 * @author getoffer
 * @since 2025-01-29
 */
@Getter
public enum ResponseCode {

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 实体已存在 */
    DUPLICATE_ENTITY("0003", "实体已存在"),

    /** 实体不存在 */
    NOT_FOUND("0004", "实体不存在"),

    /** 存储失败 */
    STORAGE_FAILURE("0005", "存储失败");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
