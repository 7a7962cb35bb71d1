package com.sqlitesession.types.exception;

import com.sqlitesession.types.enums.EntityKindEnum;
import lombok.Getter;

/**
 * 携带实体类型与标识的存储异常基类。
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Getter
public abstract class EntityException extends AppException {

    private static final long serialVersionUID = -2361735046711327462L;

    /** 实体类型 */
    private final EntityKindEnum entityKind;

    /** 实体标识，如 "session=s1, agent=a1" */
    private final String identity;

    protected EntityException(String code, EntityKindEnum entityKind, String identity, String message, Throwable cause) {
        super(code, message, cause);
        this.entityKind = entityKind;
        this.identity = identity;
    }
}
