package com.sqlitesession.types.exception;

import com.sqlitesession.types.enums.EntityKindEnum;
import com.sqlitesession.types.enums.ResponseCode;

/**
 * 被引用的实体（或其必需的父实体）不存在。
 */
public class EntityNotFoundException extends EntityException {

    private static final long serialVersionUID = -8290112718904519017L;

    public EntityNotFoundException(EntityKindEnum entityKind, String identity) {
        this(entityKind, identity, null);
    }

    public EntityNotFoundException(EntityKindEnum entityKind, String identity, Throwable cause) {
        super(ResponseCode.NOT_FOUND.getCode(), entityKind, identity,
                entityKind.getLabel() + " not found: " + identity, cause);
    }
}
