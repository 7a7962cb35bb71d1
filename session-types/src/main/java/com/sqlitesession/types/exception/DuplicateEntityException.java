package com.sqlitesession.types.exception;

import com.sqlitesession.types.enums.EntityKindEnum;
import com.sqlitesession.types.enums.ResponseCode;

/**
 * 创建时实体标识已存在。
 */
public class DuplicateEntityException extends EntityException {

    private static final long serialVersionUID = 3034915243127391651L;

    public DuplicateEntityException(EntityKindEnum entityKind, String identity, Throwable cause) {
        super(ResponseCode.DUPLICATE_ENTITY.getCode(), entityKind, identity,
                entityKind.getLabel() + " already exists: " + identity, cause);
    }
}
