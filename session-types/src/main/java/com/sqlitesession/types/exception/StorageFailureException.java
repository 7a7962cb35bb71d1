package com.sqlitesession.types.exception;

import com.sqlitesession.types.enums.EntityKindEnum;
import com.sqlitesession.types.enums.ResponseCode;

/**
 * 底层存储引擎或编解码的非预期失败。
 */
public class StorageFailureException extends EntityException {

    private static final long serialVersionUID = 6120378519862771044L;

    public StorageFailureException(String operation, EntityKindEnum entityKind, String identity, Throwable cause) {
        super(ResponseCode.STORAGE_FAILURE.getCode(), entityKind, identity,
                "Failed to " + operation + (identity == null ? "" : " [" + identity + "]")
                        + (cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage()),
                cause);
    }
}
