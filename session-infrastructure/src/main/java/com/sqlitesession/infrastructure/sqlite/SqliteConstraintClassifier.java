package com.sqlitesession.infrastructure.sqlite;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * 根据 SQLite 扩展结果码区分约束违例的种类，不依赖错误信息文本。
 */
public final class SqliteConstraintClassifier {

    private SqliteConstraintClassifier() {
    }

    public enum ConstraintViolation {
        /** 主键或唯一约束 */
        UNIQUE,
        /** 外键约束：父实体不存在 */
        FOREIGN_KEY,
        /** 引擎只给出基础 SQLITE_CONSTRAINT，需调用方自行判断 */
        UNSPECIFIED,
        /** 不是约束违例 */
        NONE
    }

    /**
     * 沿异常链查找 {@link SQLiteException} 并分类。
     */
    public static ConstraintViolation classify(Throwable throwable) {
        SQLiteException sqliteException = findSqliteException(throwable);
        if (sqliteException == null) {
            return ConstraintViolation.NONE;
        }
        SQLiteErrorCode resultCode = sqliteException.getResultCode();
        if (resultCode == SQLiteErrorCode.SQLITE_CONSTRAINT_FOREIGNKEY) {
            return ConstraintViolation.FOREIGN_KEY;
        }
        if (resultCode == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY
                || resultCode == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE) {
            return ConstraintViolation.UNIQUE;
        }
        if (resultCode == SQLiteErrorCode.SQLITE_CONSTRAINT) {
            return ConstraintViolation.UNSPECIFIED;
        }
        return ConstraintViolation.NONE;
    }

    private static SQLiteException findSqliteException(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (cursor instanceof SQLiteException sqliteException) {
                return sqliteException;
            }
            if (cursor.getCause() == cursor) {
                return null;
            }
            cursor = cursor.getCause();
        }
        return null;
    }
}
