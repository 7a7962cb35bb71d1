package com.sqlitesession.infrastructure.sqlite;

import com.sqlitesession.types.common.Constants;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.UnaryOperator;

/**
 * 存储位置：文件路径或内存库哨兵值。
 * <p>
 * 解析顺序：显式参数 → 环境变量 {@value Constants#DB_PATH_ENV} → 旧版环境变量
 * {@value Constants#LEGACY_DB_PATH_ENV} → {@value Constants#DEFAULT_DB_PATH}。
 * </p>
 */
public final class SessionStoreLocation {

    private final String dbPath;

    private SessionStoreLocation(String dbPath) {
        this.dbPath = dbPath;
    }

    public static SessionStoreLocation resolve(String explicitPath) {
        return resolve(explicitPath, System::getenv);
    }

    public static SessionStoreLocation resolve(String explicitPath, UnaryOperator<String> env) {
        if (StringUtils.isNotBlank(explicitPath)) {
            return new SessionStoreLocation(explicitPath.trim());
        }
        String fromEnv = StringUtils.trim(env.apply(Constants.DB_PATH_ENV));
        if (StringUtils.isBlank(fromEnv)) {
            fromEnv = StringUtils.trim(env.apply(Constants.LEGACY_DB_PATH_ENV));
        }
        return new SessionStoreLocation(StringUtils.defaultIfBlank(fromEnv, Constants.DEFAULT_DB_PATH));
    }

    public static SessionStoreLocation memory() {
        return new SessionStoreLocation(Constants.MEMORY_DB);
    }

    public boolean isMemory() {
        return Constants.MEMORY_DB.equals(dbPath);
    }

    public String getDbPath() {
        return dbPath;
    }

    /**
     * 文件库的绝对路径，内存库返回 null。
     */
    public Path toFilePath() {
        return isMemory() ? null : Paths.get(dbPath).toAbsolutePath();
    }

    public String toJdbcUrl() {
        return isMemory() ? "jdbc:sqlite::memory:" : "jdbc:sqlite:" + toFilePath();
    }

    @Override
    public String toString() {
        return dbPath;
    }
}
