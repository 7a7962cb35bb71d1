package com.sqlitesession.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 定义会话存储的位置约定：显式参数、环境变量、默认路径以及内存库哨兵值。
 * </p>
 *
 * @author getoffer
 * @since 2026-10-19
 */
public class Constants {

    /** 内存库哨兵值，进程退出即丢弃 */
    public final static String MEMORY_DB = ":memory:";

    /** 存储位置环境变量名 */
    public final static String DB_PATH_ENV = "SESSION_STORE_DB_PATH";

    /** 旧版存储位置环境变量名，仅在 {@link #DB_PATH_ENV} 未设置时读取 */
    public final static String LEGACY_DB_PATH_ENV = "STRANDS_SQLITE_DB_PATH";

    /** 默认数据库文件路径 */
    public final static String DEFAULT_DB_PATH = "./sessions.db";

}
