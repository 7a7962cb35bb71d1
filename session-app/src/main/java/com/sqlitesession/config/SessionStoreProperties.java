package com.sqlitesession.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 会话存储配置属性类。
 * <p>
 * 配置前缀为 session.store。db-path 为空时回退到环境变量 SESSION_STORE_DB_PATH，
 * 再回退到 ./sessions.db；取值 :memory: 表示不落盘的内存库。
 * </p>
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Data
@ConfigurationProperties(prefix = "session.store", ignoreInvalidFields = true)
public class SessionStoreProperties {

    /** 数据库文件路径或 :memory: */
    private String dbPath;

    /** 启动检查配置 */
    private StartupCheck startupCheck = new StartupCheck();

    @Data
    public static class StartupCheck {

        /** 是否在启动时探测存储，默认开启 */
        private boolean enabled = true;
    }

}
