package com.sqlitesession.config;

import com.sqlitesession.infrastructure.repository.session.SessionRepositoryImpl;
import com.sqlitesession.infrastructure.sqlite.SessionStoreLocation;
import com.sqlitesession.infrastructure.util.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 会话存储配置类。
 * <p>
 * 根据 {@link SessionStoreProperties} 解析存储位置并打开仓储，容器关闭时释放连接。
 * </p>
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SessionStoreProperties.class)
public class SessionStoreConfig {

    @Bean
    public SessionStoreLocation sessionStoreLocation(SessionStoreProperties properties) {
        SessionStoreLocation location = SessionStoreLocation.resolve(properties.getDbPath());
        log.info("Session store location resolved: {}", location);
        return location;
    }

    @Bean(destroyMethod = "close")
    public SessionRepositoryImpl sessionRepository(SessionStoreLocation location, JsonCodec jsonCodec) {
        return SessionRepositoryImpl.open(location, jsonCodec);
    }

}
