package com.sqlitesession.config;

import com.sqlitesession.domain.session.adapter.repository.ISessionRepository;
import com.sqlitesession.infrastructure.sqlite.SessionStoreLocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时校验会话存储可用性。
 */
@Slf4j
@Component
public class SessionStoreStartupCheckRunner implements ApplicationRunner {

    private static final String PROBE_SESSION_ID = "__startup_probe__";

    private final ISessionRepository sessionRepository;
    private final SessionStoreLocation location;
    private final boolean enabled;

    public SessionStoreStartupCheckRunner(ISessionRepository sessionRepository,
                                          SessionStoreLocation location,
                                          SessionStoreProperties properties) {
        this.sessionRepository = sessionRepository;
        this.location = location;
        this.enabled = properties.getStartupCheck().isEnabled();
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.info("Skip session store startup check because session.store.startup-check.enabled=false");
            return;
        }
        // 只读探测，不写入任何数据
        sessionRepository.readSession(PROBE_SESSION_ID);
        log.info("Session store startup check passed. location={}, memory={}", location, location.isMemory());
    }
}
