package com.callshield.application.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

@Component
@RequiredArgsConstructor
@Slf4j
public class SessionArchivalScheduler {

    private final SessionRegistry sessionRegistry;
    private final Clock clock;

    @Value("${callshield.session.retention-minutes:60}")
    private long retentionMinutes;

    @Scheduled(fixedRateString = "${callshield.session.archival-interval-ms:300000}")
    public void archiveEndedSessions() {
        int evicted = sessionRegistry.evictTerminated(clock.instant().minus(Duration.ofMinutes(retentionMinutes)));
        if (evicted > 0) {
            log.info("Archived {} ended session(s), {} still live", evicted, sessionRegistry.size());
        }
    }
}
