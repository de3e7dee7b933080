package com.tasktracker.backend.modules.auth.application;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RevokedTokenSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(RevokedTokenSweepScheduler.class);

    private final TokenRevocationRegistry revocationRegistry;
    private final Clock clock;

    public RevokedTokenSweepScheduler(TokenRevocationRegistry revocationRegistry, Clock clock) {
        this.revocationRegistry = revocationRegistry;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.auth.revocation-sweep-interval:PT1H}")
    public void sweepExpiredRevocations() {
        int removed = revocationRegistry.sweepExpired(clock.instant());
        if (removed > 0) {
            log.info("Removed {} expired revocation entries", removed);
        }
    }
}
