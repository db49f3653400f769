package com.jreinhal.docqa.session;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background sweep bounding how long an idle session stays in memory. Read paths also sweep on
 * demand, so expiry does not depend on this running.
 */
@Component
@ConditionalOnProperty(prefix = "docqa.sessions", name = "scheduled-sweep-enabled", havingValue = "true", matchIfMissing = true)
public class SessionExpiryScheduler {
    private final SessionStore sessionStore;

    public SessionExpiryScheduler(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Scheduled(fixedDelayString = "${docqa.sessions.sweep-interval-ms:60000}")
    public void sweep() {
        this.sessionStore.sweepExpired();
    }
}
