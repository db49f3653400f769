package com.jreinhal.docqa.controller;

import com.jreinhal.docqa.session.SessionStore;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes. Neither depends on the model backends, so a pod stays in
 * rotation and serves degraded answers while a model is down.
 */
@RestController
public class HealthController {
    private final SessionStore sessionStore;

    public HealthController(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @GetMapping(value={"/healthz"})
    public Map<String, String> healthz() {
        return Map.of("status", "healthy");
    }

    @GetMapping(value={"/readyz"})
    public Map<String, String> readyz() {
        return Map.of("status", "ready");
    }

    @GetMapping(value={"/health"})
    public Map<String, Object> health() {
        return Map.of("status", "ok", "activeSessions", this.sessionStore.size());
    }
}
