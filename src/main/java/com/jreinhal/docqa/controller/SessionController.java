package com.jreinhal.docqa.controller;

import com.jreinhal.docqa.session.SessionStore;
import com.jreinhal.docqa.session.SessionSummary;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/sessions"})
public class SessionController {
    private final SessionStore sessionStore;

    public SessionController(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @GetMapping
    public List<SessionSummary> list() {
        this.sessionStore.sweepExpired();
        return this.sessionStore.listSessions();
    }

    /**
     * Idempotent: deleting an unknown or expired session succeeds with {@code deleted=false}.
     */
    @DeleteMapping(value={"/{sessionId}"})
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String sessionId) {
        boolean deleted = this.sessionStore.deleteSession(sessionId);
        return ResponseEntity.ok(Map.of("sessionId", sessionId, "deleted", deleted));
    }
}
