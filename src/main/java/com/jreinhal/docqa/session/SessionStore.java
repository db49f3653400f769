package com.jreinhal.docqa.session;

import com.jreinhal.docqa.exception.EmptyDocumentException;
import com.jreinhal.docqa.model.Chunk;
import com.jreinhal.docqa.rag.index.EmbeddingFunction;
import com.jreinhal.docqa.rag.index.EmbeddingRetrievalIndex;
import com.jreinhal.docqa.rag.index.RetrievalIndex;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Owns every upload session and its retrieval indices.
 *
 * <p>All reads and writes of the session map happen under one guard, held only for the map
 * access itself. Index building (embedding calls) runs before the guard is taken, and callers
 * receive copied lists of indices, so retrieval and generation never run under the guard and a
 * concurrent sweep can never hand out a half-removed session.</p>
 *
 * <p>Unknown or expired ids are not errors: lookups simply omit them.</p>
 */
@Service
public class SessionStore {
    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);
    private final Object lock = new Object();
    // guarded by lock
    private final Map<String, Session> sessions = new LinkedHashMap<>();
    private final EmbeddingFunction embeddingFunction;
    private final Duration timeout;
    private final Clock clock;

    @Autowired
    public SessionStore(EmbeddingFunction embeddingFunction, @Value("${docqa.sessions.timeout-seconds:3600}") long timeoutSeconds) {
        this(embeddingFunction, Duration.ofSeconds(timeoutSeconds), Clock.systemUTC());
    }

    public SessionStore(EmbeddingFunction embeddingFunction, Duration timeout, Clock clock) {
        this.embeddingFunction = embeddingFunction;
        this.timeout = timeout;
        this.clock = clock;
    }

    public String createSession(List<Chunk> chunks) {
        return this.createSession(chunks, null);
    }

    /**
     * Builds an index over {@code chunks} and publishes a new session holding it.
     *
     * @throws EmptyDocumentException when {@code chunks} is null or empty
     * @throws com.jreinhal.docqa.exception.IndexBuildFailedException when embedding fails; nothing is published
     */
    public String createSession(List<Chunk> chunks, String label) {
        if (chunks == null || chunks.isEmpty()) {
            throw new EmptyDocumentException("Document produced no text chunks");
        }
        RetrievalIndex index = EmbeddingRetrievalIndex.build(chunks, this.embeddingFunction);
        Instant now = this.clock.instant();
        String sessionId;
        synchronized (this.lock) {
            do {
                sessionId = UUID.randomUUID().toString();
            } while (this.sessions.containsKey(sessionId));
            this.sessions.put(sessionId, new Session(sessionId, label, index, now));
        }
        log.info("Session created: {} (chunks={})", sessionId, index.size());
        return sessionId;
    }

    /**
     * Adds an index built from another upload to an existing session.
     *
     * @return false when the session no longer exists; the freshly built index is discarded
     */
    public boolean attachIndex(String sessionId, List<Chunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            throw new EmptyDocumentException("Document produced no text chunks");
        }
        RetrievalIndex index = EmbeddingRetrievalIndex.build(chunks, this.embeddingFunction);
        Instant now = this.clock.instant();
        synchronized (this.lock) {
            Session session = this.sessions.get(sessionId);
            if (session == null) {
                log.info("Attach skipped, session not found: {}", sessionId);
                return false;
            }
            session.indices.add(index);
            session.lastAccessed = now;
        }
        log.info("Index attached to session {} (chunks={})", sessionId, index.size());
        return true;
    }

    /**
     * Snapshots the indices of every known session in {@code sessionIds} and refreshes their
     * last-access time. Missing ids are left out of the result; input order is preserved.
     */
    public Map<String, List<RetrievalIndex>> resolveIndices(Collection<String> sessionIds) {
        if (sessionIds == null || sessionIds.isEmpty()) {
            return Map.of();
        }
        Instant now = this.clock.instant();
        LinkedHashMap<String, List<RetrievalIndex>> resolved = new LinkedHashMap<>();
        synchronized (this.lock) {
            for (String sessionId : sessionIds) {
                if (sessionId == null || resolved.containsKey(sessionId)) {
                    continue;
                }
                Session session = this.sessions.get(sessionId);
                if (session == null) {
                    continue;
                }
                session.lastAccessed = now;
                resolved.put(sessionId, List.copyOf(session.indices));
            }
        }
        if (log.isDebugEnabled() && resolved.size() < sessionIds.size()) {
            log.debug("Resolved {} of {} requested sessions", resolved.size(), sessionIds.size());
        }
        return Collections.unmodifiableMap(resolved);
    }

    public int sweepExpired() {
        return this.sweepExpired(this.clock.instant(), this.timeout);
    }

    /**
     * Removes every session idle for longer than {@code timeout} as of {@code now}.
     * Idempotent and safe to call before every read path.
     *
     * @return number of sessions removed
     */
    public int sweepExpired(Instant now, Duration timeout) {
        List<String> expired = new ArrayList<>();
        synchronized (this.lock) {
            Iterator<Session> it = this.sessions.values().iterator();
            while (it.hasNext()) {
                Session session = it.next();
                if (Duration.between(session.lastAccessed, now).compareTo(timeout) > 0) {
                    expired.add(session.id);
                    it.remove();
                }
            }
        }
        if (!expired.isEmpty()) {
            log.info("Cleaned up {} expired session(s)", expired.size());
        }
        return expired.size();
    }

    /**
     * Explicit removal. Deleting an unknown or already deleted id is a no-op.
     *
     * @return whether a session was actually removed
     */
    public boolean deleteSession(String sessionId) {
        Session removed;
        synchronized (this.lock) {
            removed = sessionId == null ? null : this.sessions.remove(sessionId);
        }
        if (removed != null) {
            log.info("Session deleted: {}", sessionId);
        }
        return removed != null;
    }

    /**
     * Read-only view of the live sessions. Does not refresh last-access times.
     */
    public List<SessionSummary> listSessions() {
        synchronized (this.lock) {
            List<SessionSummary> summaries = new ArrayList<>(this.sessions.size());
            for (Session session : this.sessions.values()) {
                int chunkCount = session.indices.stream().mapToInt(RetrievalIndex::size).sum();
                summaries.add(new SessionSummary(session.id, session.label, session.indices.size(), chunkCount, session.createdAt, session.lastAccessed));
            }
            return summaries;
        }
    }

    public int size() {
        synchronized (this.lock) {
            return this.sessions.size();
        }
    }

    private static final class Session {
        private final String id;
        private final String label;
        private final Instant createdAt;
        private final List<RetrievalIndex> indices = new ArrayList<>();
        private Instant lastAccessed;

        private Session(String id, String label, RetrievalIndex first, Instant createdAt) {
            this.id = id;
            this.label = label;
            this.createdAt = createdAt;
            this.lastAccessed = createdAt;
            this.indices.add(first);
        }
    }
}
