package com.meetadrive.app.services;

import com.meetadrive.app.config.SessionProperties;
import com.meetadrive.app.exceptions.SessionNotFoundException;
import com.meetadrive.app.models.Document;
import com.meetadrive.app.models.DocumentSession;
import com.meetadrive.app.models.DocumentSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Keeps one document per editing session and runs operations against it
 * under the session's lock: reads share the lock, edits/save/load are exclusive.
 * Sessions unused for longer than meeta.session.idle-timeout are dropped
 * whenever a new session is opened.
 */
@Service
public class SessionService {

    private static final Logger logger = LoggerFactory.getLogger(SessionService.class);

    // All sessions live here in memory
    private final Map<String, DocumentSession> sessions = new ConcurrentHashMap<>();

    private final DocumentService documentService;
    private final PersistenceService persistenceService;
    private final Clock clock;
    private final SessionProperties properties;

    public SessionService(DocumentService documentService, PersistenceService persistenceService,
                          Clock clock, SessionProperties properties) {
        this.documentService = documentService;
        this.persistenceService = persistenceService;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Opens a session on a new, empty document and returns the session ID.
     */
    public String openSession() {
        evictIdleSessions();
        String id = UUID.randomUUID().toString();
        sessions.put(id, new DocumentSession(id, documentService.newDocument(), clock.instant()));
        logger.info("Opened session {}", id);
        return id;
    }

    public void closeSession(String sessionId) {
        if (sessions.remove(sessionId) == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        logger.info("Closed session {}", sessionId);
    }

    /**
     * Retrieves a session by ID. Throws if not found.
     */
    public DocumentSession getSession(String sessionId) {
        DocumentSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException("Session not found: " + sessionId);
        }
        session.touch(clock.instant());
        return session;
    }

    /**
     * Drops every session whose last access is older than the idle timeout.
     * Returns how many were dropped.
     */
    public int evictIdleSessions() {
        Instant cutoff = clock.instant().minus(properties.getIdleTimeout());
        int evicted = 0;
        Iterator<DocumentSession> iterator = sessions.values().iterator();
        while (iterator.hasNext()) {
            DocumentSession session = iterator.next();
            if (session.getLastAccess().isBefore(cutoff)) {
                iterator.remove();
                evicted++;
                logger.info("Dropped idle session {}, last used {}", session.getId(), session.getLastAccess());
            }
        }
        return evicted;
    }

    public <T> T read(String sessionId, Function<Document, T> action) {
        DocumentSession session = getSession(sessionId);
        session.getLock().readLock().lock();
        try {
            return action.apply(session.getDocument());
        } finally {
            session.getLock().readLock().unlock();
        }
    }

    public <T> T write(String sessionId, Function<Document, T> action) {
        DocumentSession session = getSession(sessionId);
        session.getLock().writeLock().lock();
        try {
            return action.apply(session.getDocument());
        } finally {
            session.getLock().writeLock().unlock();
        }
    }

    public void update(String sessionId, Consumer<Document> action) {
        write(sessionId, document -> {
            action.accept(document);
            return null;
        });
    }

    /**
     * Replaces the session's document with a new, empty one.
     */
    public void newDocument(String sessionId) {
        replace(sessionId, documentService.newDocument());
    }

    public DocumentSummary save(String sessionId, String name) {
        return write(sessionId, document -> persistenceService.save(document, name));
    }

    /**
     * Loads a persisted document into the session. If loading fails the
     * session keeps its current document.
     */
    public void load(String sessionId, String documentId) {
        DocumentSession session = getSession(sessionId);
        session.getLock().writeLock().lock();
        try {
            session.replaceDocument(persistenceService.load(documentId));
        } finally {
            session.getLock().writeLock().unlock();
        }
    }

    private void replace(String sessionId, Document document) {
        DocumentSession session = getSession(sessionId);
        session.getLock().writeLock().lock();
        try {
            session.replaceDocument(document);
        } finally {
            session.getLock().writeLock().unlock();
        }
    }
}
