package com.meetadrive.app.models;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One editing session: owns the document being edited and the lock
 * guarding it. "New" and "open" replace the whole document.
 */
public class DocumentSession {

    private final String id;
    private Document document;
    private volatile Instant lastAccess;

    // Serializes concurrent requests against the same document
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public DocumentSession(String id, Document document, Instant openedAt) {
        this.id = id;
        this.document = Objects.requireNonNull(document, "document");
        this.lastAccess = openedAt;
    }

    public String getId() {
        return id;
    }

    public Document getDocument() {
        return document;
    }

    public void replaceDocument(Document document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    public Instant getLastAccess() {
        return lastAccess;
    }

    public void touch(Instant now) {
        this.lastAccess = now;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
