package com.meetadrive.app.services;

import com.meetadrive.app.config.StorageProperties;
import com.meetadrive.app.exceptions.CorruptRecordException;
import com.meetadrive.app.exceptions.DocumentNameRequiredException;
import com.meetadrive.app.exceptions.DocumentNotFoundException;
import com.meetadrive.app.exceptions.PersistenceException;
import com.meetadrive.app.models.Document;
import com.meetadrive.app.models.DocumentIdentity;
import com.meetadrive.app.models.DocumentSummary;
import com.meetadrive.app.persistence.DocumentRecord;
import com.meetadrive.app.persistence.DocumentRecordMapper;
import com.meetadrive.app.persistence.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Saves documents to, and loads them from, the document store.
 * A save either fully succeeds or leaves the document untouched.
 * Loaded documents always have their formulas re-evaluated.
 */
@Service
public class PersistenceService {

    private static final Logger logger = LoggerFactory.getLogger(PersistenceService.class);

    private final DocumentStore documentStore;
    private final DocumentService documentService;
    private final Clock clock;
    private final long userId;

    public PersistenceService(DocumentStore documentStore, DocumentService documentService,
                              Clock clock, StorageProperties storageProperties) {
        this.documentStore = documentStore;
        this.documentService = documentService;
        this.clock = clock;
        this.userId = storageProperties.getUserId();
    }

    /**
     * Saves the document under the given name (or its current name if none is given).
     * The first save assigns a new ID; later saves reuse it and keep createdAt.
     * On success the document is clean; on failure it is left exactly as it was.
     */
    public DocumentSummary save(Document document, String name) {
        DocumentIdentity current = document.getIdentity();
        String resolvedName = name != null && !name.isBlank() ? name
                : current != null ? current.getName() : null;
        if (resolvedName == null) {
            throw new DocumentNameRequiredException("A name is required to save a new document");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        DocumentIdentity next = current == null
                ? new DocumentIdentity(UUID.randomUUID().toString(), resolvedName, now, now)
                : new DocumentIdentity(current.getId(), resolvedName, current.getCreatedAt(), now);

        DocumentRecord record = DocumentRecordMapper.toRecord(document, next, userId);
        try {
            documentStore.write(record);
        } catch (PersistenceException e) {
            logger.error("Error saving document '{}' ({}): {}", resolvedName, next.getId(), e.getMessage());
            throw e;
        }

        document.setIdentity(next);
        document.markClean();
        logger.info("Saved document '{}' as {}", resolvedName, next.getId());
        return new DocumentSummary(next.getId(), resolvedName);
    }

    /**
     * Reads a document by ID and re-evaluates every formula in it.
     * Returns a new, clean document; the caller decides whether to swap it in.
     */
    public Document load(String id) {
        Document document;
        try {
            DocumentRecord record = documentStore.read(id);
            if (record.getId() == null) {
                record.setId(id);
            }
            document = DocumentRecordMapper.fromRecord(record);
        } catch (DocumentNotFoundException | CorruptRecordException | PersistenceException e) {
            logger.warn("Error loading document {}: {}", id, e.getMessage());
            throw e;
        }
        documentService.evaluateAll(document);
        document.markClean();
        logger.info("Loaded document '{}' ({}) with {} sheet(s)",
                document.getIdentity().getName(), id, document.getSheets().size());
        return document;
    }

    /**
     * All persisted documents; unreadable records are left out.
     */
    public List<DocumentSummary> listAvailable() {
        return documentStore.list();
    }
}
