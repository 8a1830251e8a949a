package com.meetadrive.app.persistence;

import com.meetadrive.app.models.DocumentSummary;

import java.util.List;

/**
 * Durable storage of document records, addressed by document ID.
 */
public interface DocumentStore {

    /**
     * Writes the record under its ID, replacing any previous version.
     * Either the whole record becomes visible or nothing does.
     * @throws com.meetadrive.app.exceptions.PersistenceException on write failure
     */
    void write(DocumentRecord record);

    /**
     * @throws com.meetadrive.app.exceptions.DocumentNotFoundException if no record has this ID
     * @throws com.meetadrive.app.exceptions.CorruptRecordException if the record cannot be parsed
     * @throws com.meetadrive.app.exceptions.PersistenceException on read failure
     */
    DocumentRecord read(String id);

    /**
     * Lists every readable record. Records that fail to parse are left out.
     */
    List<DocumentSummary> list();
}
