package com.meetadrive.app.models;

import java.time.LocalDateTime;

/**
 * What a status bar shows about a session's document.
 * documentId, name and the timestamps are null until the first save.
 */
public class DocumentStatus {
    private String documentId;
    private String name;
    private boolean modified;
    private String activeSheet;
    private LocalDateTime createdAt;
    private LocalDateTime lastSaved;

    public DocumentStatus() {
    }

    public static DocumentStatus of(Document document) {
        DocumentStatus status = new DocumentStatus();
        status.modified = document.isDirty();
        status.activeSheet = document.getActiveSheetId();
        DocumentIdentity identity = document.getIdentity();
        if (identity != null) {
            status.documentId = identity.getId();
            status.name = identity.getName();
            status.createdAt = identity.getCreatedAt();
            status.lastSaved = identity.getUpdatedAt();
        }
        return status;
    }

    public String getDocumentId() {
        return documentId;
    }

    public void setDocumentId(String documentId) {
        this.documentId = documentId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isModified() {
        return modified;
    }

    public void setModified(boolean modified) {
        this.modified = modified;
    }

    public String getActiveSheet() {
        return activeSheet;
    }

    public void setActiveSheet(String activeSheet) {
        this.activeSheet = activeSheet;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getLastSaved() {
        return lastSaved;
    }

    public void setLastSaved(LocalDateTime lastSaved) {
        this.lastSaved = lastSaved;
    }
}
