package com.meetadrive.app.persistence;

import java.time.LocalDateTime;

/**
 * One persisted document, stored as a single JSON file:
 * {
 *   "id": "...", "name": "Budget",
 *   "data": { "activeSheet": "sheet1", "sheets": [...] },
 *   "createdAt": "2026-10-17T10:15:30", "updatedAt": "...",
 *   "userId": 1
 * }
 */
public class DocumentRecord {
    private String id;
    private String name;
    private SpreadsheetData data;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private long userId;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public SpreadsheetData getData() {
        return data;
    }

    public void setData(SpreadsheetData data) {
        this.data = data;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public long getUserId() {
        return userId;
    }

    public void setUserId(long userId) {
        this.userId = userId;
    }
}
