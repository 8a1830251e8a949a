package com.meetadrive.app.models;

/**
 * ID and display name of a persisted document, as listed in the "Open" menu.
 */
public class DocumentSummary {
    private String id;
    private String name;

    // Default constructor needed for JSON deserialization
    public DocumentSummary() {
    }

    public DocumentSummary(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setId(String id) {
        this.id = id;
    }

    public void setName(String name) {
        this.name = name;
    }
}
