package com.meetadrive.app.models;

/**
 * ID and display name of a sheet, as listed to the sheet tabs.
 */
public class SheetSummary {
    private String id;
    private String name;

    // Default constructor needed for JSON deserialization
    public SheetSummary() {
    }

    public SheetSummary(String id, String name) {
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
