package com.meetadrive.app.controllers;

/**
 * Body of POST /sessions/{sessionId}/save: { "name": "Budget" }.
 * The name may be omitted when re-saving a document that already has one.
 */
public class SaveRequest {
    private String name;

    public SaveRequest() {
    }

    public SaveRequest(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
