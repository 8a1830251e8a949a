package com.meetadrive.app.models;

import java.util.*;

/**
 * An entire spreadsheet document:
 * - an ordered, never empty list of Sheets
 * - the ID of the active sheet, always one of those sheets
 * - its identity once saved (null before the first save)
 * - a dirty flag: true when it differs from the last saved/loaded state
 */
public class Document {

    public static final String DEFAULT_SHEET_ID = "sheet1";
    public static final String DEFAULT_SHEET_NAME = "Sheet1";

    private final List<Sheet> sheets = new ArrayList<>();
    private String activeSheetId;
    private DocumentIdentity identity;
    private boolean dirty;

    /**
     * Builds a document from existing sheets. Falls back to the first sheet
     * when activeSheetId does not name one of them.
     */
    public Document(List<Sheet> sheets, String activeSheetId) {
        if (sheets == null || sheets.isEmpty()) {
            throw new IllegalArgumentException("A document needs at least one sheet");
        }
        this.sheets.addAll(sheets);
        this.activeSheetId = findSheet(activeSheetId) != null ? activeSheetId : sheets.get(0).getId();
    }

    /**
     * A new, clean document with one default sheet.
     */
    public static Document createDefault() {
        return new Document(Collections.singletonList(new Sheet(DEFAULT_SHEET_ID, DEFAULT_SHEET_NAME)),
                DEFAULT_SHEET_ID);
    }

    public List<Sheet> getSheets() {
        return Collections.unmodifiableList(sheets);
    }

    /**
     * Retrieves the sheet with the given ID, or null.
     */
    public Sheet findSheet(String sheetId) {
        for (Sheet sheet : sheets) {
            if (sheet.getId().equals(sheetId)) {
                return sheet;
            }
        }
        return null;
    }

    public void addSheet(Sheet sheet) {
        sheets.add(sheet);
    }

    public void removeSheet(Sheet sheet) {
        if (sheets.size() <= 1) {
            throw new IllegalStateException("Cannot remove the last sheet");
        }
        sheets.remove(sheet);
        if (sheet.getId().equals(activeSheetId)) {
            activeSheetId = sheets.get(0).getId();
        }
    }

    public String getActiveSheetId() {
        return activeSheetId;
    }

    public void setActiveSheetId(String activeSheetId) {
        if (findSheet(activeSheetId) == null) {
            throw new IllegalArgumentException("No sheet with ID " + activeSheetId);
        }
        this.activeSheetId = activeSheetId;
    }

    public DocumentIdentity getIdentity() {
        return identity;
    }

    public void setIdentity(DocumentIdentity identity) {
        this.identity = identity;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markDirty() {
        this.dirty = true;
    }

    public void markClean() {
        this.dirty = false;
    }
}
