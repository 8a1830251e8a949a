package com.meetadrive.app.models;

import java.util.*;

/**
 * One tab of a document:
 * - a stable ID ("sheet1") and a display name ("Sheet1")
 * - a map of reference ("A1") -> Cell; empty cells are not stored
 * - column/row metadata kept for the presentation layer and persisted as-is
 */
public class Sheet {

    private final String id;
    private String name;
    private final Map<String, Cell> cells = new LinkedHashMap<>();
    private final Map<String, Object> columns = new LinkedHashMap<>();
    private final Map<String, Object> rows = new LinkedHashMap<>();

    public Sheet(String id, String name) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Returns the stored cell, or the empty cell if none is stored.
     */
    public Cell getCell(String reference) {
        Cell cell = cells.get(reference);
        return cell != null ? cell : Cell.empty();
    }

    public boolean hasCell(String reference) {
        return cells.containsKey(reference);
    }

    /**
     * Stores the cell, or removes the reference if the cell is empty.
     */
    public void putCell(String reference, Cell cell) {
        if (cell == null || cell.isEmpty()) {
            cells.remove(reference);
        } else {
            cells.put(reference, cell);
        }
    }

    public Map<String, Cell> getCells() {
        return Collections.unmodifiableMap(cells);
    }

    public Map<String, Object> getColumns() {
        return columns;
    }

    public Map<String, Object> getRows() {
        return rows;
    }
}
