package com.meetadrive.app.persistence;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted form of one sheet.
 */
public class SheetRecord {
    private String id;
    private String name;
    private Map<String, CellRecord> cells = new LinkedHashMap<>();
    private Map<String, Object> columns = new LinkedHashMap<>();
    private Map<String, Object> rows = new LinkedHashMap<>();

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

    public Map<String, CellRecord> getCells() {
        return cells;
    }

    public void setCells(Map<String, CellRecord> cells) {
        this.cells = cells;
    }

    public Map<String, Object> getColumns() {
        return columns;
    }

    public void setColumns(Map<String, Object> columns) {
        this.columns = columns;
    }

    public Map<String, Object> getRows() {
        return rows;
    }

    public void setRows(Map<String, Object> rows) {
        this.rows = rows;
    }
}
