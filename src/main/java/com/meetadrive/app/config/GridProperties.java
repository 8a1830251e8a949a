package com.meetadrive.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * "meeta.grid.*": size of the window served when the grid asks
 * for no particular size, and the largest window it may ask for.
 */
@ConfigurationProperties(prefix = "meeta.grid")
public class GridProperties {
    private int rows = 20;
    private int columns = 10;
    private int maxRows = 1000;
    private int maxColumns = 100;

    public int getRows() {
        return rows;
    }

    public void setRows(int rows) {
        this.rows = rows;
    }

    public int getColumns() {
        return columns;
    }

    public void setColumns(int columns) {
        this.columns = columns;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public void setMaxColumns(int maxColumns) {
        this.maxColumns = maxColumns;
    }
}
