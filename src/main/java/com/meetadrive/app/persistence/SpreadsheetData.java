package com.meetadrive.app.persistence;

import java.util.ArrayList;
import java.util.List;

/**
 * The "data" part of a record: the sheets and which one is active.
 */
public class SpreadsheetData {
    private String activeSheet;
    private List<SheetRecord> sheets = new ArrayList<>();

    public String getActiveSheet() {
        return activeSheet;
    }

    public void setActiveSheet(String activeSheet) {
        this.activeSheet = activeSheet;
    }

    public List<SheetRecord> getSheets() {
        return sheets;
    }

    public void setSheets(List<SheetRecord> sheets) {
        this.sheets = sheets;
    }
}
