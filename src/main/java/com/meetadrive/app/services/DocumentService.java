package com.meetadrive.app.services;

import com.meetadrive.app.exceptions.SheetNotFoundException;
import com.meetadrive.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Cell store operations on a document: reading and writing cells,
 * and adding, removing, renaming and activating sheets.
 * The document is always passed in by the caller; this service keeps no state.
 */
@Service
public class DocumentService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentService.class);

    private final FormulaEvaluator formulaEvaluator;

    public DocumentService(FormulaEvaluator formulaEvaluator) {
        this.formulaEvaluator = formulaEvaluator;
    }

    public Document newDocument() {
        return Document.createDefault();
    }

    /**
     * Retrieves a sheet by ID. Throws if not found.
     */
    public Sheet getSheet(Document document, String sheetId) {
        Sheet sheet = document.findSheet(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    public Cell getCell(Document document, String sheetId, String reference) {
        Sheet sheet = getSheet(document, sheetId);
        return sheet.getCell(normalize(reference));
    }

    /**
     * Applies a partial update to a cell:
     * 1) Merge the update into the stored content (formula xor literal).
     * 2) Mark the document dirty.
     * 3) If a literal or formula changed, re-evaluate every formula in the sheet.
     */
    public void setCell(Document document, String sheetId, String reference, CellUpdate update) {
        Sheet sheet = getSheet(document, sheetId);
        String key = normalize(reference);

        Cell updated = update.applyTo(sheet.getCell(key));
        sheet.putCell(key, updated);
        document.markDirty();
        logger.debug("Set {}!{} to {}", sheetId, key, updated);

        if (update.touchesContent()) {
            formulaEvaluator.refresh(sheet);
        }
    }

    /**
     * Commits a line of user input: "=..." becomes a formula, anything else a literal.
     */
    public void setCellInput(Document document, String sheetId, String reference, String input) {
        setCell(document, sheetId, reference, CellUpdate.fromInput(input));
    }

    public String displayValue(Document document, String sheetId, String reference) {
        return getCell(document, sheetId, reference).getDisplayValue();
    }

    /**
     * The text a formula bar shows for the cell.
     */
    public String cellInput(Document document, String sheetId, String reference) {
        return getCell(document, sheetId, reference).getInput();
    }

    /**
     * Returns reference -> display value for every stored cell of the sheet.
     */
    public Map<String, String> sheetValues(Document document, String sheetId) {
        Sheet sheet = getSheet(document, sheetId);
        Map<String, String> data = new LinkedHashMap<>();
        for (Map.Entry<String, Cell> entry : sheet.getCells().entrySet()) {
            data.put(entry.getKey(), entry.getValue().getDisplayValue());
        }
        return data;
    }

    /**
     * Display values of the top-left rows x columns window, row by row.
     */
    public List<List<String>> grid(Document document, String sheetId, int rows, int columns) {
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException("Grid size must be non-negative: " + rows + "x" + columns);
        }
        Sheet sheet = getSheet(document, sheetId);
        List<List<String>> grid = new ArrayList<>(rows);
        for (int row = 0; row < rows; row++) {
            List<String> line = new ArrayList<>(columns);
            for (int col = 0; col < columns; col++) {
                line.add(sheet.getCell(CellAddress.toReference(row, col)).getDisplayValue());
            }
            grid.add(line);
        }
        return grid;
    }

    /**
     * Appends a new sheet ("sheetN"/"SheetN") and makes it active.
     * N starts at the sheet count + 1 and skips IDs already in use.
     */
    public SheetSummary addSheet(Document document) {
        int number = document.getSheets().size() + 1;
        while (document.findSheet("sheet" + number) != null) {
            number++;
        }
        Sheet sheet = new Sheet("sheet" + number, "Sheet" + number);
        document.addSheet(sheet);
        document.setActiveSheetId(sheet.getId());
        document.markDirty();
        logger.debug("Added sheet {}", sheet.getId());
        return new SheetSummary(sheet.getId(), sheet.getName());
    }

    /**
     * Removes a sheet. Removing the only sheet does nothing.
     * If the active sheet is removed, the first remaining sheet becomes active.
     */
    public void removeSheet(Document document, String sheetId) {
        Sheet sheet = getSheet(document, sheetId);
        if (document.getSheets().size() <= 1) {
            logger.debug("Not removing {}: it is the only sheet", sheetId);
            return;
        }
        document.removeSheet(sheet);
        document.markDirty();
        logger.debug("Removed sheet {}, active sheet is {}", sheetId, document.getActiveSheetId());
    }

    public void renameSheet(Document document, String sheetId, String name) {
        Sheet sheet = getSheet(document, sheetId);
        sheet.setName(name);
        document.markDirty();
    }

    /**
     * Switches the active sheet. This is view state, so the document
     * does not become dirty.
     */
    public void setActiveSheet(Document document, String sheetId) {
        Sheet sheet = getSheet(document, sheetId);
        document.setActiveSheetId(sheet.getId());
    }

    public String activeSheetId(Document document) {
        return document.getActiveSheetId();
    }

    public List<SheetSummary> listSheets(Document document) {
        List<SheetSummary> summaries = new ArrayList<>();
        for (Sheet sheet : document.getSheets()) {
            summaries.add(new SheetSummary(sheet.getId(), sheet.getName()));
        }
        return summaries;
    }

    public boolean isDirty(Document document) {
        return document.isDirty();
    }

    /**
     * Re-evaluates every formula of every sheet.
     */
    public void evaluateAll(Document document) {
        for (Sheet sheet : document.getSheets()) {
            formulaEvaluator.refresh(sheet);
        }
    }

    // Canonical form of a reference, e.g. "A01" -> "A1"
    private String normalize(String reference) {
        return CellAddress.parse(reference).toReference();
    }
}
