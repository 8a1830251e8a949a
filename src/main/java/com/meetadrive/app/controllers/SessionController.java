package com.meetadrive.app.controllers;

import com.meetadrive.app.config.GridProperties;
import com.meetadrive.app.models.*;
import com.meetadrive.app.services.DocumentService;
import com.meetadrive.app.services.SessionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for editing the document of a session.
 * "/sessions" is the base path.
 */
@RestController
@RequestMapping("/sessions")
public class SessionController {

    @Autowired
    private SessionService sessionService;

    @Autowired
    private DocumentService documentService;

    @Autowired
    private GridProperties gridProperties;

    /**
     * POST /sessions
     * Opens a session on a new, empty document.
     * Returns { "sessionId": "..." }.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> openSession() {
        String sessionId = sessionService.openSession();
        return ResponseEntity.ok(Collections.singletonMap("sessionId", sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> closeSession(@PathVariable String sessionId) {
        sessionService.closeSession(sessionId);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sessions/{sessionId}
     * Returns whether the document is modified, its saved identity and the active sheet.
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<DocumentStatus> getStatus(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.read(sessionId, DocumentStatus::of));
    }

    /**
     * POST /sessions/{sessionId}/new
     * Discards the current document and starts an empty one.
     */
    @PostMapping("/{sessionId}/new")
    public ResponseEntity<Void> newDocument(@PathVariable String sessionId) {
        sessionService.newDocument(sessionId);
        return ResponseEntity.ok().build();
    }

    // ------------------------
    // Sheets
    // ------------------------

    @GetMapping("/{sessionId}/sheets")
    public ResponseEntity<List<SheetSummary>> listSheets(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.read(sessionId, documentService::listSheets));
    }

    /**
     * POST /sessions/{sessionId}/sheets
     * Appends a sheet and makes it active. Returns its ID and name.
     */
    @PostMapping("/{sessionId}/sheets")
    public ResponseEntity<SheetSummary> addSheet(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.write(sessionId, documentService::addSheet));
    }

    /**
     * DELETE /sessions/{sessionId}/sheets/{sheetId}
     * Removing the only sheet is accepted and does nothing.
     */
    @DeleteMapping("/{sessionId}/sheets/{sheetId}")
    public ResponseEntity<Void> removeSheet(@PathVariable String sessionId, @PathVariable String sheetId) {
        sessionService.update(sessionId, document -> documentService.removeSheet(document, sheetId));
        return ResponseEntity.ok().build();
    }

    @PutMapping("/{sessionId}/sheets/{sheetId}/name")
    public ResponseEntity<Void> renameSheet(
            @PathVariable String sessionId,
            @PathVariable String sheetId,
            @RequestBody String name
    ) {
        sessionService.update(sessionId, document -> documentService.renameSheet(document, sheetId, name));
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{sessionId}/active-sheet")
    public ResponseEntity<String> getActiveSheet(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.read(sessionId, documentService::activeSheetId));
    }

    @PutMapping("/{sessionId}/active-sheet")
    public ResponseEntity<Void> setActiveSheet(@PathVariable String sessionId, @RequestBody String sheetId) {
        sessionService.update(sessionId, document -> documentService.setActiveSheet(document, sheetId.trim()));
        return ResponseEntity.ok().build();
    }

    /**
     * GET /sessions/{sessionId}/sheets/{sheetId}
     * Returns display values of all non-empty cells: { "A1": "5", "A2": "5.0", ... }.
     */
    @GetMapping("/{sessionId}/sheets/{sheetId}")
    public ResponseEntity<Map<String, String>> getSheetValues(
            @PathVariable String sessionId,
            @PathVariable String sheetId
    ) {
        return ResponseEntity.ok(sessionService.read(sessionId,
                document -> documentService.sheetValues(document, sheetId)));
    }

    /**
     * GET /sessions/{sessionId}/sheets/{sheetId}/grid?rows=20&columns=10
     * Returns display values of the top-left window, one list per row.
     * Windows larger than meeta.grid.max-rows x max-columns are rejected with 400.
     */
    @GetMapping("/{sessionId}/sheets/{sheetId}/grid")
    public ResponseEntity<List<List<String>>> getGrid(
            @PathVariable String sessionId,
            @PathVariable String sheetId,
            @RequestParam(required = false) Integer rows,
            @RequestParam(required = false) Integer columns
    ) {
        int rowCount = rows != null ? rows : gridProperties.getRows();
        int columnCount = columns != null ? columns : gridProperties.getColumns();
        if (rowCount > gridProperties.getMaxRows() || columnCount > gridProperties.getMaxColumns()) {
            throw new IllegalArgumentException("Grid window " + rowCount + "x" + columnCount
                    + " exceeds the maximum of " + gridProperties.getMaxRows() + "x" + gridProperties.getMaxColumns());
        }
        return ResponseEntity.ok(sessionService.read(sessionId,
                document -> documentService.grid(document, sheetId, rowCount, columnCount)));
    }

    // ------------------------
    // Cells
    // ------------------------

    @GetMapping("/{sessionId}/sheets/{sheetId}/cells/{reference}")
    public ResponseEntity<CellView> getCell(
            @PathVariable String sessionId,
            @PathVariable String sheetId,
            @PathVariable String reference
    ) {
        return ResponseEntity.ok(sessionService.read(sessionId,
                document -> new CellView(reference, documentService.getCell(document, sheetId, reference))));
    }

    /**
     * PUT /sessions/{sessionId}/sheets/{sheetId}/cells/{reference}
     * Body: what the user typed. "=..." is stored as a formula, anything else
     * as a literal; an empty body clears the cell.
     */
    @PutMapping("/{sessionId}/sheets/{sheetId}/cells/{reference}")
    public ResponseEntity<CellView> setCellInput(
            @PathVariable String sessionId,
            @PathVariable String sheetId,
            @PathVariable String reference,
            @RequestBody(required = false) String input
    ) {
        String text = input != null ? input : "";
        return ResponseEntity.ok(sessionService.write(sessionId, document -> {
            documentService.setCellInput(document, sheetId, reference, text);
            return new CellView(reference, documentService.getCell(document, sheetId, reference));
        }));
    }

    /**
     * PATCH /sessions/{sessionId}/sheets/{sheetId}/cells/{reference}
     * Body: a partial update such as { "formula": "=SUM(A1:A3)", "value": null }.
     * Fields left out are not touched; fields set to null are cleared.
     */
    @PatchMapping("/{sessionId}/sheets/{sheetId}/cells/{reference}")
    public ResponseEntity<CellView> updateCell(
            @PathVariable String sessionId,
            @PathVariable String sheetId,
            @PathVariable String reference,
            @RequestBody CellUpdate update
    ) {
        return ResponseEntity.ok(sessionService.write(sessionId, document -> {
            documentService.setCell(document, sheetId, reference, update);
            return new CellView(reference, documentService.getCell(document, sheetId, reference));
        }));
    }

    // ------------------------
    // Persistence
    // ------------------------

    /**
     * POST /sessions/{sessionId}/save
     * Body: { "name": "Budget" }. Returns the document's ID and name.
     * On failure the document stays modified and a 500 with a message is returned.
     */
    @PostMapping("/{sessionId}/save")
    public ResponseEntity<DocumentSummary> save(
            @PathVariable String sessionId,
            @RequestBody(required = false) SaveRequest request
    ) {
        String name = request != null ? request.getName() : null;
        return ResponseEntity.ok(sessionService.save(sessionId, name));
    }

    /**
     * POST /sessions/{sessionId}/load/{documentId}
     * Replaces the session's document with the saved one.
     */
    @PostMapping("/{sessionId}/load/{documentId}")
    public ResponseEntity<DocumentStatus> load(@PathVariable String sessionId, @PathVariable String documentId) {
        sessionService.load(sessionId, documentId);
        return ResponseEntity.ok(sessionService.read(sessionId, DocumentStatus::of));
    }
}
