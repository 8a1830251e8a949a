package com.meetadrive.app.controllers;

import com.meetadrive.app.models.DocumentSummary;
import com.meetadrive.app.services.PersistenceService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoints for saved documents.
 * "/documents" is the base path.
 */
@RestController
@RequestMapping("/documents")
public class DocumentController {

    @Autowired
    private PersistenceService persistenceService;

    /**
     * GET /documents
     * Lists the ID and name of every saved document that can be read.
     */
    @GetMapping
    public ResponseEntity<List<DocumentSummary>> listAvailable() {
        return ResponseEntity.ok(persistenceService.listAvailable());
    }
}
