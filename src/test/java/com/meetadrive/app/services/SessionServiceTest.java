package com.meetadrive.app.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetadrive.app.config.SessionProperties;
import com.meetadrive.app.config.StorageProperties;
import com.meetadrive.app.exceptions.DocumentNotFoundException;
import com.meetadrive.app.exceptions.SessionNotFoundException;
import com.meetadrive.app.models.Document;
import com.meetadrive.app.persistence.FileDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionServiceTest {

    @TempDir
    Path tempDir;

    private SessionService sessionService;
    private DocumentService documentService;

    @BeforeEach
    void setUp() {
        documentService = new DocumentService(new FormulaEvaluator());
        PersistenceService persistenceService = new PersistenceService(
                new FileDocumentStore(new ObjectMapper(), tempDir), documentService,
                Clock.systemDefaultZone(), new StorageProperties());
        sessionService = new SessionService(documentService, persistenceService,
                Clock.systemDefaultZone(), new SessionProperties());
    }

    @Test
    void testSessionsOwnIndependentDocuments() {
        String first = sessionService.openSession();
        String second = sessionService.openSession();

        sessionService.update(first, document -> documentService.setCellInput(document, "sheet1", "A1", "one"));

        assertEquals("one", sessionService.read(first,
                document -> documentService.displayValue(document, "sheet1", "A1")));
        assertEquals("", sessionService.read(second,
                document -> documentService.displayValue(document, "sheet1", "A1")));
    }

    @Test
    void testUnknownOrClosedSession() {
        assertThrows(SessionNotFoundException.class, () -> sessionService.getSession("nope"));

        String id = sessionService.openSession();
        sessionService.closeSession(id);
        assertThrows(SessionNotFoundException.class, () -> sessionService.read(id, Document::isDirty));
        assertThrows(SessionNotFoundException.class, () -> sessionService.closeSession(id));
    }

    @Test
    void testNewDocumentReplacesEverything() {
        String id = sessionService.openSession();
        sessionService.update(id, document -> {
            documentService.setCellInput(document, "sheet1", "A1", "x");
            documentService.addSheet(document);
        });
        sessionService.newDocument(id);

        assertEquals(1, sessionService.read(id, documentService::listSheets).size());
        assertFalse(sessionService.read(id, Document::isDirty));
        assertEquals("", sessionService.read(id,
                document -> documentService.displayValue(document, "sheet1", "A1")));
    }

    @Test
    void testSaveThenLoadIntoAnotherSession() {
        String author = sessionService.openSession();
        sessionService.update(author, document -> {
            documentService.setCellInput(document, "sheet1", "A1", "2");
            documentService.setCellInput(document, "sheet1", "A2", "=SUM(A1:A1)");
        });
        String documentId = sessionService.save(author, "Shared").getId();
        assertFalse(sessionService.read(author, Document::isDirty));

        String reader = sessionService.openSession();
        sessionService.load(reader, documentId);

        assertEquals("2.0", sessionService.read(reader,
                document -> documentService.displayValue(document, "sheet1", "A2")));
        assertEquals(documentId, sessionService.read(reader, document -> document.getIdentity().getId()));
    }

    @Test
    void testFailedLoadKeepsCurrentDocument() {
        String id = sessionService.openSession();
        sessionService.update(id, document -> documentService.setCellInput(document, "sheet1", "A1", "keep me"));

        assertThrows(DocumentNotFoundException.class, () -> sessionService.load(id, "missing"));

        assertEquals("keep me", sessionService.read(id,
                document -> documentService.displayValue(document, "sheet1", "A1")));
        assertTrue(sessionService.read(id, Document::isDirty));
    }

    /**
     * Two threads editing different cells of the same session
     * must both land.
     */
    @Test
    void testConcurrentEditsOnOneSession() throws InterruptedException {
        String id = sessionService.openSession();
        Runnable task1 = () -> {
            for (int i = 1; i <= 200; i++) {
                int row = i;
                sessionService.update(id, document ->
                        documentService.setCellInput(document, "sheet1", "A" + row, "1"));
            }
        };
        Runnable task2 = () -> {
            for (int i = 1; i <= 200; i++) {
                int row = i;
                sessionService.update(id, document ->
                        documentService.setCellInput(document, "sheet1", "B" + row, "2"));
            }
        };

        Thread t1 = new Thread(task1);
        Thread t2 = new Thread(task2);
        t1.start();
        t2.start();
        t1.join();
        t2.join();

        sessionService.update(id, document ->
                documentService.setCellInput(document, "sheet1", "C1", "=SUM(A1:B200)"));
        assertEquals("600.0", sessionService.read(id,
                document -> documentService.displayValue(document, "sheet1", "C1")));
    }

    @Test
    void testIdleSessionsAreDroppedOnNextOpen() {
        Instant start = Instant.parse("2026-10-17T10:00:00Z");
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(start);
        SessionProperties properties = new SessionProperties();
        properties.setIdleTimeout(Duration.ofMinutes(30));
        PersistenceService persistenceService = new PersistenceService(
                new FileDocumentStore(new ObjectMapper(), tempDir), documentService,
                Clock.systemDefaultZone(), new StorageProperties());
        SessionService sessions = new SessionService(documentService, persistenceService, clock, properties);

        String idle = sessions.openSession();
        String active = sessions.openSession();

        when(clock.instant()).thenReturn(start.plus(Duration.ofMinutes(20)));
        sessions.update(active, document -> documentService.setCellInput(document, "sheet1", "A1", "1"));

        // idle was last used 40 minutes ago, active 20 minutes ago
        when(clock.instant()).thenReturn(start.plus(Duration.ofMinutes(40)));
        String fresh = sessions.openSession();

        assertThrows(SessionNotFoundException.class, () -> sessions.getSession(idle));
        assertEquals("1", sessions.read(active, document -> documentService.displayValue(document, "sheet1", "A1")));
        assertNotNull(sessions.getSession(fresh));
        assertEquals(0, sessions.evictIdleSessions());
    }
}
