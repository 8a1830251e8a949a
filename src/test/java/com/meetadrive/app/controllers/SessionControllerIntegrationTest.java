package com.meetadrive.app.controllers;

import com.meetadrive.app.AppApplication;
import com.meetadrive.app.models.CellView;
import com.meetadrive.app.models.DocumentStatus;
import com.meetadrive.app.models.DocumentSummary;
import com.meetadrive.app.models.SheetSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = AppApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SessionControllerIntegrationTest {

    @LocalServerPort
    int port;

    // JDK client, because the default one cannot send PATCH
    private final RestTemplate restTemplate = new RestTemplate(new JdkClientHttpRequestFactory());

    private String sessionUrl;

    @BeforeEach
    void openSession() {
        ResponseEntity<Map> response = restTemplate.postForEntity(url("/sessions"), null, Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        sessionUrl = url("/sessions/" + response.getBody().get("sessionId"));
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    private HttpEntity<String> text(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        return new HttpEntity<>(body, headers);
    }

    private HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private void putCell(String sheetId, String reference, String input) {
        restTemplate.put(sessionUrl + "/sheets/" + sheetId + "/cells/" + reference, text(input));
    }

    private CellView getCell(String sheetId, String reference) {
        return restTemplate.getForObject(sessionUrl + "/sheets/" + sheetId + "/cells/" + reference, CellView.class);
    }

    private DocumentStatus status() {
        return restTemplate.getForObject(sessionUrl, DocumentStatus.class);
    }

    @Test
    void testFormulaEvaluationOverHttp() {
        putCell("sheet1", "A1", "1");
        putCell("sheet1", "A2", "2");
        putCell("sheet1", "B1", "x");
        putCell("sheet1", "C1", "=SUM(A1:B2)");

        CellView c1 = getCell("sheet1", "C1");
        assertEquals("=SUM(A1:B2)", c1.getInput());
        assertEquals("3.0", c1.getDisplay());

        // Editing any cell refreshes the formula
        putCell("sheet1", "B2", "4");
        assertEquals("7.0", getCell("sheet1", "C1").getDisplay());

        putCell("sheet1", "D1", "=AVERAGE(A1,A2)");
        assertEquals("AVERAGE(A1,A2)", getCell("sheet1", "D1").getDisplay());

        ResponseEntity<Map> values = restTemplate.getForEntity(sessionUrl + "/sheets/sheet1", Map.class);
        assertEquals("1", values.getBody().get("A1"));
        assertEquals("7.0", values.getBody().get("C1"));
        assertFalse(values.getBody().containsKey("Z9"));
    }

    @Test
    void testPartialUpdateClearsTheOtherField() {
        putCell("sheet1", "A1", "5");

        ResponseEntity<CellView> response = restTemplate.exchange(
                sessionUrl + "/sheets/sheet1/cells/A1", HttpMethod.PATCH,
                json("{\"formula\": \"=SUM(A2:A3)\", \"value\": null}"), CellView.class);
        assertEquals("=SUM(A2:A3)", response.getBody().getInput());
        assertEquals("0.0", response.getBody().getDisplay());

        response = restTemplate.exchange(
                sessionUrl + "/sheets/sheet1/cells/A1", HttpMethod.PATCH,
                json("{\"value\": \"hello\", \"formula\": null}"), CellView.class);
        assertEquals("hello", response.getBody().getDisplay());
        assertEquals("hello", response.getBody().getInput());
    }

    @Test
    void testGridWindow() {
        putCell("sheet1", "B2", "hi");
        ResponseEntity<List> grid = restTemplate.getForEntity(sessionUrl + "/sheets/sheet1/grid", List.class);
        assertEquals(20, grid.getBody().size());
        assertEquals(10, ((List<?>) grid.getBody().get(0)).size());
        assertEquals("hi", ((List<?>) grid.getBody().get(1)).get(1));

        ResponseEntity<List> small = restTemplate.getForEntity(
                sessionUrl + "/sheets/sheet1/grid?rows=2&columns=3", List.class);
        assertEquals(Arrays.asList("", "hi", ""), small.getBody().get(1));
    }

    @Test
    void testOversizedGridIsRejected() {
        HttpClientErrorException tooManyRows = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForObject(sessionUrl + "/sheets/sheet1/grid?rows=2147483647&columns=1", String.class));
        assertEquals(HttpStatus.BAD_REQUEST, tooManyRows.getStatusCode());

        HttpClientErrorException tooManyColumns = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForObject(sessionUrl + "/sheets/sheet1/grid?rows=1&columns=101", String.class));
        assertEquals(HttpStatus.BAD_REQUEST, tooManyColumns.getStatusCode());

        // The largest allowed window is still served
        ResponseEntity<List> largest = restTemplate.getForEntity(
                sessionUrl + "/sheets/sheet1/grid?rows=1000&columns=100", List.class);
        assertEquals(1000, largest.getBody().size());
    }

    @Test
    void testSheetManagement() {
        SheetSummary added = restTemplate.postForObject(sessionUrl + "/sheets", null, SheetSummary.class);
        assertEquals("sheet2", added.getId());
        assertEquals("sheet2", status().getActiveSheet());
        assertTrue(status().isModified());

        restTemplate.put(sessionUrl + "/sheets/sheet2/name", text("Totals"));
        SheetSummary[] sheets = restTemplate.getForObject(sessionUrl + "/sheets", SheetSummary[].class);
        assertEquals(2, sheets.length);
        assertEquals("Totals", sheets[1].getName());

        restTemplate.put(sessionUrl + "/active-sheet", text("sheet1"));
        assertEquals("sheet1", restTemplate.getForObject(sessionUrl + "/active-sheet", String.class));

        restTemplate.delete(sessionUrl + "/sheets/sheet2");
        restTemplate.delete(sessionUrl + "/sheets/sheet1");
        sheets = restTemplate.getForObject(sessionUrl + "/sheets", SheetSummary[].class);
        assertEquals(1, sheets.length);
        assertEquals("sheet1", sheets[0].getId());
    }

    @Test
    void testErrorsMapToStatusCodes() {
        HttpClientErrorException badRef = assertThrows(HttpClientErrorException.class, () ->
                putCell("sheet1", "a1", "x"));
        assertEquals(HttpStatus.BAD_REQUEST, badRef.getStatusCode());
        assertTrue(badRef.getResponseBodyAsString().contains("INVALID_REFERENCE"));

        HttpClientErrorException noSheet = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.put(sessionUrl + "/active-sheet", text("sheet9")));
        assertEquals(HttpStatus.NOT_FOUND, noSheet.getStatusCode());
        assertTrue(noSheet.getResponseBodyAsString().contains("SHEET_NOT_FOUND"));

        HttpClientErrorException noSession = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForObject(url("/sessions/does-not-exist"), String.class));
        assertEquals(HttpStatus.NOT_FOUND, noSession.getStatusCode());

        HttpClientErrorException noDocument = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForObject(sessionUrl + "/load/does-not-exist", null, String.class));
        assertEquals(HttpStatus.NOT_FOUND, noDocument.getStatusCode());

        HttpClientErrorException noName = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForObject(sessionUrl + "/save", json("{}"), String.class));
        assertEquals(HttpStatus.BAD_REQUEST, noName.getStatusCode());
    }

    @Test
    void testSaveListAndLoad() {
        putCell("sheet1", "A1", "2");
        putCell("sheet1", "A2", "4");
        putCell("sheet1", "A3", "=AVERAGE(A1:A2)");

        DocumentSummary saved = restTemplate.postForObject(sessionUrl + "/save",
                json("{\"name\": \"Integration\"}"), DocumentSummary.class);
        assertNotNull(saved.getId());
        assertFalse(status().isModified());
        assertEquals("Integration", status().getName());

        DocumentSummary[] available = restTemplate.getForObject(url("/documents"), DocumentSummary[].class);
        assertTrue(Arrays.stream(available).anyMatch(d -> d.getId().equals(saved.getId())));

        // Start over, then open the saved document again
        restTemplate.postForObject(sessionUrl + "/new", null, Void.class);
        assertEquals("", getCell("sheet1", "A3").getDisplay());
        assertNull(status().getDocumentId());

        DocumentStatus loaded = restTemplate.postForObject(sessionUrl + "/load/" + saved.getId(), null,
                DocumentStatus.class);
        assertEquals(saved.getId(), loaded.getDocumentId());
        assertFalse(loaded.isModified());
        assertEquals("3.0", getCell("sheet1", "A3").getDisplay());

        // Re-saving keeps the same ID
        putCell("sheet1", "A1", "8");
        DocumentSummary resaved = restTemplate.postForObject(sessionUrl + "/save", json("{}"),
                DocumentSummary.class);
        assertEquals(saved.getId(), resaved.getId());
        assertEquals("Integration", resaved.getName());
    }
}
