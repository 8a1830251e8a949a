package com.meetadrive.app.persistence;

import com.meetadrive.app.exceptions.CorruptRecordException;
import com.meetadrive.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between in-memory documents and their persisted records.
 */
public final class DocumentRecordMapper {

    private static final Logger logger = LoggerFactory.getLogger(DocumentRecordMapper.class);

    private DocumentRecordMapper() {
    }

    /**
     * Snapshots every sheet and cell of the document under the given identity.
     */
    public static DocumentRecord toRecord(Document document, DocumentIdentity identity, long userId) {
        SpreadsheetData data = new SpreadsheetData();
        data.setActiveSheet(document.getActiveSheetId());
        for (Sheet sheet : document.getSheets()) {
            data.getSheets().add(toSheetRecord(sheet));
        }

        DocumentRecord record = new DocumentRecord();
        record.setId(identity.getId());
        record.setName(identity.getName());
        record.setData(data);
        record.setCreatedAt(identity.getCreatedAt());
        record.setUpdatedAt(identity.getUpdatedAt());
        record.setUserId(userId);
        return record;
    }

    /**
     * Rebuilds a document from a record. Cached values in the record are
     * dropped; the caller re-evaluates formulas. The result is clean.
     */
    public static Document fromRecord(DocumentRecord record) {
        SpreadsheetData data = record.getData();
        if (data == null || data.getSheets() == null || data.getSheets().isEmpty()) {
            throw new CorruptRecordException("Document " + record.getId() + " has no sheets");
        }

        List<Sheet> sheets = new ArrayList<>();
        for (SheetRecord sheetRecord : data.getSheets()) {
            if (sheetRecord == null || sheetRecord.getId() == null) {
                throw new CorruptRecordException("Document " + record.getId() + " has a sheet without an id");
            }
            sheets.add(fromSheetRecord(sheetRecord));
        }

        Document document = new Document(sheets, data.getActiveSheet());
        document.setIdentity(new DocumentIdentity(
                record.getId(), record.getName(), record.getCreatedAt(), record.getUpdatedAt()));
        document.markClean();
        return document;
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private static SheetRecord toSheetRecord(Sheet sheet) {
        SheetRecord sheetRecord = new SheetRecord();
        sheetRecord.setId(sheet.getId());
        sheetRecord.setName(sheet.getName());
        Map<String, CellRecord> cells = new LinkedHashMap<>();
        for (Map.Entry<String, Cell> entry : sheet.getCells().entrySet()) {
            Cell cell = entry.getValue();
            Object cached = cell.getCachedValue() != null ? cell.getCachedValue().toValue() : null;
            cells.put(entry.getKey(), new CellRecord(cell.getValue(), cell.getFormula(), cached));
        }
        sheetRecord.setCells(cells);
        sheetRecord.setColumns(new LinkedHashMap<>(sheet.getColumns()));
        sheetRecord.setRows(new LinkedHashMap<>(sheet.getRows()));
        return sheetRecord;
    }

    private static Sheet fromSheetRecord(SheetRecord sheetRecord) {
        Sheet sheet = new Sheet(sheetRecord.getId(),
                sheetRecord.getName() != null ? sheetRecord.getName() : sheetRecord.getId());
        if (sheetRecord.getCells() != null) {
            for (Map.Entry<String, CellRecord> entry : sheetRecord.getCells().entrySet()) {
                if (!CellAddress.isValid(entry.getKey())) {
                    logger.warn("Dropping cell with invalid reference '{}' in sheet {}", entry.getKey(), sheet.getId());
                    continue;
                }
                CellRecord cellRecord = entry.getValue();
                if (cellRecord == null) {
                    continue;
                }
                // Formula wins over value, as in the display rule
                Cell cell = cellRecord.getFormula() != null && !cellRecord.getFormula().isEmpty()
                        ? Cell.formula(cellRecord.getFormula(), null)
                        : Cell.literal(cellRecord.getValue());
                sheet.putCell(CellAddress.parse(entry.getKey()).toReference(), cell);
            }
        }
        if (sheetRecord.getColumns() != null) {
            sheet.getColumns().putAll(sheetRecord.getColumns());
        }
        if (sheetRecord.getRows() != null) {
            sheet.getRows().putAll(sheetRecord.getRows());
        }
        return sheet;
    }
}
