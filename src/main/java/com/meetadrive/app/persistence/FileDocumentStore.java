package com.meetadrive.app.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.meetadrive.app.config.StorageProperties;
import com.meetadrive.app.exceptions.CorruptRecordException;
import com.meetadrive.app.exceptions.DocumentNotFoundException;
import com.meetadrive.app.exceptions.PersistenceException;
import com.meetadrive.app.models.DocumentSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Stores each document as "<id>.json" in the configured directory.
 * Writes go to a temporary file first and are then moved into place,
 * so a failed save never leaves a half-written record behind.
 */
@Repository
public class FileDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(FileDocumentStore.class);

    private static final String EXTENSION = ".json";
    // IDs double as file names
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9_-]+$");

    private final ObjectMapper objectMapper;
    private final Path directory;

    @Autowired
    public FileDocumentStore(ObjectMapper objectMapper, StorageProperties properties) {
        this(objectMapper, Paths.get(properties.getDirectory()));
    }

    public FileDocumentStore(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void write(DocumentRecord record) {
        if (!isSafeId(record.getId())) {
            throw new IllegalArgumentException("Invalid document ID: " + record.getId());
        }
        Path target = directory.resolve(record.getId() + EXTENSION);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, record.getId() + "-", ".tmp");
            objectMapper.writeValue(temp.toFile(), record);
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new PersistenceException("Could not write document " + record.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public DocumentRecord read(String id) {
        if (!isSafeId(id)) {
            throw new DocumentNotFoundException("Document not found: " + id);
        }
        Path file = directory.resolve(id + EXTENSION);
        if (!Files.isRegularFile(file)) {
            throw new DocumentNotFoundException("Document not found: " + id);
        }
        try {
            DocumentRecord record = objectMapper.readValue(file.toFile(), DocumentRecord.class);
            if (record == null) {
                throw new CorruptRecordException("Document " + id + " is empty");
            }
            return record;
        } catch (JsonProcessingException e) {
            throw new CorruptRecordException("Document " + id + " is corrupt: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PersistenceException("Could not read document " + id + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<DocumentSummary> list() {
        List<DocumentSummary> summaries = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return summaries;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : files) {
                DocumentSummary summary = readSummary(file);
                if (summary != null) {
                    summaries.add(summary);
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Could not list documents in " + directory + ": " + e.getMessage(), e);
        }
        summaries.sort(Comparator.comparing(DocumentSummary::getName).thenComparing(DocumentSummary::getId));
        return summaries;
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private DocumentSummary readSummary(Path file) {
        try {
            DocumentRecord record = objectMapper.readValue(file.toFile(), DocumentRecord.class);
            if (record == null || record.getId() == null || record.getName() == null) {
                logger.debug("Skipping {}: no id or name", file.getFileName());
                return null;
            }
            return new DocumentSummary(record.getId(), record.getName());
        } catch (IOException e) {
            logger.debug("Skipping unreadable record {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp, IOException cause) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    private boolean isSafeId(String id) {
        return id != null && SAFE_ID.matcher(id).matches();
    }
}
