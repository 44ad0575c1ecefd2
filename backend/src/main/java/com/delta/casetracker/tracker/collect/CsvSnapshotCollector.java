package com.delta.casetracker.tracker.collect;

import com.delta.casetracker.config.TrackerProperties;
import com.delta.casetracker.tracker.model.CaseCategory;
import com.delta.casetracker.tracker.model.CaseRecord;
import com.delta.casetracker.tracker.util.PathUtils;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads a registry export in CSV form. Expected headers (case-insensitive):
 * {@code id, category, title, tags, document_count, last_movement_at}. Tags are separated by {@code ;} or {@code |}.
 */
@Service
public class CsvSnapshotCollector implements SnapshotCollector {
    private static final Logger log = LoggerFactory.getLogger(CsvSnapshotCollector.class);
    private static final Pattern TAG_SEPARATOR = Pattern.compile("[;|]");
    private static final int MAX_ERROR_SAMPLES = 10;

    private final TrackerProperties properties;

    public CsvSnapshotCollector(TrackerProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<CaseRecord> collect() {
        return collect(PathUtils.resolve(properties.getCollector().getSnapshotCsv()));
    }

    public List<CaseRecord> collect(Path csvPath) {
        if (!Files.isRegularFile(csvPath)) {
            throw new SnapshotCollectionException("Snapshot CSV not found: " + csvPath);
        }
        Map<String, CaseRecord> byId = new LinkedHashMap<>();
        ErrorCollector errors = new ErrorCollector();
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord row : parser) {
                try {
                    CaseRecord record = toRecord(row);
                    if (record == null) {
                        errors.add("row " + row.getRecordNumber() + " missing id");
                        continue;
                    }
                    if (byId.putIfAbsent(record.id(), record) != null) {
                        errors.add("row " + row.getRecordNumber() + " duplicates id " + record.id());
                    }
                } catch (IllegalArgumentException | DateTimeParseException e) {
                    errors.add("row " + row.getRecordNumber() + " invalid: " + e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new SnapshotCollectionException("Failed to read snapshot CSV " + csvPath, e);
        }
        if (errors.totalCount() > 0) {
            log.warn("Snapshot CSV {} had {} problem rows, samples={}", csvPath, errors.totalCount(), errors.sampleErrors());
        }
        log.info("Collected {} case records from {}", byId.size(), csvPath);
        return new ArrayList<>(byId.values());
    }

    private CaseRecord toRecord(CSVRecord row) {
        String id = blankToNull(getColumn(row, "id", "case_id", "process_id"));
        if (id == null) {
            return null;
        }
        return new CaseRecord(
            id,
            CaseCategory.fromRaw(getColumn(row, "category")),
            blankToNull(getColumn(row, "title")),
            parseTags(getColumn(row, "tags")),
            parseCount(getColumn(row, "document_count", "documents")),
            parseInstant(getColumn(row, "last_movement_at", "last_movement"))
        );
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord row, String... names) {
        Map<String, String> values = row.toMap();
        for (String name : names) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                if (entry.getKey() != null && entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
                    return entry.getValue();
                }
            }
        }
        return null;
    }

    private List<String> parseTags(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<String> tags = new ArrayList<>();
        for (String part : TAG_SEPARATOR.split(raw)) {
            if (!part.isBlank()) {
                tags.add(part.trim());
            }
        }
        return tags;
    }

    private int parseCount(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("document_count is not a number: " + raw, e);
        }
    }

    static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException ignored) {
            // fall through to zone-less formats, which the registry exports in UTC
        }
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
    }

    private String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static class ErrorCollector {
        private int totalCount;
        private final List<String> sampleErrors = new ArrayList<>();

        private void add(String message) {
            totalCount++;
            if (sampleErrors.size() < MAX_ERROR_SAMPLES) {
                sampleErrors.add(message);
            }
        }

        private int totalCount() {
            return totalCount;
        }

        private List<String> sampleErrors() {
            return List.copyOf(sampleErrors);
        }
    }
}
