package com.eyelevel.flambientprocessor.service.exif;

import com.eyelevel.flambientprocessor.exception.ExifExtractionException;
import com.eyelevel.flambientprocessor.model.exposure.ExifValue;
import com.eyelevel.flambientprocessor.model.exposure.ExposureRecord;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the numeric and the human-readable CSV output of the EXIF tool into exposure records
 * sorted by capture time.
 */
@Slf4j
@Component
public class ExifCsvParser {

    static final String SOURCE_FILE = "SourceFile";
    static final String FILE_NAME = "FileName";
    static final String DATE_TIME_ORIGINAL = "DateTimeOriginal";

    private static final DateTimeFormatter EXIF_DATE_TIME = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");
    private static final int EXIF_DATE_TIME_LENGTH = 19;

    private static final Comparator<ExposureRecord> CAPTURE_ORDER =
            Comparator.comparing(ExposureRecord::timestamp, Comparator.nullsLast(Comparator.naturalOrder()))
                      .thenComparing(ExposureRecord::filename);

    private final CsvMapper csvMapper = new CsvMapper();

    /**
     * Pairs rows of both runs by source file (row position when the column is absent) and keeps every
     * column except the source file as a {@code {raw, label}} pair.
     *
     * @param numericCsv Output of the numeric ({@code -n}) run.
     * @param labelCsv   Output of the label run over the same files.
     * @return the records in ascending capture time; empty for empty or header-only input.
     */
    public List<ExposureRecord> merge(String numericCsv, String labelCsv) {
        List<Map<String, String>> numericRows = readRows(numericCsv);
        if (numericRows.isEmpty()) {
            return List.of();
        }
        List<Map<String, String>> labelRows = readRows(labelCsv);
        Map<String, Map<String, String>> labelsBySource = new HashMap<>();
        labelRows.forEach(row -> {
            String source = row.get(SOURCE_FILE);
            if (source != null) {
                labelsBySource.put(source, row);
            }
        });

        List<ExposureRecord> records = new ArrayList<>(numericRows.size());
        for (int index = 0; index < numericRows.size(); index++) {
            Map<String, String> numeric = numericRows.get(index);
            Map<String, String> labels = labelsBySource.getOrDefault(numeric.get(SOURCE_FILE),
                                                                     index < labelRows.size()
                                                                     ? labelRows.get(index) : Map.of());
            records.add(toRecord(numeric, labels));
        }
        records.sort(CAPTURE_ORDER);
        log.debug("Merged EXIF metadata of {} exposures", records.size());
        return records;
    }

    private ExposureRecord toRecord(Map<String, String> numeric, Map<String, String> labels) {
        String source = numeric.getOrDefault(SOURCE_FILE, "");
        String filename = numeric.get(FILE_NAME);
        if (filename == null || filename.isBlank()) {
            filename = FilenameUtils.getName(source);
        }

        Map<String, ExifValue> fields = new LinkedHashMap<>();
        numeric.forEach((column, raw) -> {
            if (!SOURCE_FILE.equals(column)) {
                String label = labels.get(column);
                fields.put(column, new ExifValue(raw, label == null || label.isBlank() ? raw : label));
            }
        });
        return new ExposureRecord(Path.of(source), filename, parseTimestamp(numeric.get(DATE_TIME_ORIGINAL)),
                                  fields);
    }

    static LocalDateTime parseTimestamp(String value) {
        if (value == null || value.length() < EXIF_DATE_TIME_LENGTH) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.substring(0, EXIF_DATE_TIME_LENGTH), EXIF_DATE_TIME);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable capture time '{}'", value);
            return null;
        }
    }

    private List<Map<String, String>> readRows(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class)
                                                                  .with(schema)
                                                                  .readValues(csv)) {
            return rows.readAll();
        } catch (IOException e) {
            throw new ExifExtractionException("Could not parse EXIF tool CSV output", e);
        }
    }
}
