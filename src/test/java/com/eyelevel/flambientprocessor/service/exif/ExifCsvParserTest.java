package com.eyelevel.flambientprocessor.service.exif;

import com.eyelevel.flambientprocessor.model.exposure.ExposureRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExifCsvParserTest {

    private final ExifCsvParser parser = new ExifCsvParser();

    @Test
    @DisplayName("Merges numeric and label rows by source file and sorts by capture time")
    void merge_pairsRowsAndSorts() {
        String numeric = """
                SourceFile,FileName,DateTimeOriginal,Flash
                /shoot/b.jpg,b.jpg,2024:05:14 10:00:05,0
                /shoot/a.jpg,a.jpg,2024:05:14 10:00:01,16
                """;
        String labels = """
                SourceFile,FileName,DateTimeOriginal,Flash
                /shoot/a.jpg,a.jpg,2024:05:14 10:00:01,No Flash
                /shoot/b.jpg,b.jpg,2024:05:14 10:00:05,Fired
                """;

        List<ExposureRecord> records = parser.merge(numeric, labels);

        assertThat(records).extracting(ExposureRecord::filename).containsExactly("a.jpg", "b.jpg");
        ExposureRecord first = records.get(0);
        assertThat(first.timestamp()).isEqualTo(LocalDateTime.of(2024, 5, 14, 10, 0, 1));
        assertThat(first.rawValue("Flash")).contains("16");
        assertThat(first.field("Flash")).hasValueSatisfying(value -> assertThat(value.label()).isEqualTo("No Flash"));
        assertThat(records.get(1).field("Flash"))
                .hasValueSatisfying(value -> assertThat(value.label()).isEqualTo("Fired"));
    }

    @Test
    @DisplayName("Records without a capture time sort last, then by file name")
    void merge_missingTimestampSortsLast() {
        String numeric = """
                SourceFile,DateTimeOriginal,Flash
                /shoot/z.jpg,,16
                /shoot/y.jpg,,0
                /shoot/x.jpg,2024:05:14 10:00:00+02:00,16
                """;

        List<ExposureRecord> records = parser.merge(numeric, "");

        assertThat(records).extracting(ExposureRecord::filename).containsExactly("x.jpg", "y.jpg", "z.jpg");
        assertThat(records.get(1).timestamp()).isNull();
        assertThat(records.get(1).field("Flash"))
                .hasValueSatisfying(value -> assertThat(value.label()).isEqualTo("0"));
    }

    @Test
    @DisplayName("Empty or header-only output yields no records")
    void merge_empty() {
        assertThat(parser.merge("", "")).isEmpty();
        assertThat(parser.merge("SourceFile,Flash\n", "SourceFile,Flash\n")).isEmpty();
    }

    @Test
    @DisplayName("Capture time parsing keeps the first 19 characters")
    void parseTimestamp_ignoresSubsecondsAndZone() {
        assertThat(ExifCsvParser.parseTimestamp("2024:05:14 10:00:00.123")).isEqualTo(
                LocalDateTime.of(2024, 5, 14, 10, 0));
        assertThat(ExifCsvParser.parseTimestamp("0000:00:00 00:00:00")).isNull();
        assertThat(ExifCsvParser.parseTimestamp("garbage")).isNull();
    }
}
