package com.salesdw.service.raw;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a delimited source file into positional rows, skipping the header line.
 *
 * Fields are mapped by position, not by header name. Empty fields and the literal
 * {@code NULL} become SQL NULL; short rows are padded with NULLs and extra fields dropped.
 */
@Component
@Slf4j
public class CsvSourceReader {

    private static final String NULL_LITERAL = "NULL";

    private final CSVFormat format;

    public CsvSourceReader(@Value("${app.etl.csv-delimiter:,}") char delimiter) {
        this.format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setQuote('"')
                .setSkipHeaderRecord(false)
                .setIgnoreEmptyLines(true)
                .setTrim(false)
                .build();
    }

    public List<Object[]> read(Path file, int columnCount) throws IOException {
        List<Object[]> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            boolean header = true;
            for (CSVRecord record : parser) {
                if (header) {
                    header = false;
                    continue;
                }
                rows.add(toRow(record, columnCount));
            }
        }
        log.debug("Read {} rows from {}", rows.size(), file);
        return rows;
    }

    private Object[] toRow(CSVRecord record, int columnCount) {
        Object[] row = new Object[columnCount];
        for (int i = 0; i < columnCount && i < record.size(); i++) {
            row[i] = normalize(record.get(i));
        }
        return row;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        if (trimmed.isEmpty() || NULL_LITERAL.equalsIgnoreCase(trimmed)) {
            return null;
        }
        return value;
    }
}
