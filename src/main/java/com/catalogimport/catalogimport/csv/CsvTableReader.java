package com.catalogimport.catalogimport.csv;

import com.catalogimport.catalogimport.importer.ImportConstants;
import com.catalogimport.catalogimport.importer.ImportProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Locates an import file under the configured var directory and reads it into a {@link CsvTable}.
 */
@Component
public class CsvTableReader {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setDelimiter(',')
            .setQuote('"')
            .setIgnoreEmptyLines(false)
            .build();

    private final ImportProperties importProperties;

    public CsvTableReader(ImportProperties importProperties) {
        this.importProperties = importProperties;
    }

    /**
     * Resolves a CSV argument against the var directory; leading separators are ignored so the
     * argument is always read as relative.
     */
    public Path resolvePath(String csvArgument) {
        String relative = csvArgument == null ? "" : csvArgument.replaceFirst("^[/\\\\]+", "");
        return Path.of(importProperties.getVarDirectory()).resolve(relative).normalize();
    }

    /**
     * Reads the whole file. Fails when the path is not a readable regular file or cannot be parsed.
     */
    public CsvTable read(Path csvPath) {
        if (!Files.isRegularFile(csvPath) || !Files.isReadable(csvPath)) {
            throw new CsvValidationException(ImportConstants.MSG_CSV_NOT_READABLE.formatted(csvPath));
        }
        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             CSVParser parser = CSV_FORMAT.parse(reader)) {
            List<List<String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                rows.add(new ArrayList<>(record.toList()));
            }
            stripByteOrderMark(rows);
            return new CsvTable(rows);
        } catch (IOException | IllegalStateException | UncheckedIOException ex) {
            throw new CsvValidationException(ImportConstants.MSG_CSV_READ_FAILED.formatted(csvPath, ex.getMessage()), ex);
        }
    }

    /**
     * Reads and validates the shape of the file in one step.
     */
    public CsvTable readValidated(String csvArgument) {
        CsvTable table = read(resolvePath(csvArgument));
        table.validate();
        return table;
    }

    private void stripByteOrderMark(List<List<String>> rows) {
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            return;
        }
        List<String> header = rows.get(0);
        String first = header.get(0);
        if (first != null && first.startsWith(BYTE_ORDER_MARK)) {
            header.set(0, first.substring(BYTE_ORDER_MARK.length()));
        }
    }
}
