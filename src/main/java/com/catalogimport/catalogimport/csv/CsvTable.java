package com.catalogimport.catalogimport.csv;

import com.catalogimport.catalogimport.importer.ImportConstants;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Raw CSV grid whose first row is the header. Entirely blank rows are ignored everywhere.
 */
public final class CsvTable {

    private final List<List<String>> rows;
    private HeaderMap headerMap;

    public CsvTable(List<List<String>> rows) {
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copy.add(row == null ? List.of() : new ArrayList<>(row));
        }
        this.rows = copy;
    }

    public List<String> header() {
        return rows.isEmpty() ? List.of() : rows.get(0);
    }

    public HeaderMap headerMap() {
        if (headerMap == null) {
            headerMap = HeaderMap.of(header());
        }
        return headerMap;
    }

    /**
     * Checks, in order: empty file, blank header, header without data, then column count of every
     * non-blank data row against the header.
     */
    public void validate() {
        if (rows.isEmpty()) {
            throw new CsvValidationException(ImportConstants.MSG_CSV_EMPTY);
        }
        if (isBlank(header())) {
            throw new CsvValidationException(ImportConstants.MSG_CSV_HEADER_BLANK);
        }
        if (rows.size() <= 1) {
            throw new CsvValidationException(ImportConstants.MSG_CSV_HEADER_ONLY);
        }
        int headerCount = header().size();
        for (int index = 1; index < rows.size(); index++) {
            List<String> row = rows.get(index);
            if (isBlank(row)) {
                continue;
            }
            if (row.size() != headerCount) {
                throw new CsvValidationException(
                        ImportConstants.MSG_CSV_COLUMN_COUNT.formatted(index + 1, row.size(), headerCount));
            }
        }
    }

    /**
     * Lazily yields the non-blank data rows in file order.
     */
    public Stream<CsvRow> dataRows() {
        HeaderMap map = headerMap();
        return IntStream.range(1, rows.size())
                .filter(index -> !isBlank(rows.get(index)))
                .mapToObj(index -> new CsvRow(rows.get(index), map, index + 1));
    }

    /**
     * Splits a cell on {@code ;} and returns the non-empty trimmed parts in order.
     */
    public static List<String> parseList(String cell) {
        List<String> values = new ArrayList<>();
        if (cell == null || cell.isBlank()) {
            return values;
        }
        for (String part : cell.split(String.valueOf(ImportConstants.LIST_SEPARATOR), -1)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    /**
     * Splits a cell on {@code ;} keeping empty entries, so values stay aligned by position with
     * other lists of the same row.
     */
    public static List<String> parsePositionalList(String cell) {
        List<String> values = new ArrayList<>();
        if (cell == null || cell.isBlank()) {
            return values;
        }
        for (String part : cell.split(String.valueOf(ImportConstants.LIST_SEPARATOR), -1)) {
            values.add(part.trim());
        }
        return values;
    }

    static boolean isBlank(List<String> row) {
        for (String cell : row) {
            if (cell != null && !cell.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
