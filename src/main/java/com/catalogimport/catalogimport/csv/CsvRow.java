package com.catalogimport.catalogimport.csv;

import java.util.List;

/**
 * One non-blank data row read through its table's header map.
 */
public final class CsvRow {

    private final List<String> cells;
    private final HeaderMap headerMap;
    private final int lineNumber;

    CsvRow(List<String> cells, HeaderMap headerMap, int lineNumber) {
        this.cells = List.copyOf(cells);
        this.headerMap = headerMap;
        this.lineNumber = lineNumber;
    }

    public HeaderMap headerMap() {
        return headerMap;
    }

    public int lineNumber() {
        return lineNumber;
    }

    /**
     * Returns the trimmed cell for a column, or an empty string when the column or the cell is absent.
     */
    public String cell(String name) {
        return headerMap.indexOf(name).map(this::cellAt).orElse("");
    }

    public String cellAt(int index) {
        if (index < 0 || index >= cells.size()) {
            return "";
        }
        String value = cells.get(index);
        return value == null ? "" : value.trim();
    }

    public String cell(HeaderColumn column) {
        return cellAt(column.index());
    }

    /**
     * Reads a column as a semicolon-separated list.
     */
    public List<String> list(String name) {
        return CsvTable.parseList(cell(name));
    }

    public List<String> positionalList(String name) {
        return CsvTable.parsePositionalList(cell(name));
    }
}
