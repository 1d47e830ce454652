package com.catalogimport.catalogimport.attribute;

import com.catalogimport.catalogimport.csv.CsvTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds single attribute rows from alternating column names and cell values.
 */
public final class AttributeRows {

    private AttributeRows() {
    }

    public static AttributeRow row(String... columnsAndValues) {
        if (columnsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected column/value pairs");
        }
        List<String> header = new ArrayList<>();
        List<String> cells = new ArrayList<>();
        for (int index = 0; index < columnsAndValues.length; index += 2) {
            header.add(columnsAndValues[index]);
            cells.add(columnsAndValues[index + 1]);
        }
        return new CsvTable(List.of(header, cells)).dataRows()
                .findFirst()
                .map(AttributeRow::new)
                .orElseThrow();
    }
}
