package com.catalogimport.catalogimport.attribute;

import com.catalogimport.catalogimport.csv.ColumnRole;
import com.catalogimport.catalogimport.csv.CsvRow;
import com.catalogimport.catalogimport.csv.HeaderColumn;
import com.catalogimport.catalogimport.importer.ImportConstants;
import com.catalogimport.catalogimport.importer.LabelNormalizer;

import java.util.List;

/**
 * Attribute-mode view of one CSV row.
 */
public class AttributeRow {

    private final CsvRow row;

    public AttributeRow(CsvRow row) {
        this.row = row;
    }

    public String code() {
        return row.cell(ImportConstants.COLUMN_ATTRIBUTE_CODE);
    }

    public int lineNumber() {
        return row.lineNumber();
    }

    public String cell(String name) {
        return row.cell(name);
    }

    public String cell(HeaderColumn column) {
        return row.cell(column);
    }

    public boolean isBlank(String name) {
        return row.cell(name).isEmpty();
    }

    public List<String> list(String name) {
        return row.list(name);
    }

    public List<String> positionalList(String name) {
        return row.positionalList(name);
    }

    public List<HeaderColumn> columns(ColumnRole role) {
        return row.headerMap().columns(role);
    }

    public boolean replacesOptions() {
        return ImportConstants.OPTION_STRATEGY_REPLACE.equals(LabelNormalizer.normalize(cell(ImportConstants.COLUMN_OPTION_STRATEGY)));
    }
}
