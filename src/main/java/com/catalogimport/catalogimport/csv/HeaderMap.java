package com.catalogimport.catalogimport.csv;

import com.catalogimport.catalogimport.importer.ImportConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Case-insensitive, trimmed column name to index lookup built from a header row.
 * The first occurrence of a duplicated name wins; blank names are not addressable.
 * Every column is classified once, when the map is built.
 */
public final class HeaderMap {

    private static final Set<String> RESERVED_COLUMNS = Set.of(
            ImportConstants.COLUMN_ATTRIBUTE_CODE,
            ImportConstants.COLUMN_ATTRIBUTE_SET,
            ImportConstants.COLUMN_GROUP,
            ImportConstants.COLUMN_OPTION
    );

    private final Map<String, HeaderColumn> columnsByName;

    private HeaderMap(Map<String, HeaderColumn> columnsByName) {
        this.columnsByName = columnsByName;
    }

    public static HeaderMap of(List<String> header) {
        Map<String, HeaderColumn> columns = new LinkedHashMap<>();
        for (int index = 0; index < header.size(); index++) {
            String key = normalizeName(header.get(index));
            if (!key.isEmpty() && !columns.containsKey(key)) {
                columns.put(key, classify(key, index));
            }
        }
        return new HeaderMap(Collections.unmodifiableMap(columns));
    }

    public static String normalizeName(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public boolean contains(String name) {
        return columnsByName.containsKey(normalizeName(name));
    }

    public Optional<Integer> indexOf(String name) {
        HeaderColumn column = columnsByName.get(normalizeName(name));
        return column == null ? Optional.empty() : Optional.of(column.index());
    }

    public List<HeaderColumn> columns(ColumnRole role) {
        List<HeaderColumn> matching = new ArrayList<>();
        for (HeaderColumn column : columnsByName.values()) {
            if (column.role() == role) {
                matching.add(column);
            }
        }
        return matching;
    }

    /**
     * Maps a normalized header name to its role in an attribute row.
     */
    static HeaderColumn classify(String key, int index) {
        if (RESERVED_COLUMNS.contains(key)) {
            return new HeaderColumn(key, index, ColumnRole.RESERVED, null);
        }
        if (key.startsWith(ImportConstants.LABEL_COLUMN_PREFIX)) {
            String storeCode = key.substring(ImportConstants.LABEL_COLUMN_PREFIX.length());
            return storeCode.isEmpty()
                    ? new HeaderColumn(key, index, ColumnRole.RESERVED, null)
                    : new HeaderColumn(key, index, ColumnRole.STORE_LABEL, storeCode);
        }
        if (key.startsWith(ImportConstants.OPTION_COLUMN_PREFIX)) {
            String storeCode = key.substring(ImportConstants.OPTION_COLUMN_PREFIX.length());
            if (storeCode.isEmpty() || ImportConstants.RESERVED_OPTION_COLUMNS.contains(key)) {
                return new HeaderColumn(key, index, ColumnRole.RESERVED, null);
            }
            return new HeaderColumn(key, index, ColumnRole.STORE_OPTION, storeCode);
        }
        return new HeaderColumn(key, index, ColumnRole.SCALAR, null);
    }
}
