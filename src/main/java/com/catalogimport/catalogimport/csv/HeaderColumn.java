package com.catalogimport.catalogimport.csv;

/**
 * One classified header column. {@code storeCode} is set only for store-scoped roles.
 */
public record HeaderColumn(String name, int index, ColumnRole role, String storeCode) {
}
