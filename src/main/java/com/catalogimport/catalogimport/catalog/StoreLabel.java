package com.catalogimport.catalogimport.catalog;

public record StoreLabel(long storeId, String label) {
}
