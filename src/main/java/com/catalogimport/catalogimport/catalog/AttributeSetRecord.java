package com.catalogimport.catalogimport.catalog;

public record AttributeSetRecord(long attributeSetId, String attributeSetName, int sortOrder) {
}
