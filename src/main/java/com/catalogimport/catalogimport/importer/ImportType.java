package com.catalogimport.catalogimport.importer;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Kind of entity a CSV file describes.
 */
public enum ImportType {

    ATTRIBUTE(ImportConstants.TYPE_ATTRIBUTE),
    ATTRIBUTE_SET(ImportConstants.TYPE_ATTRIBUTE_SET);

    private final String value;

    ImportType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ImportType> fromValue(String value) {
        return Arrays.stream(values()).filter(type -> type.value.equals(value)).findFirst();
    }

    public static List<String> allowedValues() {
        return Arrays.stream(values()).map(ImportType::value).toList();
    }
}
