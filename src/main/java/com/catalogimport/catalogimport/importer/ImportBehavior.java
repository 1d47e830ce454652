package com.catalogimport.catalogimport.importer;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * What an import run does with each row.
 */
public enum ImportBehavior {

    ADD("add"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    ImportBehavior(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ImportBehavior> fromValue(String value) {
        return Arrays.stream(values()).filter(behavior -> behavior.value.equals(value)).findFirst();
    }

    public static List<String> allowedValues() {
        return Arrays.stream(values()).map(ImportBehavior::value).toList();
    }
}
