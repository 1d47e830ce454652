package com.catalogimport.catalogimport.catalog;

import java.util.Map;

/**
 * Stored attribute definition. Fields not modelled as columns are kept in {@code properties}.
 */
public record CatalogAttribute(
        long attributeId,
        String attributeCode,
        String frontendInput,
        String frontendLabel,
        String defaultValue,
        String backendModel,
        String sourceModel,
        String applyTo,
        Map<String, String> properties
) {

    public CatalogAttribute {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }
}
