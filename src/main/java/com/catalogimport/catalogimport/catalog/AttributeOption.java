package com.catalogimport.catalogimport.catalog;

import java.util.Map;

/**
 * Stored option of a select/multiselect attribute; {@code label} is the admin (store 0) label.
 */
public record AttributeOption(long optionId, String label, int sortOrder, Map<Long, String> storeLabels) {

    public AttributeOption {
        storeLabels = storeLabels == null ? Map.of() : Map.copyOf(storeLabels);
    }
}
