package com.catalogimport.catalogimport.catalog;

import java.util.Map;

/**
 * Option to be created: admin label, optional sort order and per-store label overrides.
 */
public record OptionDraft(String label, Integer sortOrder, Map<Long, String> storeLabels) {

    public OptionDraft {
        storeLabels = storeLabels == null ? Map.of() : Map.copyOf(storeLabels);
    }
}
