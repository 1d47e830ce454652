package com.catalogimport.catalogimport.attribute;

import com.catalogimport.catalogimport.catalog.OptionDraft;

import java.util.Map;
import java.util.Set;

/**
 * One option built from a row.
 *
 * @param label            admin label as written in the row
 * @param sortOrder        resolved sort order, or {@code null} when the row has no {@code option_order}
 * @param storeLabels      per-store label overrides keyed by store id
 * @param normalizedLabels normalized forms of the admin label and every override
 */
public record PlannedOption(String label, Integer sortOrder, Map<Long, String> storeLabels, Set<String> normalizedLabels) {

    public PlannedOption {
        storeLabels = Map.copyOf(storeLabels);
        normalizedLabels = Set.copyOf(normalizedLabels);
    }

    public OptionDraft toDraft() {
        return new OptionDraft(label, sortOrder, storeLabels);
    }
}
