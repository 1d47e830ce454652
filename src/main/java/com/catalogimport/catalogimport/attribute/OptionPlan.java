package com.catalogimport.catalogimport.attribute;

import com.catalogimport.catalogimport.catalog.OptionDraft;

import java.util.List;

/**
 * Options built from one row, keyed and ordered by first occurrence of their normalized label.
 */
public record OptionPlan(List<PlannedOption> options) {

    public OptionPlan {
        options = List.copyOf(options);
    }

    public static OptionPlan empty() {
        return new OptionPlan(List.of());
    }

    public boolean isEmpty() {
        return options.isEmpty();
    }

    public List<OptionDraft> drafts() {
        return options.stream().map(PlannedOption::toDraft).toList();
    }
}
