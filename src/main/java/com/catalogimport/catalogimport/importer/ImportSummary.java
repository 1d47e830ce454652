package com.catalogimport.catalogimport.importer;

import java.util.List;

/**
 * Outcome of a completed import run.
 */
public record ImportSummary(int added, int updated, int deleted, int errors, List<String> warnings) {

    public ImportSummary {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean successful() {
        return errors == 0;
    }
}
