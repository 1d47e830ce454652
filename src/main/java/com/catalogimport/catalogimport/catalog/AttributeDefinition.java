package com.catalogimport.catalogimport.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of one attribute save.
 *
 * @param data           field name to value, as read from the import row
 * @param options        options created together with the definition
 * @param rebuildOptions drop the stored options before {@code options} are written
 */
public record AttributeDefinition(Map<String, String> data, List<OptionDraft> options, boolean rebuildOptions) {

    public AttributeDefinition {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        options = options == null ? List.of() : List.copyOf(options);
    }
}
