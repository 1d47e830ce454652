package com.catalogimport.catalogimport.attribute;

import com.catalogimport.catalogimport.catalog.AttributeCatalog;
import com.catalogimport.catalogimport.catalog.CatalogAttribute;

import java.util.Optional;

/**
 * Read-through view of the stored attribute for one row. The attribute is fetched on first use
 * and then reused for the rest of the row.
 */
public class ExistingAttributeSnapshot {

    private final AttributeCatalog attributeCatalog;
    private final String attributeCode;
    private Optional<CatalogAttribute> attribute;

    public ExistingAttributeSnapshot(AttributeCatalog attributeCatalog, String attributeCode) {
        this.attributeCatalog = attributeCatalog;
        this.attributeCode = attributeCode;
    }

    public boolean exists() {
        return load().isPresent();
    }

    public String frontendInput() {
        return load().map(CatalogAttribute::frontendInput).orElse("");
    }

    public String defaultValue() {
        return load().map(CatalogAttribute::defaultValue).orElse("");
    }

    public String defaultLabel() {
        return load().map(CatalogAttribute::frontendLabel).orElse("");
    }

    private Optional<CatalogAttribute> load() {
        if (attribute == null) {
            attribute = attributeCatalog.findAttribute(attributeCode);
        }
        return attribute;
    }
}
