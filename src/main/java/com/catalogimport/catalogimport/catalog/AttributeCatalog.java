package com.catalogimport.catalogimport.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of attribute definitions, their options and store-scoped labels.
 */
public interface AttributeCatalog {

    Optional<CatalogAttribute> findAttribute(String attributeCode);

    /**
     * Creates the attribute or merges the given fields into the stored one, then writes the
     * embedded options.
     */
    void saveAttribute(String attributeCode, AttributeDefinition definition);

    void removeAttribute(String attributeCode);

    List<AttributeOption> getOptions(String attributeCode);

    /**
     * Adds a single option and returns its generated identifier.
     */
    long addOption(String attributeCode, OptionDraft option);

    void deleteOption(String attributeCode, long optionId);

    void updateDefaultValue(String attributeCode, String defaultValue);

    List<StoreLabel> getStoreLabels(String attributeCode);

    void saveStoreLabels(String attributeCode, List<StoreLabel> storeLabels);

    /**
     * Drops any cached attribute metadata so the next read goes to the store.
     */
    void invalidateCache();
}
