package com.catalogimport.catalogimport.store;

import com.catalogimport.catalogimport.catalog.StoreDirectory;
import com.catalogimport.catalogimport.importer.ImportConstants;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Store code to store id cache owned by one import run. Lookups are lazy and never invalidated;
 * unknown codes are remembered as absent. The admin code always maps to store 0.
 */
public class StoreResolver {

    private final StoreDirectory storeDirectory;
    private final String adminStoreCode;
    private final Map<String, Optional<Long>> resolved = new HashMap<>();

    public StoreResolver(StoreDirectory storeDirectory, String adminStoreCode) {
        this.storeDirectory = storeDirectory;
        this.adminStoreCode = adminStoreCode == null ? "" : adminStoreCode.trim().toLowerCase(Locale.ROOT);
    }

    public Optional<Long> resolve(String storeCode) {
        String key = storeCode == null ? "" : storeCode.trim().toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        if (key.equals(adminStoreCode)) {
            return Optional.of(ImportConstants.ADMIN_STORE_ID);
        }
        return resolved.computeIfAbsent(key, storeDirectory::findStoreId);
    }
}
