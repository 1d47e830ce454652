package com.catalogimport.catalogimport.catalog;

import java.util.Optional;

/**
 * Lookup of store (view) identifiers by code.
 */
public interface StoreDirectory {

    Optional<Long> findStoreId(String storeCode);
}
