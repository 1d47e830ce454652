package com.catalogimport.catalogimport.catalog;

/**
 * Logical failure reported by a catalog persistence collaborator, such as a missing entity.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
