package com.catalogimport.catalogimport.importer;

/**
 * Fatal problem detected before any row is processed: missing required column or an invalid
 * type/behavior combination.
 */
public class ImportValidationException extends RuntimeException {

    public ImportValidationException(String message) {
        super(message);
    }
}
