package com.catalogimport.catalogimport.csv;

/**
 * The CSV file could not be read or does not have a usable shape.
 */
public class CsvValidationException extends RuntimeException {

    public CsvValidationException(String message) {
        super(message);
    }

    public CsvValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
