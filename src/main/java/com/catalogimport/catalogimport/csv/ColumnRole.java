package com.catalogimport.catalogimport.csv;

/**
 * How a header column takes part in an attribute import.
 */
public enum ColumnRole {

    /** Copied into the attribute definition payload. */
    SCALAR,

    /** {@code label_{storeCode}}: store-scoped attribute label. */
    STORE_LABEL,

    /** {@code option_{storeCode}}: store-scoped option labels, aligned by position with {@code option}. */
    STORE_OPTION,

    /** Structural column handled outside the definition payload. */
    RESERVED
}
