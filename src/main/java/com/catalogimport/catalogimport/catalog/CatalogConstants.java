package com.catalogimport.catalogimport.catalog;

/**
 * Seed values and messages of the JDBC catalog.
 */
public final class CatalogConstants {

    private CatalogConstants() {
    }

    public static final long DEFAULT_STORE_VIEW_ID = 1L;
    public static final String DEFAULT_STORE_VIEW_CODE = "default";
    public static final String DEFAULT_FRONTEND_INPUT = "text";

    public static final String MSG_ATTRIBUTE_NOT_FOUND = "The attribute with code '%s' does not exist";
    public static final String MSG_ATTRIBUTE_SET_NOT_FOUND = "The attribute set with ID %d does not exist";
    public static final String MSG_DEFAULT_SET_NOT_FOUND = "The default attribute set '%s' does not exist";
    public static final String MSG_DEFAULT_GROUP_NOT_FOUND = "The attribute set with ID %d has no groups";
    public static final String MSG_GROUP_NOT_FOUND = "The attribute group '%s' does not exist in attribute set %d";
    public static final String MSG_ID_NOT_GENERATED = "Unable to read generated identifier from %s";
}
