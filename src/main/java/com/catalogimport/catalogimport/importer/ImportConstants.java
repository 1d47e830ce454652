package com.catalogimport.catalogimport.importer;

import java.util.Set;

/**
 * Shared constants for the attribute import flow.
 */
public final class ImportConstants {

    private ImportConstants() {
    }

    public static final String DEFAULT_VAR_DIRECTORY = "var";
    public static final String DEFAULT_ADMIN_STORE_CODE = "admin";
    public static final String DEFAULT_ATTRIBUTE_SET_NAME = "Default";
    public static final String DEFAULT_GROUP_NAME = "General";
    public static final String DEFAULT_MULTISELECT_BACKEND_MODEL = "array";
    public static final int DEFAULT_OPTION_SORT_STEP = 10;
    public static final long ADMIN_STORE_ID = 0L;

    public static final String TYPE_ATTRIBUTE = "attribute";
    public static final String TYPE_ATTRIBUTE_SET = "attribute-set";

    public static final String INPUT_SELECT = "select";
    public static final String INPUT_MULTISELECT = "multiselect";
    public static final String OPTION_STRATEGY_REPLACE = "replace";

    public static final String COLUMN_ATTRIBUTE_CODE = "attribute_code";
    public static final String COLUMN_ATTRIBUTE_SET = "attribute_set";
    public static final String COLUMN_ATTRIBUTE_SET_ORDER = "attribute_set_order";
    public static final String COLUMN_GROUP = "group";
    public static final String COLUMN_GROUP_ORDER = "group_order";
    public static final String COLUMN_SORT_ORDER = "sort_order";
    public static final String COLUMN_LABEL = "label";
    public static final String COLUMN_INPUT = "input";
    public static final String COLUMN_DEFAULT = "default";
    public static final String COLUMN_APPLY_TO = "apply_to";
    public static final String COLUMN_OPTION = "option";
    public static final String COLUMN_OPTION_ORDER = "option_order";
    public static final String COLUMN_OPTION_STRATEGY = "option_strategy";
    public static final String COLUMN_SOURCE = "source";
    public static final String COLUMN_BACKEND = "backend";

    public static final String LABEL_COLUMN_PREFIX = "label_";
    public static final String OPTION_COLUMN_PREFIX = "option_";

    public static final Set<String> RESERVED_OPTION_COLUMNS = Set.of(COLUMN_OPTION_ORDER, COLUMN_OPTION_STRATEGY);

    public static final char LIST_SEPARATOR = ';';
    public static final String PERSISTED_LIST_SEPARATOR = ",";

    public static final String MSG_CSV_NOT_READABLE = "The CSV file '%s' does not exist or is not readable";
    public static final String MSG_CSV_READ_FAILED = "An error occurred while reading the CSV file '%s': %s";
    public static final String MSG_CSV_EMPTY = "The CSV file is empty";
    public static final String MSG_CSV_HEADER_BLANK = "The CSV file header is empty or contains only whitespace";
    public static final String MSG_CSV_HEADER_ONLY = "The CSV file contains only the header row";
    public static final String MSG_CSV_COLUMN_COUNT =
            "The CSV file has a row on line %d with %d columns, but the header has %d columns";
    public static final String MSG_MISSING_COLUMN = "The CSV file is missing the '%s' column";
    public static final String MSG_INVALID_TYPE = "Invalid --type '%s'; must be one of: %s";
    public static final String MSG_INVALID_BEHAVIOR = "Invalid --behavior '%s'; must be one of: %s";
    public static final String MSG_INVALID_BEHAVIOR_FOR_TYPE = "Invalid --behavior '%s' for type '%s'; must be 'delete'";
    public static final String MSG_DELETED_SETS = "Deleted %d attribute set(s)";
    public static final String MSG_DELETED_ATTRIBUTES = "Deleted %d attribute(s)";
    public static final String MSG_ADDED_UPDATED_ATTRIBUTES = "Added %d attribute(s), updated %d attribute(s)";
    public static final String MSG_ADDED_ATTRIBUTES = "Added %d attribute(s)";
    public static final String MSG_ROW_FAILED = "An error occurred while processing line %d (attribute '%s'): %s";
    public static final String MSG_ERRORS_OCCURRED = "%d error(s) occurred during import";
}
