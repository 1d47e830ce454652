package com.catalogimport.catalogimport.attribute;

import com.catalogimport.catalogimport.importer.ImportConstants;

import java.util.Set;

/**
 * Message templates and column groups of the attribute row pipeline.
 */
public final class AttributeConstants {

    private AttributeConstants() {
    }

    /** Scalar columns that drive set assignment and never reach the attribute payload. */
    public static final Set<String> ASSIGNMENT_COLUMNS = Set.of(
            ImportConstants.COLUMN_ATTRIBUTE_SET_ORDER,
            ImportConstants.COLUMN_GROUP_ORDER,
            ImportConstants.COLUMN_SORT_ORDER
    );

    public static final String MSG_ADDING = "Adding attribute '%s'...";
    public static final String MSG_UPDATING = "Updating attribute '%s'...";
    public static final String MSG_DELETING = "Deleting attribute '%s'...";
    public static final String MSG_ALREADY_EXISTS = "Attribute '%s' already exists; skipping";
    public static final String MSG_DOES_NOT_EXIST = "Attribute '%s' does not exist and cannot be deleted; skipping";
    public static final String MSG_LOOKUP_FAILED = "An error occurred while looking up attribute '%s': %s";
    public static final String MSG_DELETE_FAILED = "An error occurred while deleting attribute '%s': %s";
    public static final String MSG_SAVE_FAILED = "An error occurred while %s attribute '%s': %s";
    public static final String MSG_INHERIT_FAILED = "An error occurred while reading the current %s of attribute '%s': %s";
    public static final String MSG_INPUT_CHANGE =
            "The input type of attribute '%s' changes from '%s' to '%s'; stored option identifiers are no longer valid";
    public static final String MSG_OPTIONS_FAILED = "An error occurred while preparing the options of attribute '%s': %s";
    public static final String MSG_POST_SAVE_FAILED = "An error occurred while applying %s to attribute '%s': %s";

    public static final String MSG_SOURCE_AND_OPTION =
            "Attribute '%s' has both 'source' and 'option' set; the source model is used and the options are ignored";
    public static final String MSG_STORE_NOT_FOUND = "Store code '%s' of column '%s' could not be resolved; ignoring";
    public static final String MSG_ADMIN_OPTION_COLUMN = "Column '%s' targets the admin store; use the 'option' column instead";
    public static final String MSG_OPTION_COUNT_MISMATCH =
            "Column '%s' of attribute '%s' has %d option(s) but 'option' has %d; values are matched by position";
    public static final String MSG_OPTION_PROMOTED = "Option %d of attribute '%s' has no base label; using '%s' from column '%s'";
    public static final String MSG_OPTION_EMPTY = "Option %d of attribute '%s' has no label; skipping";
    public static final String MSG_OPTION_DUPLICATES = "Duplicate option label(s) of attribute '%s' ignored: %s";
    public static final String MSG_OPTION_ORDER_INVALID = "Option order '%s' of attribute '%s' is not a number; ignoring";
    public static final String MSG_OPTIONS_REPLACED = "Removed %d existing option(s) of attribute '%s'";
    public static final String MSG_OPTION_REPLACE_FAILED = "An error occurred while removing the options of attribute '%s': %s";
    public static final String MSG_OPTIONS_READ_FAILED = "An error occurred while reading the options of attribute '%s': %s";
    public static final String MSG_OPTION_EXISTS = "Option '%s' of attribute '%s' already exists";
    public static final String MSG_OPTION_ADDED = "Added option '%s' to attribute '%s'";
    public static final String MSG_OPTION_ADD_FAILED = "An error occurred while adding option '%s' to attribute '%s': %s";

    public static final String MSG_DEFAULT_UNRESOLVED = "Default value '%s' of attribute '%s' was not set as default";
    public static final String MSG_DEFAULT_UNRESOLVED_VERBOSE =
            "Default value '%s' of attribute '%s' does not match any option; available labels: %s";
    public static final String MSG_DEFAULT_FAILED = "An error occurred while setting the default value of attribute '%s': %s";

    public static final String MSG_LABEL_FAILED = "An error occurred while saving store labels of attribute '%s': %s";
}
