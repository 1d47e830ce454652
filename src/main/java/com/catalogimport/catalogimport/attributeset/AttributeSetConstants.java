package com.catalogimport.catalogimport.attributeset;

public final class AttributeSetConstants {

    private AttributeSetConstants() {
    }

    public static final String MSG_SET_ID_NOT_FOUND = "Attribute set with ID %d does not exist; skipping it for attribute '%s'";
    public static final String MSG_SET_CREATED = "Attribute set '%s' does not exist; created it for attribute '%s'";
    public static final String MSG_SET_ORDER_MISMATCH =
            "Attribute '%s' lists %d attribute set(s) but %d attribute set order(s); orders are matched by position";
    public static final String MSG_GROUP_FALLBACK =
            "Group '%s' could not be resolved in attribute set %d (%s); using the default group";
    public static final String MSG_DEFAULT_SET_FAILED = "An error occurred while resolving the default attribute set for attribute '%s': %s";
    public static final String MSG_ASSIGN_FAILED = "An error occurred while assigning attribute '%s' to attribute set '%s': %s";

    public static final String MSG_DELETING_SET = "Deleting attribute set '%s'...";
    public static final String MSG_DEFAULT_SET_PROTECTED = "Attribute set '%s' is the default attribute set and cannot be deleted; skipping";
    public static final String MSG_SET_NOT_FOUND = "Attribute set '%s' does not exist; skipping";
    public static final String MSG_DELETE_SET_FAILED = "An error occurred while deleting attribute set '%s': %s";
}
