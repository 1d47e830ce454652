package com.catalogimport.catalogimport.attribute;

/**
 * How one call of {@link OptionReconciler#reconcile} treats the options already stored.
 */
public enum OptionPass {

    /** Assume no stored options; every planned option goes into the save payload. */
    CREATE,

    /** Merge into the stored options, honouring the replace strategy. */
    MERGE,

    /** Merge after a rebuilding save; the replace strategy is not applied again. */
    FOLLOW_UP
}
