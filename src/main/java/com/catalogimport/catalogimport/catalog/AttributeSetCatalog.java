package com.catalogimport.catalogimport.catalog;

import java.util.Optional;

/**
 * Persistence of attribute sets, their groups and attribute assignments.
 */
public interface AttributeSetCatalog {

    long getDefaultAttributeSetId();

    Optional<AttributeSetRecord> findAttributeSet(long attributeSetId);

    /**
     * Looks a set up by name, ignoring case.
     */
    Optional<AttributeSetRecord> findAttributeSet(String attributeSetName);

    /**
     * Creates a set whose groups and assignments are copied from {@code skeletonSetId}.
     */
    long createAttributeSet(String attributeSetName, Integer sortOrder, long skeletonSetId);

    void updateAttributeSetSortOrder(long attributeSetId, int sortOrder);

    void removeAttributeSet(long attributeSetId);

    long getDefaultGroupId(long attributeSetId);

    /**
     * Creates the group when missing; an existing group only gets its sort order updated.
     */
    void addAttributeGroup(long attributeSetId, String groupName, Integer sortOrder);

    long getAttributeGroupId(long attributeSetId, String groupName);

    /**
     * Places the attribute in the set and group, moving it when it is already assigned to the set.
     */
    void addAttributeToSet(long attributeSetId, long attributeGroupId, String attributeCode, Integer sortOrder);
}
