package com.catalogimport.catalogimport.catalog;

import com.catalogimport.catalogimport.importer.ImportProperties;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class JdbcAttributeSetCatalog implements AttributeSetCatalog {

    private static final RowMapper<AttributeSetRecord> SET_MAPPER = (rs, rowNum) -> new AttributeSetRecord(
            rs.getLong("attribute_set_id"),
            rs.getString("attribute_set_name"),
            rs.getInt("sort_order")
    );

    private final JdbcTemplate jdbcTemplate;
    private final ImportProperties importProperties;

    public JdbcAttributeSetCatalog(JdbcTemplate jdbcTemplate, ImportProperties importProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.importProperties = importProperties;
    }

    @Override
    public long getDefaultAttributeSetId() {
        String defaultSetName = importProperties.getDefaultAttributeSetName();
        return findAttributeSet(defaultSetName)
                .map(AttributeSetRecord::attributeSetId)
                .orElseThrow(() -> new CatalogException(CatalogConstants.MSG_DEFAULT_SET_NOT_FOUND.formatted(defaultSetName)));
    }

    @Override
    public Optional<AttributeSetRecord> findAttributeSet(long attributeSetId) {
        List<AttributeSetRecord> found = jdbcTemplate.query(
                "SELECT attribute_set_id, attribute_set_name, sort_order FROM catalog_attribute_set WHERE attribute_set_id = ?",
                SET_MAPPER,
                attributeSetId
        );
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public Optional<AttributeSetRecord> findAttributeSet(String attributeSetName) {
        List<AttributeSetRecord> found = jdbcTemplate.query(
                """
                SELECT attribute_set_id, attribute_set_name, sort_order
                FROM catalog_attribute_set
                WHERE LOWER(attribute_set_name) = LOWER(?)
                ORDER BY attribute_set_id
                """,
                SET_MAPPER,
                attributeSetName.trim()
        );
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * Creates the set, then copies the skeleton's groups and their attribute assignments.
     */
    @Override
    public long createAttributeSet(String attributeSetName, Integer sortOrder, long skeletonSetId) {
        if (findAttributeSet(skeletonSetId).isEmpty()) {
            throw new CatalogException(CatalogConstants.MSG_ATTRIBUTE_SET_NOT_FOUND.formatted(skeletonSetId));
        }
        jdbcTemplate.update(
                "INSERT INTO catalog_attribute_set (attribute_set_name, sort_order) VALUES (?, ?)",
                attributeSetName.trim(),
                sortOrder == null ? 0 : sortOrder
        );
        Long attributeSetId = jdbcTemplate.queryForObject(
                "SELECT MAX(attribute_set_id) FROM catalog_attribute_set WHERE attribute_set_name = ?",
                Long.class,
                attributeSetName.trim()
        );
        if (attributeSetId == null) {
            throw new CatalogException(CatalogConstants.MSG_ID_NOT_GENERATED.formatted("catalog_attribute_set"));
        }

        List<Map<String, Object>> skeletonGroups = jdbcTemplate.queryForList(
                """
                SELECT attribute_group_id, attribute_group_name, sort_order, is_default
                FROM catalog_attribute_group
                WHERE attribute_set_id = ?
                ORDER BY sort_order, attribute_group_id
                """,
                skeletonSetId
        );
        for (Map<String, Object> group : skeletonGroups) {
            String groupName = (String) group.get("attribute_group_name");
            jdbcTemplate.update(
                    "INSERT INTO catalog_attribute_group (attribute_set_id, attribute_group_name, sort_order, is_default) "
                            + "VALUES (?, ?, ?, ?)",
                    attributeSetId,
                    groupName,
                    ((Number) group.get("sort_order")).intValue(),
                    Boolean.TRUE.equals(group.get("is_default"))
            );
            long newGroupId = getAttributeGroupId(attributeSetId, groupName);
            jdbcTemplate.update(
                    """
                    INSERT INTO catalog_entity_attribute (attribute_set_id, attribute_group_id, attribute_id, sort_order)
                    SELECT CAST(? AS BIGINT), CAST(? AS BIGINT), attribute_id, sort_order
                    FROM catalog_entity_attribute
                    WHERE attribute_set_id = ? AND attribute_group_id = ?
                    """,
                    attributeSetId,
                    newGroupId,
                    skeletonSetId,
                    ((Number) group.get("attribute_group_id")).longValue()
            );
        }
        return attributeSetId;
    }

    @Override
    public void updateAttributeSetSortOrder(long attributeSetId, int sortOrder) {
        int updated = jdbcTemplate.update(
                "UPDATE catalog_attribute_set SET sort_order = ? WHERE attribute_set_id = ?",
                sortOrder,
                attributeSetId
        );
        if (updated == 0) {
            throw new CatalogException(CatalogConstants.MSG_ATTRIBUTE_SET_NOT_FOUND.formatted(attributeSetId));
        }
    }

    @Override
    public void removeAttributeSet(long attributeSetId) {
        if (findAttributeSet(attributeSetId).isEmpty()) {
            throw new CatalogException(CatalogConstants.MSG_ATTRIBUTE_SET_NOT_FOUND.formatted(attributeSetId));
        }
        jdbcTemplate.update("DELETE FROM catalog_entity_attribute WHERE attribute_set_id = ?", attributeSetId);
        jdbcTemplate.update("DELETE FROM catalog_attribute_group WHERE attribute_set_id = ?", attributeSetId);
        jdbcTemplate.update("DELETE FROM catalog_attribute_set WHERE attribute_set_id = ?", attributeSetId);
    }

    /**
     * Returns the group flagged as default, or the first group by sort order when none is flagged.
     */
    @Override
    public long getDefaultGroupId(long attributeSetId) {
        List<Long> ids = jdbcTemplate.queryForList(
                """
                SELECT attribute_group_id
                FROM catalog_attribute_group
                WHERE attribute_set_id = ?
                ORDER BY CASE WHEN is_default THEN 0 ELSE 1 END, sort_order, attribute_group_id
                """,
                Long.class,
                attributeSetId
        );
        if (ids.isEmpty()) {
            throw new CatalogException(CatalogConstants.MSG_DEFAULT_GROUP_NOT_FOUND.formatted(attributeSetId));
        }
        return ids.get(0);
    }

    @Override
    public void addAttributeGroup(long attributeSetId, String groupName, Integer sortOrder) {
        Optional<Long> existing = findGroupId(attributeSetId, groupName);
        if (existing.isPresent()) {
            if (sortOrder != null) {
                jdbcTemplate.update(
                        "UPDATE catalog_attribute_group SET sort_order = ? WHERE attribute_group_id = ?",
                        sortOrder,
                        existing.get()
                );
            }
            return;
        }
        int resolvedOrder = sortOrder != null ? sortOrder : nextGroupSortOrder(attributeSetId);
        jdbcTemplate.update(
                "INSERT INTO catalog_attribute_group (attribute_set_id, attribute_group_name, sort_order, is_default) "
                        + "VALUES (?, ?, ?, FALSE)",
                attributeSetId,
                groupName.trim(),
                resolvedOrder
        );
    }

    @Override
    public long getAttributeGroupId(long attributeSetId, String groupName) {
        return findGroupId(attributeSetId, groupName)
                .orElseThrow(() -> new CatalogException(CatalogConstants.MSG_GROUP_NOT_FOUND.formatted(groupName, attributeSetId)));
    }

    @Override
    public void addAttributeToSet(long attributeSetId, long attributeGroupId, String attributeCode, Integer sortOrder) {
        List<Long> attributeIds = jdbcTemplate.queryForList(
                "SELECT attribute_id FROM catalog_attribute WHERE attribute_code = ?",
                Long.class,
                attributeCode
        );
        if (attributeIds.isEmpty()) {
            throw new CatalogException(CatalogConstants.MSG_ATTRIBUTE_NOT_FOUND.formatted(attributeCode));
        }
        long attributeId = attributeIds.get(0);
        List<Integer> currentOrder = jdbcTemplate.queryForList(
                "SELECT sort_order FROM catalog_entity_attribute WHERE attribute_set_id = ? AND attribute_id = ?",
                Integer.class,
                attributeSetId,
                attributeId
        );
        if (!currentOrder.isEmpty()) {
            jdbcTemplate.update(
                    "UPDATE catalog_entity_attribute SET attribute_group_id = ?, sort_order = ? "
                            + "WHERE attribute_set_id = ? AND attribute_id = ?",
                    attributeGroupId,
                    sortOrder != null ? sortOrder : currentOrder.get(0),
                    attributeSetId,
                    attributeId
            );
            return;
        }
        jdbcTemplate.update(
                "INSERT INTO catalog_entity_attribute (attribute_set_id, attribute_group_id, attribute_id, sort_order) "
                        + "VALUES (?, ?, ?, ?)",
                attributeSetId,
                attributeGroupId,
                attributeId,
                sortOrder != null ? sortOrder : nextAttributeSortOrder(attributeGroupId)
        );
    }

    private Optional<Long> findGroupId(long attributeSetId, String groupName) {
        List<Long> ids = jdbcTemplate.queryForList(
                """
                SELECT attribute_group_id
                FROM catalog_attribute_group
                WHERE attribute_set_id = ? AND LOWER(attribute_group_name) = LOWER(?)
                ORDER BY attribute_group_id
                """,
                Long.class,
                attributeSetId,
                groupName.trim()
        );
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    private int nextGroupSortOrder(long attributeSetId) {
        Integer max = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(sort_order), 0) FROM catalog_attribute_group WHERE attribute_set_id = ?",
                Integer.class,
                attributeSetId
        );
        return (max == null ? 0 : max) + 1;
    }

    private int nextAttributeSortOrder(long attributeGroupId) {
        Integer max = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(sort_order), 0) FROM catalog_entity_attribute WHERE attribute_group_id = ?",
                Integer.class,
                attributeGroupId
        );
        return (max == null ? 0 : max) + 1;
    }
}
