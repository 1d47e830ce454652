package com.catalogimport.catalogimport.catalog;

import com.catalogimport.catalogimport.importer.ImportConstants;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AttributeCatalog} over the catalog metadata tables. Attribute lookups are cached per code
 * until {@link #invalidateCache()} is called or the attribute is written.
 */
@Repository
public class JdbcAttributeCatalog implements AttributeCatalog {

    private static final Map<String, String> COLUMN_BY_FIELD = Map.of(
            ImportConstants.COLUMN_INPUT, "frontend_input",
            ImportConstants.COLUMN_LABEL, "frontend_label",
            ImportConstants.COLUMN_DEFAULT, "default_value",
            ImportConstants.COLUMN_BACKEND, "backend_model",
            ImportConstants.COLUMN_SOURCE, "source_model",
            ImportConstants.COLUMN_APPLY_TO, "apply_to"
    );

    private final JdbcTemplate jdbcTemplate;
    private final Map<String, CatalogAttribute> attributeCache = new HashMap<>();

    public JdbcAttributeCatalog(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<CatalogAttribute> findAttribute(String attributeCode) {
        CatalogAttribute cached = attributeCache.get(attributeCode);
        if (cached != null) {
            return Optional.of(cached);
        }
        List<CatalogAttribute> found = jdbcTemplate.query(
                """
                SELECT attribute_id, attribute_code, frontend_input, frontend_label, default_value,
                       backend_model, source_model, apply_to
                FROM catalog_attribute
                WHERE attribute_code = ?
                """,
                (rs, rowNum) -> new CatalogAttribute(
                        rs.getLong("attribute_id"),
                        rs.getString("attribute_code"),
                        rs.getString("frontend_input"),
                        rs.getString("frontend_label"),
                        rs.getString("default_value"),
                        rs.getString("backend_model"),
                        rs.getString("source_model"),
                        rs.getString("apply_to"),
                        loadProperties(rs.getLong("attribute_id"))
                ),
                attributeCode
        );
        if (found.isEmpty()) {
            return Optional.empty();
        }
        attributeCache.put(attributeCode, found.get(0));
        return Optional.of(found.get(0));
    }

    @Override
    public void saveAttribute(String attributeCode, AttributeDefinition definition) {
        attributeCache.remove(attributeCode);
        Optional<Long> existingId = findAttributeId(attributeCode);
        long attributeId = existingId.isPresent()
                ? updateAttribute(existingId.get(), definition.data())
                : insertAttribute(attributeCode, definition.data());

        for (Map.Entry<String, String> entry : definition.data().entrySet()) {
            if (!COLUMN_BY_FIELD.containsKey(entry.getKey())) {
                saveProperty(attributeId, entry.getKey(), entry.getValue());
            }
        }
        if (definition.rebuildOptions()) {
            deleteAllOptions(attributeId);
        }
        for (OptionDraft option : definition.options()) {
            insertOption(attributeId, option);
        }
    }

    @Override
    public void removeAttribute(String attributeCode) {
        long attributeId = requireAttributeId(attributeCode);
        attributeCache.remove(attributeCode);
        deleteAllOptions(attributeId);
        jdbcTemplate.update("DELETE FROM catalog_attribute_label WHERE attribute_id = ?", attributeId);
        jdbcTemplate.update("DELETE FROM catalog_attribute_property WHERE attribute_id = ?", attributeId);
        jdbcTemplate.update("DELETE FROM catalog_entity_attribute WHERE attribute_id = ?", attributeId);
        jdbcTemplate.update("DELETE FROM catalog_attribute WHERE attribute_id = ?", attributeId);
    }

    @Override
    public List<AttributeOption> getOptions(String attributeCode) {
        long attributeId = requireAttributeId(attributeCode);
        Map<Long, Map<Long, String>> labelsByOption = new LinkedHashMap<>();
        jdbcTemplate.query(
                """
                SELECT l.option_id, l.store_id, l.label
                FROM catalog_attribute_option_label l
                JOIN catalog_attribute_option o ON o.option_id = l.option_id
                WHERE o.attribute_id = ?
                ORDER BY l.option_id, l.store_id
                """,
                rs -> {
                    labelsByOption.computeIfAbsent(rs.getLong("option_id"), id -> new LinkedHashMap<>())
                            .put(rs.getLong("store_id"), rs.getString("label"));
                },
                attributeId
        );
        return jdbcTemplate.query(
                "SELECT option_id, sort_order FROM catalog_attribute_option WHERE attribute_id = ? ORDER BY sort_order, option_id",
                (rs, rowNum) -> {
                    long optionId = rs.getLong("option_id");
                    Map<Long, String> labels = labelsByOption.getOrDefault(optionId, Map.of());
                    Map<Long, String> storeLabels = new LinkedHashMap<>(labels);
                    String adminLabel = storeLabels.remove(ImportConstants.ADMIN_STORE_ID);
                    return new AttributeOption(optionId, adminLabel == null ? "" : adminLabel, rs.getInt("sort_order"), storeLabels);
                },
                attributeId
        );
    }

    @Override
    public long addOption(String attributeCode, OptionDraft option) {
        return insertOption(requireAttributeId(attributeCode), option);
    }

    @Override
    public void deleteOption(String attributeCode, long optionId) {
        long attributeId = requireAttributeId(attributeCode);
        int removed = jdbcTemplate.update(
                "DELETE FROM catalog_attribute_option WHERE option_id = ? AND attribute_id = ?",
                optionId,
                attributeId
        );
        if (removed > 0) {
            jdbcTemplate.update("DELETE FROM catalog_attribute_option_label WHERE option_id = ?", optionId);
        }
    }

    @Override
    public void updateDefaultValue(String attributeCode, String defaultValue) {
        long attributeId = requireAttributeId(attributeCode);
        attributeCache.remove(attributeCode);
        jdbcTemplate.update("UPDATE catalog_attribute SET default_value = ? WHERE attribute_id = ?", defaultValue, attributeId);
    }

    @Override
    public List<StoreLabel> getStoreLabels(String attributeCode) {
        long attributeId = requireAttributeId(attributeCode);
        return jdbcTemplate.query(
                "SELECT store_id, label FROM catalog_attribute_label WHERE attribute_id = ? ORDER BY store_id",
                (rs, rowNum) -> new StoreLabel(rs.getLong("store_id"), rs.getString("label")),
                attributeId
        );
    }

    @Override
    public void saveStoreLabels(String attributeCode, List<StoreLabel> storeLabels) {
        long attributeId = requireAttributeId(attributeCode);
        jdbcTemplate.update("DELETE FROM catalog_attribute_label WHERE attribute_id = ?", attributeId);
        for (StoreLabel storeLabel : storeLabels) {
            jdbcTemplate.update(
                    "INSERT INTO catalog_attribute_label (attribute_id, store_id, label) VALUES (?, ?, ?)",
                    attributeId,
                    storeLabel.storeId(),
                    storeLabel.label()
            );
        }
    }

    @Override
    public void invalidateCache() {
        attributeCache.clear();
    }

    private long insertAttribute(String attributeCode, Map<String, String> data) {
        String frontendInput = blankToNull(data.get(ImportConstants.COLUMN_INPUT));
        jdbcTemplate.update(
                """
                INSERT INTO catalog_attribute (attribute_code, frontend_input, frontend_label, default_value,
                                               backend_model, source_model, apply_to)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """,
                attributeCode,
                frontendInput == null ? CatalogConstants.DEFAULT_FRONTEND_INPUT : frontendInput,
                blankToNull(data.get(ImportConstants.COLUMN_LABEL)),
                blankToNull(data.get(ImportConstants.COLUMN_DEFAULT)),
                blankToNull(data.get(ImportConstants.COLUMN_BACKEND)),
                blankToNull(data.get(ImportConstants.COLUMN_SOURCE)),
                blankToNull(data.get(ImportConstants.COLUMN_APPLY_TO))
        );
        return requireAttributeId(attributeCode);
    }

    /**
     * Writes only the modelled columns present in the payload; absent fields keep their stored value.
     */
    private long updateAttribute(long attributeId, Map<String, String> data) {
        for (Map.Entry<String, String> entry : COLUMN_BY_FIELD.entrySet()) {
            if (!data.containsKey(entry.getKey())) {
                continue;
            }
            jdbcTemplate.update(
                    "UPDATE catalog_attribute SET " + entry.getValue() + " = ? WHERE attribute_id = ?",
                    blankToNull(data.get(entry.getKey())),
                    attributeId
            );
        }
        return attributeId;
    }

    private void saveProperty(long attributeId, String name, String value) {
        int updated = jdbcTemplate.update(
                "UPDATE catalog_attribute_property SET property_value = ? WHERE attribute_id = ? AND property_name = ?",
                value,
                attributeId,
                name
        );
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO catalog_attribute_property (attribute_id, property_name, property_value) VALUES (?, ?, ?)",
                    attributeId,
                    name,
                    value
            );
        }
    }

    private Map<String, String> loadProperties(long attributeId) {
        Map<String, String> properties = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT property_name, property_value FROM catalog_attribute_property WHERE attribute_id = ? ORDER BY property_name",
                rs -> {
                    String value = rs.getString("property_value");
                    properties.put(rs.getString("property_name"), value == null ? "" : value);
                },
                attributeId
        );
        return properties;
    }

    /**
     * Inserts the option and its labels; a missing sort order places it after the current last option.
     */
    private long insertOption(long attributeId, OptionDraft option) {
        int sortOrder = option.sortOrder() != null ? option.sortOrder() : nextOptionSortOrder(attributeId);
        jdbcTemplate.update("INSERT INTO catalog_attribute_option (attribute_id, sort_order) VALUES (?, ?)", attributeId, sortOrder);
        Long optionId = jdbcTemplate.queryForObject(
                "SELECT MAX(option_id) FROM catalog_attribute_option WHERE attribute_id = ?",
                Long.class,
                attributeId
        );
        if (optionId == null) {
            throw new CatalogException(CatalogConstants.MSG_ID_NOT_GENERATED.formatted("catalog_attribute_option"));
        }
        insertOptionLabel(optionId, ImportConstants.ADMIN_STORE_ID, option.label());
        for (Map.Entry<Long, String> storeLabel : option.storeLabels().entrySet()) {
            if (storeLabel.getKey() != ImportConstants.ADMIN_STORE_ID) {
                insertOptionLabel(optionId, storeLabel.getKey(), storeLabel.getValue());
            }
        }
        return optionId;
    }

    private void insertOptionLabel(long optionId, long storeId, String label) {
        jdbcTemplate.update(
                "INSERT INTO catalog_attribute_option_label (option_id, store_id, label) VALUES (?, ?, ?)",
                optionId,
                storeId,
                label
        );
    }

    private int nextOptionSortOrder(long attributeId) {
        Integer max = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(sort_order), 0) FROM catalog_attribute_option WHERE attribute_id = ?",
                Integer.class,
                attributeId
        );
        return (max == null ? 0 : max) + 1;
    }

    private void deleteAllOptions(long attributeId) {
        jdbcTemplate.update(
                "DELETE FROM catalog_attribute_option_label WHERE option_id IN "
                        + "(SELECT option_id FROM catalog_attribute_option WHERE attribute_id = ?)",
                attributeId
        );
        jdbcTemplate.update("DELETE FROM catalog_attribute_option WHERE attribute_id = ?", attributeId);
    }

    private Optional<Long> findAttributeId(String attributeCode) {
        List<Long> ids = jdbcTemplate.queryForList(
                "SELECT attribute_id FROM catalog_attribute WHERE attribute_code = ?",
                Long.class,
                attributeCode
        );
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    private long requireAttributeId(String attributeCode) {
        return findAttributeId(attributeCode)
                .orElseThrow(() -> new CatalogException(CatalogConstants.MSG_ATTRIBUTE_NOT_FOUND.formatted(attributeCode)));
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
