package com.catalogimport.catalogimport.catalog;

import com.catalogimport.catalogimport.importer.ImportConstants;
import com.catalogimport.catalogimport.importer.ImportProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the catalog metadata tables at startup and seeds the admin store, the default store view
 * and the default attribute set with its default group.
 */
@Component
public class CatalogSchemaInitializer {

    private final JdbcTemplate jdbcTemplate;
    private final ImportProperties importProperties;

    public CatalogSchemaInitializer(JdbcTemplate jdbcTemplate, ImportProperties importProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.importProperties = importProperties;
    }

    @PostConstruct
    public void initializeSchema() {
        ensureStoreTable();
        ensureAttributeTables();
        ensureOptionTables();
        ensureAttributeSetTables();
        seedStores();
        seedDefaultAttributeSet();
    }

    private void ensureStoreTable() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS catalog_store (
                    store_id BIGINT PRIMARY KEY,
                    code VARCHAR(64) NOT NULL,
                    name VARCHAR(255)
                )
                """);
        jdbcTemplate.execute("CREATE UNIQUE INDEX IF NOT EXISTS uk_catalog_store_code ON catalog_store(code)");
    }

    private void ensureAttributeTables() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS catalog_attribute (
                    attribute_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    attribute_code VARCHAR(255) NOT NULL,
                    frontend_input VARCHAR(64),
                    frontend_label VARCHAR(255),
                    default_value VARCHAR(1024),
                    backend_model VARCHAR(255),
                    source_model VARCHAR(255),
                    apply_to VARCHAR(255)
                )
                """);
        jdbcTemplate.execute("CREATE UNIQUE INDEX IF NOT EXISTS uk_catalog_attribute_code ON catalog_attribute(attribute_code)");
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS catalog_attribute_property (
                    attribute_id BIGINT NOT NULL,
                    property_name VARCHAR(255) NOT NULL,
                    property_value VARCHAR(1024),
                    PRIMARY KEY (attribute_id, property_name)
                )
                """);
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS catalog_attribute_label (
                    attribute_id BIGINT NOT NULL,
                    store_id BIGINT NOT NULL,
                    label VARCHAR(255) NOT NULL,
                    PRIMARY KEY (attribute_id, store_id)
                )
                """);
    }

    private void ensureOptionTables() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS catalog_attribute_option (
                    option_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    attribute_id BIGINT NOT NULL,
                    sort_order INT NOT NULL
                )
                """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_catalog_attribute_option_attribute ON catalog_attribute_option(attribute_id)");
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS catalog_attribute_option_label (
                    option_id BIGINT NOT NULL,
                    store_id BIGINT NOT NULL,
                    label VARCHAR(255) NOT NULL,
                    PRIMARY KEY (option_id, store_id)
                )
                """);
    }

    private void ensureAttributeSetTables() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS catalog_attribute_set (
                    attribute_set_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    attribute_set_name VARCHAR(255) NOT NULL,
                    sort_order INT NOT NULL
                )
                """);
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS catalog_attribute_group (
                    attribute_group_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                    attribute_set_id BIGINT NOT NULL,
                    attribute_group_name VARCHAR(255) NOT NULL,
                    sort_order INT NOT NULL,
                    is_default BOOLEAN NOT NULL
                )
                """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_catalog_attribute_group_set ON catalog_attribute_group(attribute_set_id)");
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS catalog_entity_attribute (
                    attribute_set_id BIGINT NOT NULL,
                    attribute_group_id BIGINT NOT NULL,
                    attribute_id BIGINT NOT NULL,
                    sort_order INT NOT NULL,
                    PRIMARY KEY (attribute_set_id, attribute_id)
                )
                """);
    }

    private void seedStores() {
        seedStore(ImportConstants.ADMIN_STORE_ID, importProperties.getAdminStoreCode(), "Admin");
        seedStore(CatalogConstants.DEFAULT_STORE_VIEW_ID, CatalogConstants.DEFAULT_STORE_VIEW_CODE, "Default Store View");
    }

    private void seedStore(long storeId, String code, String name) {
        Integer existing = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM catalog_store WHERE store_id = ?",
                Integer.class,
                storeId
        );
        if (existing == null || existing == 0) {
            jdbcTemplate.update("INSERT INTO catalog_store (store_id, code, name) VALUES (?, ?, ?)", storeId, code, name);
        }
    }

    private void seedDefaultAttributeSet() {
        String defaultSetName = importProperties.getDefaultAttributeSetName();
        Integer existing = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM catalog_attribute_set WHERE LOWER(attribute_set_name) = LOWER(?)",
                Integer.class,
                defaultSetName
        );
        if (existing != null && existing > 0) {
            return;
        }
        jdbcTemplate.update(
                "INSERT INTO catalog_attribute_set (attribute_set_name, sort_order) VALUES (?, 0)",
                defaultSetName
        );
        Long defaultSetId = jdbcTemplate.queryForObject(
                "SELECT MIN(attribute_set_id) FROM catalog_attribute_set WHERE LOWER(attribute_set_name) = LOWER(?)",
                Long.class,
                defaultSetName
        );
        jdbcTemplate.update(
                "INSERT INTO catalog_attribute_group (attribute_set_id, attribute_group_name, sort_order, is_default) "
                        + "VALUES (?, ?, 1, TRUE)",
                defaultSetId,
                ImportConstants.DEFAULT_GROUP_NAME
        );
    }
}
