package com.catalogimport.catalogimport.importer;

import com.catalogimport.catalogimport.catalog.AttributeCatalog;
import com.catalogimport.catalogimport.catalog.AttributeOption;
import com.catalogimport.catalogimport.catalog.AttributeSetCatalog;
import com.catalogimport.catalogimport.catalog.AttributeSetRecord;
import com.catalogimport.catalogimport.catalog.CatalogAttribute;
import com.catalogimport.catalogimport.catalog.CatalogSchemaInitializer;
import com.catalogimport.catalogimport.catalog.StoreLabel;
import com.catalogimport.catalogimport.csv.CsvValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class CatalogImportServiceTest {

    @Autowired
    private CatalogImportService catalogImportService;

    @Autowired
    private AttributeCatalog attributeCatalog;

    @Autowired
    private AttributeSetCatalog attributeSetCatalog;

    @Autowired
    private CatalogSchemaInitializer catalogSchemaInitializer;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetTables() {
        jdbcTemplate.execute("DELETE FROM catalog_entity_attribute");
        jdbcTemplate.execute("DELETE FROM catalog_attribute_group");
        jdbcTemplate.execute("DELETE FROM catalog_attribute_set");
        jdbcTemplate.execute("DELETE FROM catalog_attribute_option_label");
        jdbcTemplate.execute("DELETE FROM catalog_attribute_option");
        jdbcTemplate.execute("DELETE FROM catalog_attribute_label");
        jdbcTemplate.execute("DELETE FROM catalog_attribute_property");
        jdbcTemplate.execute("DELETE FROM catalog_attribute");
        jdbcTemplate.execute("DELETE FROM catalog_store");
        catalogSchemaInitializer.initializeSchema();
        attributeCatalog.invalidateCache();
    }

    @Test
    void shouldAddSelectAttributeWithOptionsAndDefault() {
        ImportSummary summary = catalogImportService.run("attributes_add.csv", "attribute", "add", false);

        assertTrue(summary.successful());
        assertEquals(1, summary.added());
        CatalogAttribute color = attributeCatalog.findAttribute("color").orElseThrow();
        assertEquals("select", color.frontendInput());
        assertEquals("Color", color.frontendLabel());
        List<AttributeOption> options = attributeCatalog.getOptions("color");
        assertEquals(List.of("Red", "Green", "Blue"), options.stream().map(AttributeOption::label).toList());
        assertEquals(String.valueOf(optionId(options, "Green")), color.defaultValue());

        Integer assigned = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM catalog_entity_attribute WHERE attribute_set_id = ? AND attribute_id = ?",
                Integer.class,
                attributeSetCatalog.getDefaultAttributeSetId(),
                color.attributeId()
        );
        assertEquals(1, assigned);
    }

    @Test
    void shouldSkipExistingAttributeOnSecondAdd() {
        catalogImportService.run("attributes_add.csv", "attribute", "add", false);

        ImportSummary summary = catalogImportService.run("attributes_add.csv", "attribute", "add", false);

        assertTrue(summary.successful());
        assertEquals(0, summary.added());
        assertEquals(3, attributeCatalog.getOptions("color").size());
    }

    @Test
    void shouldAddOnlyMissingOptionsOnUpdate() {
        catalogImportService.run("attributes_add.csv", "attribute", "add", false);
        long red = optionId(attributeCatalog.getOptions("color"), "Red");
        String defaultValue = attributeCatalog.findAttribute("color").orElseThrow().defaultValue();

        ImportSummary summary = catalogImportService.run("attributes_update.csv", "attribute", "update", false);

        assertTrue(summary.successful());
        assertEquals(1, summary.updated());
        assertEquals(0, summary.added());
        List<AttributeOption> options = attributeCatalog.getOptions("color");
        assertEquals(List.of("Red", "Green", "Blue", "Yellow"), options.stream().map(AttributeOption::label).toList());
        assertEquals(red, optionId(options, "Red"));
        assertEquals(defaultValue, attributeCatalog.findAttribute("color").orElseThrow().defaultValue());
    }

    @Test
    void shouldDeleteAttributesListedInFile() {
        catalogImportService.run("attributes_add.csv", "attribute", "add", false);

        ImportSummary summary = catalogImportService.run("attributes_add.csv", "attribute", "delete", false);

        assertEquals(1, summary.deleted());
        assertFalse(attributeCatalog.findAttribute("color").isPresent());
        Integer optionRows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM catalog_attribute_option", Integer.class);
        assertEquals(0, optionRows);
    }

    @Test
    void shouldImportStoreScopedLabelsOrdersSetsAndGroups() {
        ImportSummary summary = catalogImportService.run("attributes_full.csv", "attribute", "add", true);

        assertTrue(summary.successful());
        CatalogAttribute material = attributeCatalog.findAttribute("material").orElseThrow();
        assertEquals("multiselect", material.frontendInput());
        assertEquals("array", material.backendModel());
        assertEquals("simple,configurable", material.applyTo());
        assertEquals(List.of(new StoreLabel(1L, "Stoff")), attributeCatalog.getStoreLabels("material"));

        List<AttributeOption> options = attributeCatalog.getOptions("material");
        Map<String, Integer> orders = options.stream()
                .collect(Collectors.toMap(AttributeOption::label, AttributeOption::sortOrder));
        assertEquals(Map.of("Cotton", 20, "Linen", 10, "Wool", 30), orders);
        AttributeOption cotton = options.stream().filter(option -> option.label().equals("Cotton")).findFirst().orElseThrow();
        assertEquals(Map.of(1L, "Baumwolle"), cotton.storeLabels());

        AttributeSetRecord apparel = attributeSetCatalog.findAttributeSet("Apparel").orElseThrow();
        long fabric = attributeSetCatalog.getAttributeGroupId(apparel.attributeSetId(), "Fabric");
        Integer groupOrder = jdbcTemplate.queryForObject(
                "SELECT sort_order FROM catalog_attribute_group WHERE attribute_group_id = ?",
                Integer.class,
                fabric
        );
        assertEquals(5, groupOrder);
        Map<String, Object> assignment = jdbcTemplate.queryForMap(
                "SELECT attribute_group_id, sort_order FROM catalog_entity_attribute WHERE attribute_set_id = ? AND attribute_id = ?",
                apparel.attributeSetId(),
                material.attributeId()
        );
        assertEquals(fabric, ((Number) assignment.get("attribute_group_id")).longValue());
        assertEquals(3, ((Number) assignment.get("sort_order")).intValue());
        assertTrue(summary.warnings().contains("Attribute set 'Apparel' does not exist; created it for attribute 'material'"));
    }

    @Test
    void shouldDeleteExistingSetsAndSkipMissingOnes() {
        attributeSetCatalog.createAttributeSet("Legacy Set", null, attributeSetCatalog.getDefaultAttributeSetId());

        ImportSummary summary = catalogImportService.run("attribute_sets_delete.csv", "attribute-set", "delete", false);

        assertTrue(summary.successful());
        assertEquals(1, summary.deleted());
        assertTrue(attributeSetCatalog.findAttributeSet("Legacy Set").isEmpty());
        assertTrue(summary.warnings().contains("Attribute set 'Obsolete Set' does not exist; skipping"));
    }

    @Test
    void shouldNeverDeleteDefaultSet() {
        attributeSetCatalog.createAttributeSet("Seasonal", 2, attributeSetCatalog.getDefaultAttributeSetId());

        ImportSummary summary = catalogImportService.run("attribute_sets_default.csv", "attribute-set", "delete", false);

        assertTrue(summary.successful());
        assertEquals(1, summary.deleted());
        assertTrue(attributeSetCatalog.findAttributeSet("Default").isPresent());
        assertTrue(attributeSetCatalog.findAttributeSet("Seasonal").isEmpty());
    }

    @Test
    void shouldRejectNonDeleteBehaviorForAttributeSets() {
        ImportValidationException ex = assertThrows(ImportValidationException.class,
                () -> catalogImportService.run("attribute_sets_delete.csv", "attribute-set", "add", false));
        assertEquals("Invalid --behavior 'add' for type 'attribute-set'; must be 'delete'", ex.getMessage());
    }

    @Test
    void shouldRejectUnknownTypeAndBehavior() {
        assertThrows(ImportValidationException.class,
                () -> catalogImportService.run("attributes_add.csv", "product", "add", false));
        assertThrows(ImportValidationException.class,
                () -> catalogImportService.run("attributes_add.csv", "attribute", "append", false));
    }

    @Test
    void shouldFailOnMalformedFileBeforeAnyRow() {
        CsvValidationException ex = assertThrows(CsvValidationException.class,
                () -> catalogImportService.run("malformed.csv", "attribute", "add", false));
        assertTrue(ex.getMessage().contains("line 2"));
        assertFalse(attributeCatalog.findAttribute("color").isPresent());
    }

    @Test
    void shouldRequireAttributeCodeColumn() {
        ImportValidationException ex = assertThrows(ImportValidationException.class,
                () -> catalogImportService.run("missing_code.csv", "attribute", "add", false));
        assertEquals("The CSV file is missing the 'attribute_code' column", ex.getMessage());
    }

    private static long optionId(List<AttributeOption> options, String label) {
        return options.stream()
                .filter(option -> option.label().equals(label))
                .findFirst()
                .orElseThrow()
                .optionId();
    }
}
