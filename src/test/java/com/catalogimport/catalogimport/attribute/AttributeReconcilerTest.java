package com.catalogimport.catalogimport.attribute;

import com.catalogimport.catalogimport.attributeset.AttributeSetReconciler;
import com.catalogimport.catalogimport.catalog.AttributeDefinition;
import com.catalogimport.catalogimport.catalog.AttributeOption;
import com.catalogimport.catalogimport.catalog.CatalogAttribute;
import com.catalogimport.catalogimport.catalog.CatalogException;
import com.catalogimport.catalogimport.catalog.InMemoryCatalog;
import com.catalogimport.catalogimport.catalog.StoreLabel;
import com.catalogimport.catalogimport.importer.ImportBehavior;
import com.catalogimport.catalogimport.importer.ImportContext;
import com.catalogimport.catalogimport.importer.ImportProperties;
import com.catalogimport.catalogimport.store.StoreResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.catalogimport.catalogimport.attribute.AttributeRows.row;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttributeReconcilerTest {

    private InMemoryCatalog catalog;
    private ImportContext context;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryCatalog();
        context = new ImportContext(true, new StoreResolver(catalog, "admin"));
    }

    @Test
    void shouldCreateSelectAttributeWithOptionsDefaultAndSetAssignment() {
        AttributeRow row = row(
                "attribute_code", "color",
                "label", "Color",
                "input", "select",
                "option", "Red;Green;Blue",
                "default", "Green",
                "label_de", "Farbe"
        );

        reconciler(catalog).process(row, ImportBehavior.ADD, context);

        CatalogAttribute color = catalog.findAttribute("color").orElseThrow();
        assertEquals("select", color.frontendInput());
        assertEquals(List.of("Red", "Green", "Blue"), catalog.optionLabels("color"));
        assertEquals(String.valueOf(catalog.option("color", "Green").orElseThrow().optionId()), color.defaultValue());
        assertEquals(List.of(new StoreLabel(2L, "Farbe")), catalog.getStoreLabels("color"));
        assertTrue(catalog.assignment(InMemoryCatalog.DEFAULT_SET_ID, "color").isPresent());
        assertEquals(1, context.added());
        assertEquals(0, context.errorCount());
    }

    @Test
    void shouldSkipAddOfExistingAttribute() {
        catalog.putAttribute("color", "select", "Color", null);

        reconciler(catalog).process(row("attribute_code", "color", "label", "Colour"), ImportBehavior.ADD, context);

        assertEquals("Color", catalog.findAttribute("color").orElseThrow().frontendLabel());
        assertEquals(0, catalog.saveCalls());
        assertEquals(0, context.added());
        assertTrue(context.warnings().contains("Attribute 'color' already exists; skipping"));
    }

    @Test
    void shouldSkipBlankAttributeCode() {
        reconciler(catalog).process(row("attribute_code", " ", "label", "Nameless"), ImportBehavior.ADD, context);

        assertEquals(0, catalog.saveCalls());
        assertEquals(0, context.errorCount());
    }

    @Test
    void shouldDeleteExistingAndWarnAboutMissing() {
        catalog.putAttribute("color", "select", "Color", null);

        reconciler(catalog).process(row("attribute_code", "color"), ImportBehavior.DELETE, context);
        reconciler(catalog).process(row("attribute_code", "size"), ImportBehavior.DELETE, context);

        assertFalse(catalog.findAttribute("color").isPresent());
        assertEquals(1, context.deleted());
        assertEquals(0, context.errorCount());
        assertTrue(context.warnings().contains("Attribute 'size' does not exist and cannot be deleted; skipping"));
    }

    @Test
    void shouldUpsertAndSplitAddedFromUpdated() {
        catalog.putAttribute("color", "select", "Color", null);
        AttributeReconciler reconciler = reconciler(catalog);

        reconciler.process(row("attribute_code", "color", "label", "Colour"), ImportBehavior.UPDATE, context);
        reconciler.process(row("attribute_code", "size", "label", "Size"), ImportBehavior.UPDATE, context);

        assertEquals(1, context.updated());
        assertEquals(1, context.added());
        assertEquals("Colour", catalog.findAttribute("color").orElseThrow().frontendLabel());
        assertEquals("text", catalog.findAttribute("size").orElseThrow().frontendInput());
    }

    @Test
    void shouldInheritInputLabelAndDefaultWhenCellsAreBlank() {
        catalog.putAttribute("size", "text", "Size", "M");

        reconciler(catalog).process(row("attribute_code", "size", "input", "", "label", " ", "default", "", "is_filterable", "1"),
                ImportBehavior.UPDATE, context);

        Map<String, String> data = catalog.lastDefinition().data();
        assertEquals("text", data.get("input"));
        assertEquals("Size", data.get("label"));
        assertEquals("M", data.get("default"));
        assertEquals("1", data.get("is_filterable"));
        assertEquals("M", catalog.findAttribute("size").orElseThrow().defaultValue());
    }

    @Test
    void shouldMergeOptionsIntoExistingSelect() {
        catalog.putAttribute("color", "select", "Color", null);
        catalog.putOption("color", "Red", 1);
        catalog.putOption("color", "Green", 2);

        reconciler(catalog).process(row("attribute_code", "color", "option", "red;GREEN;Yellow"), ImportBehavior.UPDATE, context);

        assertEquals(List.of("Red", "Green", "Yellow"), catalog.optionLabels("color"));
        assertEquals(1, catalog.addOptionCalls());
        assertEquals(1, context.updated());
    }

    @Test
    void shouldRebuildOptionsWhenInputTypeChanges() {
        catalog.putAttribute("color", "select", "Color", null);
        long oldRed = catalog.putOption("color", "Red", 1);
        ImportContext quiet = new ImportContext(false, new StoreResolver(catalog, "admin"));

        reconciler(catalog).process(
                row("attribute_code", "color", "input", "MultiSelect", "option", "Red;Blue", "default", "Blue;Red"),
                ImportBehavior.UPDATE,
                quiet
        );

        CatalogAttribute color = catalog.findAttribute("color").orElseThrow();
        assertEquals(List.of("Red", "Blue"), catalog.optionLabels("color"));
        long newRed = catalog.option("color", "Red").orElseThrow().optionId();
        long blue = catalog.option("color", "Blue").orElseThrow().optionId();
        assertTrue(newRed != oldRed);
        assertEquals(blue + "," + newRed, color.defaultValue());
        assertEquals("array", color.backendModel());
        assertEquals(0, catalog.addOptionCalls());
        assertTrue(quiet.warnings().stream().anyMatch(message -> message.contains("changes from 'select' to 'MultiSelect'")));
    }

    @Test
    void shouldKeepStoredOptionsWhenInputChangesWithoutOptions() {
        catalog.putAttribute("color", "select", "Color", "5");
        catalog.putOption("color", "Red", 1);

        reconciler(catalog).process(row("attribute_code", "color", "input", "text"), ImportBehavior.UPDATE, context);

        assertEquals(List.of("Red"), catalog.optionLabels("color"));
        assertEquals("text", catalog.findAttribute("color").orElseThrow().frontendInput());
        assertEquals("5", catalog.findAttribute("color").orElseThrow().defaultValue());
    }

    @Test
    void shouldJoinApplyToAsDistinctCommaList() {
        reconciler(catalog).process(
                row("attribute_code", "weight", "apply_to", "simple; virtual;simple", "sort_order", "4", "group_order", "2"),
                ImportBehavior.ADD,
                context
        );

        Map<String, String> data = catalog.lastDefinition().data();
        assertEquals("simple,virtual", data.get("apply_to"));
        assertFalse(data.containsKey("sort_order"));
        assertFalse(data.containsKey("group_order"));
        assertEquals(Integer.valueOf(4), catalog.assignment(InMemoryCatalog.DEFAULT_SET_ID, "weight").orElseThrow().sortOrder());
    }

    @Test
    void shouldCountSaveFailureAndStopRow() {
        InMemoryCatalog failing = new InMemoryCatalog() {
            @Override
            public void saveAttribute(String attributeCode, AttributeDefinition definition) {
                throw new CatalogException("disk full");
            }
        };

        reconciler(failing).process(row("attribute_code", "color", "label", "Color"), ImportBehavior.ADD, context);

        assertEquals(1, context.errorCount());
        assertEquals(0, context.added());
    }

    @Test
    void shouldCountPostSaveFailureButKeepRowAsAdded() {
        InMemoryCatalog failing = new InMemoryCatalog() {
            @Override
            public long getDefaultGroupId(long attributeSetId) {
                throw new CatalogException("groups unavailable");
            }
        };

        reconciler(failing).process(row("attribute_code", "color", "label", "Color", "label_de", "Farbe"), ImportBehavior.ADD, context);

        assertEquals(1, context.added());
        assertEquals(1, context.errorCount());
        assertEquals(List.of(new StoreLabel(2L, "Farbe")), failing.getStoreLabels("color"));
        assertNull(failing.findAttribute("color").orElseThrow().defaultValue());
    }

    @Test
    void shouldCountStoreLookupFailureInOptionStepAndEndRow() {
        InMemoryCatalog failing = new InMemoryCatalog() {
            @Override
            public Optional<Long> findStoreId(String storeCode) {
                throw new CatalogException("store table unavailable");
            }
        };
        ImportContext failingContext = new ImportContext(false, new StoreResolver(failing, "admin"));
        AttributeRow row = row("attribute_code", "color", "input", "select", "option", "Red", "option_de", "Rot");

        assertDoesNotThrow(() -> reconciler(failing).process(row, ImportBehavior.ADD, failingContext));

        assertEquals(1, failingContext.errorCount());
        assertEquals(0, failingContext.added());
        assertEquals(0, failing.saveCalls());
    }

    @Test
    void shouldCountFailedFollowUpOptionPassAsPostSaveError() {
        InMemoryCatalog failing = new InMemoryCatalog() {
            @Override
            public List<AttributeOption> getOptions(String attributeCode) {
                throw new CatalogException("option table locked");
            }
        };
        failing.putAttribute("color", "select", "Color", null);
        ImportContext failingContext = new ImportContext(false, new StoreResolver(failing, "admin"));

        assertDoesNotThrow(() -> reconciler(failing).process(
                row("attribute_code", "color", "input", "multiselect", "option", "Red;Blue"),
                ImportBehavior.UPDATE,
                failingContext
        ));

        assertEquals(1, failingContext.updated());
        assertTrue(failingContext.errorCount() >= 1);
        assertEquals(List.of("Red", "Blue"), failing.optionLabels("color"));
    }

    private static AttributeReconciler reconciler(InMemoryCatalog catalog) {
        ImportProperties properties = new ImportProperties();
        return new AttributeReconciler(
                catalog,
                new OptionReconciler(catalog, properties),
                new LabelAssigner(catalog),
                new AttributeSetReconciler(catalog, properties),
                properties
        );
    }
}
