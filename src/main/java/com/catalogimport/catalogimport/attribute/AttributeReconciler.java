package com.catalogimport.catalogimport.attribute;

import com.catalogimport.catalogimport.attributeset.AttributeSetReconciler;
import com.catalogimport.catalogimport.catalog.AttributeCatalog;
import com.catalogimport.catalogimport.catalog.AttributeDefinition;
import com.catalogimport.catalogimport.catalog.OptionDraft;
import com.catalogimport.catalogimport.csv.ColumnRole;
import com.catalogimport.catalogimport.csv.CsvTable;
import com.catalogimport.catalogimport.csv.HeaderColumn;
import com.catalogimport.catalogimport.importer.ImportBehavior;
import com.catalogimport.catalogimport.importer.ImportConstants;
import com.catalogimport.catalogimport.importer.ImportContext;
import com.catalogimport.catalogimport.importer.ImportProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Applies one attribute row: add, update (upsert) or delete, followed by default, store label and
 * attribute set handling. Failures are counted on the context and never stop the run.
 */
@Component
public class AttributeReconciler {

    private final AttributeCatalog attributeCatalog;
    private final OptionReconciler optionReconciler;
    private final LabelAssigner labelAssigner;
    private final AttributeSetReconciler attributeSetReconciler;
    private final ImportProperties importProperties;

    public AttributeReconciler(
            AttributeCatalog attributeCatalog,
            OptionReconciler optionReconciler,
            LabelAssigner labelAssigner,
            AttributeSetReconciler attributeSetReconciler,
            ImportProperties importProperties
    ) {
        this.attributeCatalog = attributeCatalog;
        this.optionReconciler = optionReconciler;
        this.labelAssigner = labelAssigner;
        this.attributeSetReconciler = attributeSetReconciler;
        this.importProperties = importProperties;
    }

    public void process(AttributeRow row, ImportBehavior behavior, ImportContext context) {
        String code = row.code();
        if (code.isEmpty()) {
            return;
        }

        ExistingAttributeSnapshot existing = new ExistingAttributeSnapshot(attributeCatalog, code);
        boolean exists;
        try {
            exists = existing.exists();
        } catch (RuntimeException ex) {
            context.error(AttributeConstants.MSG_LOOKUP_FAILED.formatted(code, ex.getMessage()), ex);
            return;
        }

        if (behavior == ImportBehavior.DELETE) {
            delete(code, exists, context);
            return;
        }
        if (behavior == ImportBehavior.ADD && exists) {
            context.warn(AttributeConstants.MSG_ALREADY_EXISTS.formatted(code));
            return;
        }
        context.info((exists ? AttributeConstants.MSG_UPDATING : AttributeConstants.MSG_ADDING).formatted(code));
        save(row, existing, exists, context);
    }

    private void delete(String code, boolean exists, ImportContext context) {
        if (!exists) {
            context.warn(AttributeConstants.MSG_DOES_NOT_EXIST.formatted(code));
            return;
        }
        context.info(AttributeConstants.MSG_DELETING.formatted(code));
        try {
            attributeCatalog.removeAttribute(code);
            attributeCatalog.invalidateCache();
            context.recordDeleted();
        } catch (RuntimeException ex) {
            context.error(AttributeConstants.MSG_DELETE_FAILED.formatted(code, ex.getMessage()), ex);
        }
    }

    private void save(AttributeRow row, ExistingAttributeSnapshot existing, boolean exists, ImportContext context) {
        String code = row.code();
        Map<String, String> data = buildData(row);

        String rowInput = row.cell(ImportConstants.COLUMN_INPUT);
        String storedInput = exists ? inherit(existing::frontendInput, "input type", code, context) : "";
        String frontendInput = rowInput.isEmpty() ? storedInput : rowInput;
        if (!frontendInput.isEmpty()) {
            data.put(ImportConstants.COLUMN_INPUT, frontendInput);
        }
        if (exists && row.isBlank(ImportConstants.COLUMN_LABEL)) {
            putIfNotBlank(data, ImportConstants.COLUMN_LABEL, inherit(existing::defaultLabel, "label", code, context));
        }

        boolean optionInput = OptionReconciler.isOptionInput(frontendInput) && row.isBlank(ImportConstants.COLUMN_SOURCE);
        if (optionInput) {
            // option defaults are resolved to identifiers once the options are stored
            data.remove(ImportConstants.COLUMN_DEFAULT);
        } else if (exists && row.isBlank(ImportConstants.COLUMN_DEFAULT)) {
            putIfNotBlank(data, ImportConstants.COLUMN_DEFAULT, inherit(existing::defaultValue, "default value", code, context));
        }

        if (OptionReconciler.isMultiselect(frontendInput) && row.isBlank(ImportConstants.COLUMN_BACKEND)) {
            data.put(ImportConstants.COLUMN_BACKEND, importProperties.getMultiselectBackendModel());
        }

        boolean inputChanging = exists
                && !rowInput.isEmpty()
                && !storedInput.isEmpty()
                && !rowInput.equalsIgnoreCase(storedInput);
        if (inputChanging) {
            context.warn(AttributeConstants.MSG_INPUT_CHANGE.formatted(code, storedInput, rowInput));
        }

        OptionPass pass = !exists || inputChanging ? OptionPass.CREATE : OptionPass.MERGE;
        List<OptionDraft> options;
        try {
            options = optionReconciler.reconcile(row, frontendInput, pass, context);
        } catch (RuntimeException ex) {
            context.error(AttributeConstants.MSG_OPTIONS_FAILED.formatted(code, ex.getMessage()), ex);
            return;
        }
        boolean rebuildOptions = inputChanging && !options.isEmpty();
        if (rebuildOptions && row.isBlank(ImportConstants.COLUMN_DEFAULT)) {
            data.put(ImportConstants.COLUMN_DEFAULT, "");
        }

        try {
            attributeCatalog.saveAttribute(code, new AttributeDefinition(data, options, rebuildOptions));
            attributeCatalog.invalidateCache();
        } catch (RuntimeException ex) {
            String action = exists ? "updating" : "adding";
            context.error(AttributeConstants.MSG_SAVE_FAILED.formatted(action, code, ex.getMessage()), ex);
            return;
        }
        if (exists) {
            context.recordUpdated();
        } else {
            context.recordAdded();
        }

        if (inputChanging) {
            postSave("options", code, context, () -> optionReconciler.reconcile(row, frontendInput, OptionPass.FOLLOW_UP, context));
        }
        postSave("default value", code, context, () -> optionReconciler.applyDefault(row, frontendInput, context));
        postSave("store labels", code, context, () -> labelAssigner.assign(row, context));
        postSave("attribute sets", code, context, () -> attributeSetReconciler.assign(row, context));
    }

    /**
     * Attribute payload from the row's scalar columns. Blank cells are left out so stored values are kept.
     */
    Map<String, String> buildData(AttributeRow row) {
        Map<String, String> data = new LinkedHashMap<>();
        for (HeaderColumn column : row.columns(ColumnRole.SCALAR)) {
            if (AttributeConstants.ASSIGNMENT_COLUMNS.contains(column.name())) {
                continue;
            }
            String value = row.cell(column);
            if (value.isEmpty()) {
                continue;
            }
            if (ImportConstants.COLUMN_APPLY_TO.equals(column.name())) {
                value = String.join(ImportConstants.PERSISTED_LIST_SEPARATOR, new LinkedHashSet<>(CsvTable.parseList(value)));
            }
            data.put(column.name(), value);
        }
        return data;
    }

    private String inherit(Supplier<String> reader, String field, String code, ImportContext context) {
        try {
            String value = reader.get();
            return value == null ? "" : value.trim();
        } catch (RuntimeException ex) {
            context.error(AttributeConstants.MSG_INHERIT_FAILED.formatted(field, code, ex.getMessage()), ex);
            return "";
        }
    }

    private void postSave(String step, String code, ImportContext context, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException ex) {
            context.error(AttributeConstants.MSG_POST_SAVE_FAILED.formatted(step, code, ex.getMessage()), ex);
        }
    }

    private static void putIfNotBlank(Map<String, String> data, String key, String value) {
        if (value != null && !value.isEmpty()) {
            data.put(key, value);
        }
    }
}
