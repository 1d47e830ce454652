package com.catalogimport.catalogimport.importer;

import com.catalogimport.catalogimport.attribute.AttributeReconciler;
import com.catalogimport.catalogimport.attribute.AttributeRow;
import com.catalogimport.catalogimport.attributeset.AttributeSetReconciler;
import com.catalogimport.catalogimport.catalog.StoreDirectory;
import com.catalogimport.catalogimport.csv.CsvTable;
import com.catalogimport.catalogimport.csv.CsvTableReader;
import com.catalogimport.catalogimport.store.StoreResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one CSV import: validates the options and the file, dispatches every row in file order and
 * reports the totals. Row failures are counted, never thrown.
 */
@Service
public class CatalogImportService {

    private static final Logger log = LoggerFactory.getLogger(CatalogImportService.class);

    private final CsvTableReader csvTableReader;
    private final AttributeReconciler attributeReconciler;
    private final AttributeSetReconciler attributeSetReconciler;
    private final StoreDirectory storeDirectory;
    private final ImportProperties importProperties;

    public CatalogImportService(
            CsvTableReader csvTableReader,
            AttributeReconciler attributeReconciler,
            AttributeSetReconciler attributeSetReconciler,
            StoreDirectory storeDirectory,
            ImportProperties importProperties
    ) {
        this.csvTableReader = csvTableReader;
        this.attributeReconciler = attributeReconciler;
        this.attributeSetReconciler = attributeSetReconciler;
        this.storeDirectory = storeDirectory;
        this.importProperties = importProperties;
    }

    /**
     * Imports the CSV file at {@code csvPath}, relative to the var directory.
     *
     * @throws ImportValidationException when the type, behavior or required columns are invalid
     * @throws com.catalogimport.catalogimport.csv.CsvValidationException when the file is unreadable or malformed
     */
    public ImportSummary run(String csvPath, String type, String behavior, boolean verbose) {
        ImportType importType = ImportType.fromValue(type).orElseThrow(() -> new ImportValidationException(
                ImportConstants.MSG_INVALID_TYPE.formatted(type, String.join(", ", ImportType.allowedValues()))));
        ImportBehavior importBehavior = ImportBehavior.fromValue(behavior).orElseThrow(() -> new ImportValidationException(
                ImportConstants.MSG_INVALID_BEHAVIOR.formatted(behavior, String.join(", ", ImportBehavior.allowedValues()))));
        if (importType == ImportType.ATTRIBUTE_SET && importBehavior != ImportBehavior.DELETE) {
            throw new ImportValidationException(ImportConstants.MSG_INVALID_BEHAVIOR_FOR_TYPE.formatted(behavior, type));
        }

        CsvTable table = csvTableReader.readValidated(csvPath);
        ImportContext context = new ImportContext(verbose, new StoreResolver(storeDirectory, importProperties.getAdminStoreCode()));

        if (importType == ImportType.ATTRIBUTE_SET) {
            requireColumn(table, ImportConstants.COLUMN_ATTRIBUTE_SET);
            attributeSetReconciler.deleteSets(table.dataRows(), context);
            context.info(ImportConstants.MSG_DELETED_SETS.formatted(context.deleted()));
        } else {
            requireColumn(table, ImportConstants.COLUMN_ATTRIBUTE_CODE);
            table.dataRows().forEach(row -> processRow(new AttributeRow(row), importBehavior, context));
            reportAttributeTotals(importBehavior, context);
        }

        if (context.hasErrors()) {
            log.error(ImportConstants.MSG_ERRORS_OCCURRED.formatted(context.errorCount()));
        }
        ImportSummary summary = context.toSummary();
        log.debug("Import of {} finished: {}", csvPath, summary);
        return summary;
    }

    private void processRow(AttributeRow row, ImportBehavior behavior, ImportContext context) {
        try {
            attributeReconciler.process(row, behavior, context);
        } catch (RuntimeException ex) {
            context.error(ImportConstants.MSG_ROW_FAILED.formatted(row.lineNumber(), row.code(), ex.getMessage()), ex);
        }
    }

    private void reportAttributeTotals(ImportBehavior behavior, ImportContext context) {
        switch (behavior) {
            case DELETE -> context.info(ImportConstants.MSG_DELETED_ATTRIBUTES.formatted(context.deleted()));
            case UPDATE -> context.info(ImportConstants.MSG_ADDED_UPDATED_ATTRIBUTES.formatted(context.added(), context.updated()));
            default -> context.info(ImportConstants.MSG_ADDED_ATTRIBUTES.formatted(context.added()));
        }
    }

    private void requireColumn(CsvTable table, String column) {
        if (!table.headerMap().contains(column)) {
            throw new ImportValidationException(ImportConstants.MSG_MISSING_COLUMN.formatted(column));
        }
    }
}
