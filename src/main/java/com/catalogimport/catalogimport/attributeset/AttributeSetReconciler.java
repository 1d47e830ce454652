package com.catalogimport.catalogimport.attributeset;

import com.catalogimport.catalogimport.attribute.AttributeRow;
import com.catalogimport.catalogimport.catalog.AttributeSetCatalog;
import com.catalogimport.catalogimport.catalog.AttributeSetRecord;
import com.catalogimport.catalogimport.csv.CsvRow;
import com.catalogimport.catalogimport.importer.ImportConstants;
import com.catalogimport.catalogimport.importer.ImportContext;
import com.catalogimport.catalogimport.importer.ImportProperties;
import com.catalogimport.catalogimport.importer.LabelNormalizer;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Assigns attributes to attribute sets and groups, and deletes attribute sets in attribute-set mode.
 * Sets are referenced by name or numeric id; the default set is never deleted.
 */
@Component
public class AttributeSetReconciler {

    private static final int MAX_ORDER_DIGITS = 9;

    private final AttributeSetCatalog attributeSetCatalog;
    private final ImportProperties importProperties;

    public AttributeSetReconciler(AttributeSetCatalog attributeSetCatalog, ImportProperties importProperties) {
        this.attributeSetCatalog = attributeSetCatalog;
        this.importProperties = importProperties;
    }

    /**
     * Places the row's attribute in every listed set, or in the default set when none is listed.
     */
    public void assign(AttributeRow row, ImportContext context) {
        String code = row.code();
        List<String> references = row.list(ImportConstants.COLUMN_ATTRIBUTE_SET);
        List<String> orders = row.positionalList(ImportConstants.COLUMN_ATTRIBUTE_SET_ORDER);

        if (references.isEmpty()) {
            try {
                references = List.of(String.valueOf(attributeSetCatalog.getDefaultAttributeSetId()));
            } catch (RuntimeException ex) {
                context.error(AttributeSetConstants.MSG_DEFAULT_SET_FAILED.formatted(code, ex.getMessage()), ex);
                return;
            }
        } else if (orders.size() > 1 && orders.size() != references.size()) {
            context.notice(AttributeSetConstants.MSG_SET_ORDER_MISMATCH.formatted(code, references.size(), orders.size()));
        }

        Set<Long> processed = new HashSet<>();
        for (int position = 0; position < references.size(); position++) {
            String reference = references.get(position);
            Integer order = orders.size() == 1 ? parseOrder(orders.get(0)) : orderAt(orders, position);
            try {
                Optional<Long> attributeSetId = resolveOrCreate(reference, order, code, context);
                if (attributeSetId.isPresent() && processed.add(attributeSetId.get())) {
                    attach(attributeSetId.get(), row, context);
                }
            } catch (RuntimeException ex) {
                context.error(AttributeSetConstants.MSG_ASSIGN_FAILED.formatted(code, reference, ex.getMessage()), ex);
            }
        }
    }

    /**
     * Deletes every set named in the rows' {@code attribute_set} cells. Names are collected case-insensitively,
     * keeping the first spelling; missing sets are skipped without counting as errors.
     */
    public void deleteSets(Stream<CsvRow> rows, ImportContext context) {
        Map<String, String> names = new LinkedHashMap<>();
        rows.forEach(row -> {
            for (String name : row.list(ImportConstants.COLUMN_ATTRIBUTE_SET)) {
                names.putIfAbsent(LabelNormalizer.normalize(name), name);
            }
        });

        String defaultKey = LabelNormalizer.normalize(importProperties.getDefaultAttributeSetName());
        for (Map.Entry<String, String> entry : names.entrySet()) {
            String name = entry.getValue();
            if (entry.getKey().equals(defaultKey)) {
                context.info(AttributeSetConstants.MSG_DEFAULT_SET_PROTECTED.formatted(name));
                continue;
            }
            try {
                Optional<AttributeSetRecord> attributeSet = findSet(name);
                if (attributeSet.isEmpty()) {
                    context.warn(AttributeSetConstants.MSG_SET_NOT_FOUND.formatted(name));
                    continue;
                }
                if (LabelNormalizer.normalize(attributeSet.get().attributeSetName()).equals(defaultKey)) {
                    context.info(AttributeSetConstants.MSG_DEFAULT_SET_PROTECTED.formatted(name));
                    continue;
                }
                context.info(AttributeSetConstants.MSG_DELETING_SET.formatted(name));
                attributeSetCatalog.removeAttributeSet(attributeSet.get().attributeSetId());
                context.recordDeleted();
            } catch (RuntimeException ex) {
                context.error(AttributeSetConstants.MSG_DELETE_SET_FAILED.formatted(name, ex.getMessage()), ex);
            }
        }
    }

    private Optional<Long> resolveOrCreate(String reference, Integer order, String code, ImportContext context) {
        if (isNumeric(reference)) {
            long attributeSetId = Long.parseLong(reference);
            Optional<AttributeSetRecord> attributeSet = attributeSetCatalog.findAttributeSet(attributeSetId);
            if (attributeSet.isEmpty()) {
                context.notice(AttributeSetConstants.MSG_SET_ID_NOT_FOUND.formatted(attributeSetId, code));
                return Optional.empty();
            }
            updateOrder(attributeSet.get(), order);
            return Optional.of(attributeSetId);
        }

        Optional<AttributeSetRecord> attributeSet = attributeSetCatalog.findAttributeSet(reference);
        if (attributeSet.isPresent()) {
            updateOrder(attributeSet.get(), order);
            return Optional.of(attributeSet.get().attributeSetId());
        }
        long skeletonSetId = attributeSetCatalog.getDefaultAttributeSetId();
        long created = attributeSetCatalog.createAttributeSet(reference, order, skeletonSetId);
        context.notice(AttributeSetConstants.MSG_SET_CREATED.formatted(reference, code));
        return Optional.of(created);
    }

    private void attach(long attributeSetId, AttributeRow row, ImportContext context) {
        String groupName = row.cell(ImportConstants.COLUMN_GROUP);
        long groupId;
        if (groupName.isEmpty()) {
            groupId = attributeSetCatalog.getDefaultGroupId(attributeSetId);
        } else {
            groupId = resolveGroup(attributeSetId, groupName, parseOrder(row.cell(ImportConstants.COLUMN_GROUP_ORDER)), context);
        }
        attributeSetCatalog.addAttributeToSet(
                attributeSetId,
                groupId,
                row.code(),
                parseOrder(row.cell(ImportConstants.COLUMN_SORT_ORDER))
        );
    }

    private long resolveGroup(long attributeSetId, String groupName, Integer groupOrder, ImportContext context) {
        try {
            attributeSetCatalog.addAttributeGroup(attributeSetId, groupName, groupOrder);
            return attributeSetCatalog.getAttributeGroupId(attributeSetId, groupName);
        } catch (RuntimeException ex) {
            context.notice(AttributeSetConstants.MSG_GROUP_FALLBACK.formatted(groupName, attributeSetId, ex.getMessage()));
            return attributeSetCatalog.getDefaultGroupId(attributeSetId);
        }
    }

    private void updateOrder(AttributeSetRecord attributeSet, Integer order) {
        if (order != null && order != attributeSet.sortOrder()) {
            attributeSetCatalog.updateAttributeSetSortOrder(attributeSet.attributeSetId(), order);
        }
    }

    private Optional<AttributeSetRecord> findSet(String reference) {
        if (isNumeric(reference)) {
            return attributeSetCatalog.findAttributeSet(Long.parseLong(reference));
        }
        return attributeSetCatalog.findAttributeSet(reference);
    }

    private static Integer orderAt(List<String> orders, int position) {
        return position < orders.size() ? parseOrder(orders.get(position)) : null;
    }

    static Integer parseOrder(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_ORDER_DIGITS || !trimmed.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
            return null;
        }
        return Integer.parseInt(trimmed);
    }

    private static boolean isNumeric(String reference) {
        return !reference.isEmpty() && reference.length() <= 18 && reference.chars().allMatch(ch -> ch >= '0' && ch <= '9');
    }
}
