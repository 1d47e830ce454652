package com.catalogimport.catalogimport.attribute;

import com.catalogimport.catalogimport.catalog.AttributeCatalog;
import com.catalogimport.catalogimport.catalog.AttributeOption;
import com.catalogimport.catalogimport.catalog.CatalogAttribute;
import com.catalogimport.catalogimport.catalog.OptionDraft;
import com.catalogimport.catalogimport.csv.ColumnRole;
import com.catalogimport.catalogimport.csv.CsvTable;
import com.catalogimport.catalogimport.csv.HeaderColumn;
import com.catalogimport.catalogimport.importer.ImportConstants;
import com.catalogimport.catalogimport.importer.ImportContext;
import com.catalogimport.catalogimport.importer.ImportProperties;
import com.catalogimport.catalogimport.importer.LabelNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the option plan of a select/multiselect row, merges it into the stored options and
 * resolves the row's default value to option identifiers.
 */
@Component
public class OptionReconciler {

    private static final int MAX_ORDER_DIGITS = 9;
    private static final int MAX_ID_DIGITS = 18;

    private final AttributeCatalog attributeCatalog;
    private final ImportProperties importProperties;

    public OptionReconciler(AttributeCatalog attributeCatalog, ImportProperties importProperties) {
        this.attributeCatalog = attributeCatalog;
        this.importProperties = importProperties;
    }

    public static boolean isOptionInput(String frontendInput) {
        String input = frontendInput == null ? "" : frontendInput.trim().toLowerCase(Locale.ROOT);
        return ImportConstants.INPUT_SELECT.equals(input) || ImportConstants.INPUT_MULTISELECT.equals(input);
    }

    public static boolean isMultiselect(String frontendInput) {
        return frontendInput != null && ImportConstants.INPUT_MULTISELECT.equalsIgnoreCase(frontendInput.trim());
    }

    /**
     * Applies the row's options for the given pass. Options that belong in the attribute save payload
     * are returned; options added incrementally to an existing attribute are not.
     */
    public List<OptionDraft> reconcile(AttributeRow row, String frontendInput, OptionPass pass, ImportContext context) {
        if (!handlesOptions(row, frontendInput, context, pass != OptionPass.FOLLOW_UP)) {
            return List.of();
        }
        OptionPlan plan = buildPlan(row, context, pass != OptionPass.FOLLOW_UP);
        if (plan.isEmpty()) {
            return List.of();
        }

        boolean replace = pass == OptionPass.MERGE && row.replacesOptions();
        if (replace) {
            removeAllOptions(row.code(), context);
        }
        if (pass == OptionPass.CREATE || replace) {
            return plan.drafts();
        }

        addMissingOptions(row.code(), plan, context);
        return List.of();
    }

    /**
     * Builds the options of a row: positional base labels with their store overrides, de-duplicated by
     * normalized label, with sort orders resolved from {@code option_order}.
     */
    public OptionPlan buildPlan(AttributeRow row, ImportContext context, boolean report) {
        String code = row.code();
        List<String> baseLabels = row.positionalList(ImportConstants.COLUMN_OPTION);
        if (baseLabels.stream().allMatch(String::isEmpty)) {
            return OptionPlan.empty();
        }

        List<ScopedOptions> scopedColumns = scopedOptionColumns(row, baseLabels.size(), context, report);
        boolean hasOrderColumn = !row.isBlank(ImportConstants.COLUMN_OPTION_ORDER);
        List<String> orderValues = row.positionalList(ImportConstants.COLUMN_OPTION_ORDER);

        Map<String, PlannedOption> entries = new LinkedHashMap<>();
        Map<String, Integer> orderByKey = new HashMap<>();
        List<String> duplicates = new ArrayList<>();

        for (int position = 0; position < baseLabels.size(); position++) {
            Map<Long, String> storeLabels = new LinkedHashMap<>();
            String promotedFrom = null;
            String promotedLabel = null;
            for (ScopedOptions scoped : scopedColumns) {
                String value = position < scoped.values().size() ? scoped.values().get(position) : "";
                if (value.isEmpty()) {
                    continue;
                }
                storeLabels.putIfAbsent(scoped.storeId(), value);
                if (promotedLabel == null) {
                    promotedLabel = value;
                    promotedFrom = scoped.column();
                }
            }

            String label = baseLabels.get(position);
            if (label.isEmpty()) {
                if (promotedLabel == null) {
                    notice(context, report, AttributeConstants.MSG_OPTION_EMPTY.formatted(position + 1, code));
                    continue;
                }
                label = promotedLabel;
                notice(context, report, AttributeConstants.MSG_OPTION_PROMOTED.formatted(position + 1, code, label, promotedFrom));
            }

            String key = LabelNormalizer.normalize(label);
            Integer order = hasOrderColumn ? parseOrder(orderValues, position, code, context, report) : null;
            if (order != null) {
                orderByKey.putIfAbsent(key, order);
            }
            if (entries.containsKey(key)) {
                duplicates.add(label);
                continue;
            }
            Set<String> normalizedLabels = new LinkedHashSet<>();
            normalizedLabels.add(key);
            storeLabels.values().forEach(value -> normalizedLabels.add(LabelNormalizer.normalize(value)));
            entries.put(key, new PlannedOption(label, null, storeLabels, normalizedLabels));
        }

        if (!duplicates.isEmpty()) {
            notice(context, report, AttributeConstants.MSG_OPTION_DUPLICATES.formatted(code, String.join(", ", duplicates)));
        }
        if (!hasOrderColumn) {
            return new OptionPlan(new ArrayList<>(entries.values()));
        }
        return new OptionPlan(assignSortOrders(entries, orderByKey));
    }

    /**
     * Resolves the row's {@code default} cell to option identifiers and stores it when it differs
     * from the current default. Values that match no option are reported and left out.
     */
    public void applyDefault(AttributeRow row, String frontendInput, ImportContext context) {
        String code = row.code();
        String defaultCell = row.cell(ImportConstants.COLUMN_DEFAULT);
        if (defaultCell.isEmpty() || !isOptionInput(frontendInput) || !row.isBlank(ImportConstants.COLUMN_SOURCE)) {
            return;
        }
        boolean multiselect = isMultiselect(frontendInput);
        List<String> values = multiselect ? CsvTable.parseList(defaultCell) : List.of(defaultCell);

        try {
            List<AttributeOption> options = attributeCatalog.getOptions(code);
            Set<Long> optionIds = new HashSet<>();
            Map<String, Long> idByLabel = new LinkedHashMap<>();
            for (AttributeOption option : options) {
                optionIds.add(option.optionId());
                idByLabel.putIfAbsent(LabelNormalizer.normalize(option.label()), option.optionId());
            }
            for (PlannedOption planned : buildPlan(row, context, false).options()) {
                Long optionId = idByLabel.get(LabelNormalizer.normalize(planned.label()));
                if (optionId != null) {
                    planned.normalizedLabels().forEach(label -> idByLabel.putIfAbsent(label, optionId));
                }
            }
            for (AttributeOption option : options) {
                option.storeLabels().values()
                        .forEach(label -> idByLabel.putIfAbsent(LabelNormalizer.normalize(label), option.optionId()));
            }

            Set<String> resolved = new LinkedHashSet<>();
            for (String value : values) {
                Optional<Long> optionId = resolveOption(value, optionIds, idByLabel);
                if (optionId.isPresent()) {
                    resolved.add(String.valueOf(optionId.get()));
                } else if (context.isVerbose()) {
                    List<String> available = options.stream().map(AttributeOption::label).toList();
                    context.warn(AttributeConstants.MSG_DEFAULT_UNRESOLVED_VERBOSE.formatted(value, code, String.join(", ", available)));
                } else {
                    context.warn(AttributeConstants.MSG_DEFAULT_UNRESOLVED.formatted(value, code));
                }
            }
            if (resolved.isEmpty()) {
                return;
            }

            String defaultValue = multiselect
                    ? String.join(ImportConstants.PERSISTED_LIST_SEPARATOR, resolved)
                    : resolved.iterator().next();
            String current = attributeCatalog.findAttribute(code).map(CatalogAttribute::defaultValue).orElse(null);
            if (!defaultValue.equals(current)) {
                attributeCatalog.updateDefaultValue(code, defaultValue);
            }
        } catch (RuntimeException ex) {
            context.error(AttributeConstants.MSG_DEFAULT_FAILED.formatted(code, ex.getMessage()), ex);
        }
    }

    private boolean handlesOptions(AttributeRow row, String frontendInput, ImportContext context, boolean report) {
        if (!isOptionInput(frontendInput)) {
            return false;
        }
        if (row.isBlank(ImportConstants.COLUMN_SOURCE)) {
            return true;
        }
        if (report && !row.isBlank(ImportConstants.COLUMN_OPTION)) {
            context.warn(AttributeConstants.MSG_SOURCE_AND_OPTION.formatted(row.code()));
        }
        return false;
    }

    private void removeAllOptions(String code, ImportContext context) {
        try {
            List<AttributeOption> existing = attributeCatalog.getOptions(code);
            for (AttributeOption option : existing) {
                attributeCatalog.deleteOption(code, option.optionId());
            }
            context.notice(AttributeConstants.MSG_OPTIONS_REPLACED.formatted(existing.size(), code));
        } catch (RuntimeException ex) {
            context.error(AttributeConstants.MSG_OPTION_REPLACE_FAILED.formatted(code, ex.getMessage()), ex);
        }
    }

    /**
     * Adds, one call per option, every planned option whose labels match no stored option.
     * A failed add is counted and the remaining options are still attempted.
     */
    private void addMissingOptions(String code, OptionPlan plan, ImportContext context) {
        List<AttributeOption> existing;
        try {
            existing = attributeCatalog.getOptions(code);
        } catch (RuntimeException ex) {
            context.error(AttributeConstants.MSG_OPTIONS_READ_FAILED.formatted(code, ex.getMessage()), ex);
            return;
        }
        Set<String> existingLabels = new HashSet<>();
        existing.forEach(option -> existingLabels.add(LabelNormalizer.normalize(option.label())));

        for (PlannedOption option : plan.options()) {
            if (option.normalizedLabels().stream().anyMatch(existingLabels::contains)) {
                context.notice(AttributeConstants.MSG_OPTION_EXISTS.formatted(option.label(), code));
                continue;
            }
            try {
                attributeCatalog.addOption(code, option.toDraft());
                existingLabels.addAll(option.normalizedLabels());
                context.notice(AttributeConstants.MSG_OPTION_ADDED.formatted(option.label(), code));
            } catch (RuntimeException ex) {
                context.error(AttributeConstants.MSG_OPTION_ADD_FAILED.formatted(option.label(), code, ex.getMessage()), ex);
            }
        }
    }

    private List<ScopedOptions> scopedOptionColumns(AttributeRow row, int baseCount, ImportContext context, boolean report) {
        List<ScopedOptions> scopedColumns = new ArrayList<>();
        for (HeaderColumn column : row.columns(ColumnRole.STORE_OPTION)) {
            String cell = row.cell(column);
            if (cell.isEmpty()) {
                continue;
            }
            Optional<Long> storeId = context.storeResolver().resolve(column.storeCode());
            if (storeId.isEmpty()) {
                notice(context, report, AttributeConstants.MSG_STORE_NOT_FOUND.formatted(column.storeCode(), column.name()));
                continue;
            }
            if (storeId.get() == ImportConstants.ADMIN_STORE_ID) {
                notice(context, report, AttributeConstants.MSG_ADMIN_OPTION_COLUMN.formatted(column.name()));
                continue;
            }
            List<String> values = CsvTable.parsePositionalList(cell);
            if (values.size() != baseCount) {
                notice(context, report, AttributeConstants.MSG_OPTION_COUNT_MISMATCH.formatted(
                        column.name(), row.code(), values.size(), baseCount));
            }
            scopedColumns.add(new ScopedOptions(column.name(), storeId.get(), values));
        }
        return scopedColumns;
    }

    private Integer parseOrder(List<String> orderValues, int position, String code, ImportContext context, boolean report) {
        String value = position < orderValues.size() ? orderValues.get(position) : "";
        if (value.isEmpty()) {
            return null;
        }
        if (isDigits(value, MAX_ORDER_DIGITS)) {
            return Integer.parseInt(value);
        }
        notice(context, report, AttributeConstants.MSG_OPTION_ORDER_INVALID.formatted(value, code));
        return null;
    }

    /**
     * Options without a resolved order go after the highest resolved one, spaced by the configured step.
     */
    private List<PlannedOption> assignSortOrders(Map<String, PlannedOption> entries, Map<String, Integer> orderByKey) {
        int maxResolved = 0;
        for (String key : entries.keySet()) {
            Integer order = orderByKey.get(key);
            if (order != null) {
                maxResolved = Math.max(maxResolved, order);
            }
        }
        int step = importProperties.getOptionSortStep();
        int missing = 0;
        List<PlannedOption> ordered = new ArrayList<>();
        for (Map.Entry<String, PlannedOption> entry : entries.entrySet()) {
            Integer order = orderByKey.get(entry.getKey());
            if (order == null) {
                missing++;
                order = maxResolved + step * missing;
            }
            PlannedOption option = entry.getValue();
            ordered.add(new PlannedOption(option.label(), order, option.storeLabels(), option.normalizedLabels()));
        }
        return ordered;
    }

    private static Optional<Long> resolveOption(String value, Set<Long> optionIds, Map<String, Long> idByLabel) {
        String trimmed = value.trim();
        if (isDigits(trimmed, MAX_ID_DIGITS) && optionIds.contains(Long.parseLong(trimmed))) {
            return Optional.of(Long.parseLong(trimmed));
        }
        return Optional.ofNullable(idByLabel.get(LabelNormalizer.normalize(trimmed)));
    }

    private static boolean isDigits(String value, int maxDigits) {
        return !value.isEmpty() && value.length() <= maxDigits && value.chars().allMatch(ch -> ch >= '0' && ch <= '9');
    }

    private static void notice(ImportContext context, boolean report, String message) {
        if (report) {
            context.notice(message);
        }
    }

    private record ScopedOptions(String column, long storeId, List<String> values) {
    }
}
