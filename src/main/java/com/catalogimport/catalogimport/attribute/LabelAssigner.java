package com.catalogimport.catalogimport.attribute;

import com.catalogimport.catalogimport.catalog.AttributeCatalog;
import com.catalogimport.catalogimport.catalog.StoreLabel;
import com.catalogimport.catalogimport.csv.ColumnRole;
import com.catalogimport.catalogimport.csv.HeaderColumn;
import com.catalogimport.catalogimport.importer.ImportContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes the {@code label_{store}} cells of a row as store-scoped attribute labels.
 */
@Component
public class LabelAssigner {

    private final AttributeCatalog attributeCatalog;

    public LabelAssigner(AttributeCatalog attributeCatalog) {
        this.attributeCatalog = attributeCatalog;
    }

    public void assign(AttributeRow row, ImportContext context) {
        Map<Long, String> incoming = collectLabels(row, context);
        if (incoming.isEmpty()) {
            return;
        }
        String code = row.code();
        try {
            List<StoreLabel> current = attributeCatalog.getStoreLabels(code);
            List<StoreLabel> merged = merge(current, incoming);
            if (!new HashSet<>(merged).equals(new HashSet<>(current))) {
                attributeCatalog.saveStoreLabels(code, merged);
            }
        } catch (RuntimeException ex) {
            context.error(AttributeConstants.MSG_LABEL_FAILED.formatted(code, ex.getMessage()), ex);
        }
    }

    /**
     * Keeps the current labels of stores the row does not mention and appends the row's labels.
     */
    public static List<StoreLabel> merge(List<StoreLabel> current, Map<Long, String> incoming) {
        List<StoreLabel> merged = new ArrayList<>();
        for (StoreLabel label : current) {
            if (!incoming.containsKey(label.storeId())) {
                merged.add(label);
            }
        }
        incoming.forEach((storeId, label) -> merged.add(new StoreLabel(storeId, label)));
        return merged;
    }

    private Map<Long, String> collectLabels(AttributeRow row, ImportContext context) {
        Map<Long, String> labels = new LinkedHashMap<>();
        for (HeaderColumn column : row.columns(ColumnRole.STORE_LABEL)) {
            String value = row.cell(column);
            if (value.isEmpty()) {
                continue;
            }
            Optional<Long> storeId = context.storeResolver().resolve(column.storeCode());
            if (storeId.isEmpty()) {
                context.notice(AttributeConstants.MSG_STORE_NOT_FOUND.formatted(column.storeCode(), column.name()));
                continue;
            }
            labels.putIfAbsent(storeId.get(), value);
        }
        return labels;
    }
}
