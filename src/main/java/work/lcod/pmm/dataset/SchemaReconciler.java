package work.lcod.pmm.dataset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pmm.model.Field;
import work.lcod.pmm.model.Metadata;
import work.lcod.pmm.table.Column;
import work.lcod.pmm.table.Table;

/**
 * Brings metadata in line with the columns of a table.
 *
 * <p>Existing fields keep their declared type, tags and stats; only membership, order and the two counts
 * follow the table.
 */
public final class SchemaReconciler {
    private static final Logger log = LoggerFactory.getLogger(SchemaReconciler.class);

    private SchemaReconciler() {}

    public static Reconciliation reconcile(Table table, Metadata metadata) {
        List<String> columnNames = table.columnNames();
        Set<String> fieldNames = new LinkedHashSet<>(metadata.fieldNames());

        List<String> added = new ArrayList<>();
        for (Column column : table.columns()) {
            if (!fieldNames.contains(column.name())) {
                metadata.addField(TypeInference.createField(column));
                added.add(column.name());
            }
        }
        List<String> removed = new ArrayList<>();
        for (String name : fieldNames) {
            if (!table.hasColumn(name)) {
                metadata.removeField(name);
                removed.add(name);
            }
        }

        boolean reordered = !metadata.fieldNames().equals(columnNames);
        if (reordered) {
            metadata.reorderFields(columnNames);
        }

        boolean recounted = metadata.recordCount() != table.rowCount();
        if (recounted) {
            metadata.setRecordCount(table.rowCount());
        }

        Reconciliation result = new Reconciliation(added, removed, reordered, recounted);
        if (!result.isNoop()) {
            log.debug(
                "Reconciled {}: added {}, removed {}, reordered {}, recordcount {}",
                metadata.name(), added, removed, reordered, metadata.recordCount()
            );
        }
        return result;
    }

    /**
     * Appends copies of the fields {@code other} declares and {@code metadata} does not.
     *
     * @return names of the appended fields
     */
    public static List<String> addMissingFrom(Metadata metadata, Metadata other) {
        List<String> appended = new ArrayList<>();
        for (Field field : other.fields()) {
            if (!metadata.hasField(field.name())) {
                metadata.addField(field.copy());
                appended.add(field.name());
            }
        }
        return appended;
    }

    /**
     * Takes in field metadata from {@code other}. Fields both sides declare keep the primary's version
     * unless their name is listed in {@code overrideFields}.
     */
    public static List<String> merge(Metadata metadata, Metadata other, Collection<String> overrideFields) {
        for (String name : overrideFields) {
            if (other.hasField(name) && metadata.hasField(name)) {
                metadata.addField(other.field(name).copy());
            }
        }
        List<String> appended = addMissingFrom(metadata, other);
        if (!appended.isEmpty()) {
            log.debug("Merged fields {} from {} into {}", appended, other.name(), metadata.name());
        }
        return appended;
    }
}
