package work.lcod.pmm.dataset;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import work.lcod.pmm.model.Field;
import work.lcod.pmm.model.FieldType;
import work.lcod.pmm.model.Metadata;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;
import work.lcod.pmm.table.Column;
import work.lcod.pmm.table.StorageType;
import work.lcod.pmm.table.Table;

/**
 * A table paired with the metadata describing it.
 *
 * <p>The table is only referenced; the metadata is owned and mutated in place by the operations below.
 */
public final class Dataset {
    private Table table;
    private final Metadata metadata;

    public Dataset(Table table, Metadata metadata) {
        this.table = Objects.requireNonNull(table, "table");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    /**
     * Dataset whose metadata is inferred from {@code table}.
     */
    public Dataset(Table table, String name) {
        this(table, TypeInference.createMetadata(table, name));
    }

    public Table table() {
        return table;
    }

    public Metadata metadata() {
        return metadata;
    }

    /**
     * Swaps in a table transformed by the host application. Call {@link #updateMetadata()} afterwards.
     */
    public void replaceTable(Table table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    /**
     * Adds (or replaces) column {@code name} and declares its field.
     *
     * @param type canonical type to declare, {@code null} to infer it
     */
    public Field addField(String name, Column column, String type) {
        table = table.withColumn(column.renamed(name));
        return declareField(name, type);
    }

    public Field addField(String name, Column column) {
        return addField(name, column, null);
    }

    /**
     * Declares the field of an existing column. An all-null column declared {@code string} or
     * {@code datestamp} is first re-typed to object or date-time storage.
     *
     * @param type canonical type to declare, {@code null} to infer it
     */
    public Field declareField(String name, String type) {
        Column column = table.column(name).orElseThrow(() -> new PmmException(
            PmmErrorCode.UNKNOWN_FIELD,
            "No column named " + name
        ));
        if (column.nonNullCount() == 0) {
            if (FieldType.STRING.wireName().equals(type)) {
                column = Column.allNull(name, StorageType.OBJECT, table.rowCount());
                table = table.withColumn(column);
            } else if (FieldType.DATESTAMP.wireName().equals(type)) {
                column = Column.allNull(name, StorageType.DATETIME, table.rowCount());
                table = table.withColumn(column);
            }
        }
        Field field = TypeInference.createField(column, type);
        metadata.addField(field);
        return field;
    }

    public Field declareField(String name) {
        return declareField(name, null);
    }

    public void tagField(String fieldName, String tag, Object value) {
        metadata.setFieldTag(fieldName, tag, value);
    }

    public void tagField(String fieldName, String tag) {
        tagField(fieldName, tag, null);
    }

    public void tagDataset(String tag, Object value) {
        metadata.setTag(tag, value);
    }

    public void tagDataset(String tag) {
        tagDataset(tag, null);
    }

    /**
     * Adds inferred fields for new columns, drops fields without a column and follows the table's
     * column order and row count. Declared types of existing fields are kept.
     */
    public Reconciliation updateMetadata() {
        return SchemaReconciler.reconcile(table, metadata);
    }

    /**
     * Takes in the field metadata of {@code other}, typically after its columns were merged into this
     * table. Fields declared on both sides keep this dataset's version unless listed in
     * {@code overrideFields}.
     */
    public Reconciliation mergeMetadata(Dataset other, Collection<String> overrideFields) {
        SchemaReconciler.merge(metadata, other.metadata, overrideFields);
        return updateMetadata();
    }

    public Reconciliation mergeMetadata(Dataset other) {
        return mergeMetadata(other, List.of());
    }

    /**
     * Appends the rows of {@code other}, taking in metadata for the fields only {@code other} declares.
     */
    public Reconciliation append(Dataset other) {
        table = table.append(other.table);
        SchemaReconciler.addMissingFrom(metadata, other.metadata);
        return updateMetadata();
    }
}
