package work.lcod.pmm.dataset;

import java.util.ArrayList;
import java.util.List;
import work.lcod.pmm.model.Field;
import work.lcod.pmm.model.FieldType;
import work.lcod.pmm.model.Metadata;
import work.lcod.pmm.model.Role;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;
import work.lcod.pmm.table.Column;
import work.lcod.pmm.table.StorageType;
import work.lcod.pmm.table.Table;

/**
 * Maps column storage types to canonical field types and builds fresh metadata from a table.
 */
public final class TypeInference {
    private TypeInference() {}

    /**
     * Canonical type of {@code column}. Object columns are decided by their first non-null value.
     */
    public static FieldType infer(Column column) {
        StorageType storage = column.storageType();
        if (storage == StorageType.BOOL) {
            return FieldType.BOOLEAN;
        }
        if (storage.isInteger()) {
            return FieldType.INTEGER;
        }
        if (storage.isFloat()) {
            return FieldType.REAL;
        }
        if (storage.isDateTime()) {
            return FieldType.DATESTAMP;
        }
        if (storage == StorageType.OBJECT) {
            return column.firstNonNull().filter(Boolean.class::isInstance).isPresent()
                ? FieldType.BOOLEAN
                : FieldType.STRING;
        }
        throw new PmmException(
            PmmErrorCode.UNKNOWN_STORAGE_TYPE,
            "Unknown type: " + storage.dtype() + " for column " + column.name()
        );
    }

    /**
     * The explicit {@code override} when given, which must name a canonical type; the inferred type otherwise.
     */
    public static FieldType resolve(Column column, String override) {
        if (override == null || override.isEmpty()) {
            return infer(column);
        }
        return FieldType.fromWire(override).orElseThrow(() -> new PmmException(
            PmmErrorCode.UNKNOWN_TYPE,
            "Unknown PMM type: " + override
        ));
    }

    public static Field createField(Column column, String override) {
        return Field.of(column.name(), resolve(column, override), Role.UNSPECIFIED);
    }

    public static Field createField(Column column) {
        return createField(column, null);
    }

    /**
     * Vanilla metadata for {@code table}: one inferred field per column, no tags, no provenance.
     */
    public static Metadata createMetadata(Table table, String name) {
        List<Field> fields = new ArrayList<>(table.columns().size());
        for (Column column : table.columns()) {
            fields.add(createField(column));
        }
        return Metadata.of(name, table.rowCount(), fields);
    }
}
