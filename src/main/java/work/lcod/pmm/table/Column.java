package work.lcod.pmm.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, typed column. Values may contain {@code null}; in floating-point columns NaN also counts as null.
 */
public record Column(String name, StorageType storageType, List<Object> values) {
    public Column {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(storageType, "storageType");
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Column of(String name, StorageType storageType, Object... values) {
        List<Object> list = new ArrayList<>();
        Collections.addAll(list, values);
        return new Column(name, storageType, list);
    }

    public static Column allNull(String name, StorageType storageType, int rows) {
        return new Column(name, storageType, Collections.nCopies(rows, null));
    }

    public static Column allNaN(String name, int rows) {
        return new Column(name, StorageType.FLOAT64, Collections.nCopies(rows, Double.NaN));
    }

    public int size() {
        return values.size();
    }

    public boolean isNull(int row) {
        return isNullValue(values.get(row));
    }

    public int nonNullCount() {
        int count = 0;
        for (Object value : values) {
            if (!isNullValue(value)) {
                count++;
            }
        }
        return count;
    }

    public Optional<Object> firstNonNull() {
        for (Object value : values) {
            if (!isNullValue(value)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    /**
     * True for a floating-point column holding only NaN, and for any empty column.
     */
    public boolean isAllNaN() {
        if (values.isEmpty()) {
            return true;
        }
        return storageType.isFloat() && nonNullCount() == 0;
    }

    public Column renamed(String newName) {
        return new Column(newName, storageType, values);
    }

    static boolean isNullValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        return value instanceof Float f && f.isNaN();
    }
}
