package work.lcod.pmm.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable ordered set of equally long, uniquely named columns.
 */
public final class Table {
    private final List<Column> columns;
    private final int rowCount;

    public Table(List<Column> columns) {
        this(columns, columns.isEmpty() ? 0 : columns.get(0).size());
    }

    public Table(List<Column> columns, int rowCount) {
        Set<String> names = new LinkedHashSet<>();
        for (Column column : columns) {
            if (!names.add(column.name())) {
                throw new IllegalArgumentException("Duplicate column " + column.name());
            }
            if (column.size() != rowCount) {
                throw new IllegalArgumentException(
                    "Column " + column.name() + " has " + column.size() + " rows, expected " + rowCount
                );
            }
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rowCount = rowCount;
    }

    public static Table empty(int rowCount) {
        return new Table(List.of(), rowCount);
    }

    public List<Column> columns() {
        return columns;
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.name());
        }
        return names;
    }

    public int rowCount() {
        return rowCount;
    }

    public Optional<Column> column(String name) {
        for (Column column : columns) {
            if (column.name().equals(name)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    public boolean hasColumn(String name) {
        return column(name).isPresent();
    }

    /**
     * Replaces the column with the same name in place, or appends it.
     */
    public Table withColumn(Column column) {
        List<Column> updated = new ArrayList<>(columns);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).name().equals(column.name())) {
                updated.set(i, column);
                return new Table(updated, rowCount);
            }
        }
        updated.add(column);
        return new Table(updated, columns.isEmpty() ? column.size() : rowCount);
    }

    public Table withColumnAt(int index, Column column) {
        List<Column> updated = new ArrayList<>(columns);
        updated.set(index, column);
        return new Table(updated, rowCount);
    }

    /**
     * Rows of {@code other} below the rows of this table. Columns missing on either side are filled with
     * nulls; a column whose storage types differ becomes an object column.
     */
    public Table append(Table other) {
        List<Column> merged = new ArrayList<>();
        for (Column column : columns) {
            List<Object> values = new ArrayList<>(column.values());
            StorageType type = column.storageType();
            Optional<Column> match = other.column(column.name());
            if (match.isPresent()) {
                values.addAll(match.get().values());
                if (match.get().storageType() != type) {
                    type = StorageType.OBJECT;
                }
            } else {
                values.addAll(Collections.nCopies(other.rowCount, null));
            }
            merged.add(new Column(column.name(), type, values));
        }
        for (Column column : other.columns) {
            if (!hasColumn(column.name())) {
                List<Object> values = new ArrayList<>(Collections.nCopies(rowCount, null));
                values.addAll(column.values());
                merged.add(new Column(column.name(), column.storageType(), values));
            }
        }
        return new Table(merged, rowCount + other.rowCount);
    }
}
