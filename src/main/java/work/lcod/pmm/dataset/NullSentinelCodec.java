package work.lcod.pmm.dataset;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pmm.model.Field;
import work.lcod.pmm.model.FieldType;
import work.lcod.pmm.model.Metadata;
import work.lcod.pmm.table.Column;
import work.lcod.pmm.table.StorageType;
import work.lcod.pmm.table.Table;

/**
 * Carries all-null string and boolean columns through table stores that cannot hold them.
 *
 * <p>Such a column is written as an all-NaN float column named {@code <name>_<marker><t>}, where
 * {@code t} is {@code b}, {@code s} or {@code u} for a field declared boolean, string or anything else.
 */
public final class NullSentinelCodec {
    private static final Logger log = LoggerFactory.getLogger(NullSentinelCodec.class);

    private final String suffix;

    public NullSentinelCodec(String nullMarker) {
        if (nullMarker == null || nullMarker.isEmpty()) {
            throw new IllegalArgumentException("nullMarker must not be empty");
        }
        this.suffix = "_" + nullMarker;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * Table to hand to the store. Columns with any non-null value are never touched, and a column whose
     * sentinel name is already taken is left as it is.
     */
    public Table encode(Table table, Metadata metadata) {
        List<String> names = table.columnNames();
        Table encoded = table;
        for (int i = 0; i < names.size(); i++) {
            Column column = table.columns().get(i);
            if (!needsSentinel(column, table.rowCount())) {
                continue;
            }
            String sentinel = column.name() + suffix + typeChar(metadata.findField(column.name()));
            if (names.contains(sentinel)) {
                log.debug("Sentinel {} already present, leaving column {} unchanged", sentinel, column.name());
                continue;
            }
            encoded = encoded.withColumnAt(i, Column.allNaN(sentinel, table.rowCount()));
            log.debug("Encoded all-null column {} as {}", column.name(), sentinel);
        }
        return encoded;
    }

    /**
     * Reverses {@link #encode}: every all-NaN column carrying a sentinel name gets its original name back
     * as an all-null column. An entry whose original name already exists, in the input or from an earlier
     * sentinel, is left alone.
     */
    public Table decode(Table table) {
        List<String> names = table.columnNames();
        Table decoded = table;
        for (int i = 0; i < names.size(); i++) {
            Column column = table.columns().get(i);
            String name = column.name();
            if (name.length() <= suffix.length() || !name.substring(0, name.length() - 1).endsWith(suffix)
                || !column.isAllNaN()) {
                continue;
            }
            String original = name.substring(0, name.length() - suffix.length() - 1);
            char type = name.charAt(name.length() - 1);
            if (decoded.hasColumn(original)) {
                log.debug("Column {} already present, leaving sentinel column {} as is", original, name);
                continue;
            }
            StorageType storage = type == 'b' && table.rowCount() == 0 ? StorageType.BOOL : StorageType.OBJECT;
            decoded = decoded.withColumnAt(i, Column.allNull(original, storage, table.rowCount()));
            log.debug("Decoded sentinel column {} as {}", name, original);
        }
        return decoded;
    }

    private static boolean needsSentinel(Column column, int rows) {
        return switch (column.storageType()) {
            case OBJECT -> column.nonNullCount() == 0;
            case BOOL -> rows == 0;
            default -> false;
        };
    }

    private static char typeChar(Optional<Field> field) {
        FieldType type = field.flatMap(f -> FieldType.fromWire(f.type())).orElse(null);
        if (type == FieldType.BOOLEAN) {
            return 'b';
        }
        return type == FieldType.STRING ? 's' : 'u';
    }
}
