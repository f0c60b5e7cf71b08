package work.lcod.pmm.table;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import work.lcod.pmm.model.FlatFileFormat;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

/**
 * Maps table file extensions to the {@link TableStore} able to handle them.
 */
public final class TableStoreRegistry {
    private final Map<String, TableStore> stores = new LinkedHashMap<>();

    public static TableStoreRegistry withDefaults(FlatFileFormat csvFormat) {
        return new TableStoreRegistry().register(".csv", new CsvTableStore(csvFormat));
    }

    public TableStoreRegistry register(String extension, TableStore store) {
        stores.put(extension.toLowerCase(Locale.ROOT), store);
        return this;
    }

    public Map<String, TableStore> stores() {
        return Collections.unmodifiableMap(stores);
    }

    /**
     * Store registered for the longest extension {@code path} ends with.
     */
    public TableStore forPath(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        TableStore match = null;
        int matchLength = -1;
        for (Map.Entry<String, TableStore> entry : stores.entrySet()) {
            if (fileName.endsWith(entry.getKey()) && entry.getKey().length() > matchLength) {
                match = entry.getValue();
                matchLength = entry.getKey().length();
            }
        }
        if (match == null) {
            throw new PmmException(PmmErrorCode.TABLE_UNAVAILABLE, "No table store available for " + path);
        }
        return match;
    }
}
