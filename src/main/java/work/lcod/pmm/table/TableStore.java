package work.lcod.pmm.table;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Host table system: reads and writes named, typed columns at a path.
 */
public interface TableStore {
    Table read(Path path) throws IOException;

    void write(Table table, Path path) throws IOException;
}
