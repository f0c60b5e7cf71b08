package work.lcod.pmm.dataset;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pmm.codec.DateTagTranscoder;
import work.lcod.pmm.codec.SidecarCodec;
import work.lcod.pmm.config.PmmSettings;
import work.lcod.pmm.model.Metadata;
import work.lcod.pmm.table.Table;
import work.lcod.pmm.table.TableStore;
import work.lcod.pmm.table.TableStoreRegistry;

/**
 * Reads and writes a dataset as a table file plus its sidecar.
 */
public final class DatasetIO {
    private static final Logger log = LoggerFactory.getLogger(DatasetIO.class);

    private final PmmSettings settings;
    private final TableStoreRegistry stores;
    private final SidecarCodec codec;
    private final NullSentinelCodec sentinels;

    public DatasetIO(PmmSettings settings, TableStoreRegistry stores) {
        this.settings = settings;
        this.stores = stores;
        this.codec = new SidecarCodec(new DateTagTranscoder(settings.dateTagFormat()));
        this.sentinels = new NullSentinelCodec(settings.nullMarker());
    }

    public DatasetIO(PmmSettings settings) {
        this(settings, TableStoreRegistry.withDefaults(settings.csvFormat()));
    }

    public DatasetIO() {
        this(PmmSettings.defaults());
    }

    public SidecarCodec codec() {
        return codec;
    }

    /**
     * Reads the table at {@code tablePath} and its sidecar. Without a sidecar the metadata is inferred
     * from the table. Nothing is written.
     */
    public Dataset read(Path tablePath) throws IOException {
        TableStore store = stores.forPath(tablePath);
        SidecarPaths.SidecarLocation location = SidecarPaths.locate(tablePath, settings.tableExtension());
        Table table = sentinels.decode(store.read(tablePath));
        Metadata metadata;
        if (Files.exists(location.sidecar())) {
            metadata = codec.load(location.sidecar());
            metadata.validate();
        } else {
            log.debug("No sidecar at {}, inferring metadata for {}", location.sidecar(), location.datasetName());
            metadata = TypeInference.createMetadata(table, location.datasetName());
        }
        Dataset dataset = new Dataset(table, metadata);
        dataset.updateMetadata();
        log.info("Read dataset {} ({} records, {} fields) from {}",
            metadata.name(), metadata.recordCount(), metadata.fieldCount(), tablePath);
        return dataset;
    }

    /**
     * Writes the table, then the sidecar. The metadata is reconciled with the table and rendered before
     * anything touches the disk. When either write fails both files are removed before the failure is
     * rethrown.
     */
    public void write(Dataset dataset, Path tablePath) throws IOException {
        TableStore store = stores.forPath(tablePath);
        SidecarPaths.SidecarLocation location = SidecarPaths.locate(tablePath, settings.tableExtension());
        Metadata metadata = dataset.metadata();
        dataset.updateMetadata();
        metadata.validate();
        String sidecarText = codec.toCanonicalJson(metadata);
        Table encoded = sentinels.encode(dataset.table(), metadata);
        try {
            store.write(encoded, tablePath);
            Files.writeString(location.sidecar(), sidecarText, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException ex) {
            cleanUp(ex, tablePath, location.sidecar());
            throw ex;
        }
        log.info("Wrote dataset {} ({} records, {} fields) to {}",
            metadata.name(), metadata.recordCount(), metadata.fieldCount(), tablePath);
    }

    private static void cleanUp(Exception failure, Path... paths) {
        log.warn("Failed to write dataset to {}, removing partial files", paths[0], failure);
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException ex) {
                failure.addSuppressed(ex);
            }
        }
    }
}
