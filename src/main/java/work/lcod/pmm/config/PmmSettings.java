package work.lcod.pmm.config;

import java.util.Objects;
import work.lcod.pmm.codec.StrftimePattern;
import work.lcod.pmm.model.FlatFileFormat;

/**
 * Immutable settings shared by the sidecar codec, the null-sentinel codec and the bundled CSV store.
 */
public record PmmSettings(
    String dateTagFormat,
    String nullMarker,
    String tableExtension,
    FlatFileFormat csvFormat
) {
    public static final String DEFAULT_NULL_MARKER = "∅";
    public static final String DEFAULT_TABLE_EXTENSION = ".csv";

    public PmmSettings {
        Objects.requireNonNull(dateTagFormat, "dateTagFormat");
        Objects.requireNonNull(nullMarker, "nullMarker");
        Objects.requireNonNull(tableExtension, "tableExtension");
        Objects.requireNonNull(csvFormat, "csvFormat");
        if (nullMarker.isEmpty()) {
            throw new IllegalArgumentException("nullMarker must not be empty");
        }
    }

    public static PmmSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String dateTagFormat = StrftimePattern.DEFAULT_FORMAT;
        private String nullMarker = DEFAULT_NULL_MARKER;
        private String tableExtension = DEFAULT_TABLE_EXTENSION;
        private FlatFileFormat csvFormat = FlatFileFormat.defaults();

        public Builder dateTagFormat(String dateTagFormat) {
            this.dateTagFormat = dateTagFormat;
            return this;
        }

        public Builder nullMarker(String nullMarker) {
            this.nullMarker = nullMarker;
            return this;
        }

        public Builder tableExtension(String tableExtension) {
            this.tableExtension = tableExtension;
            return this;
        }

        public Builder csvFormat(FlatFileFormat csvFormat) {
            this.csvFormat = csvFormat;
            return this;
        }

        public PmmSettings build() {
            return new PmmSettings(dateTagFormat, nullMarker, tableExtension, csvFormat);
        }
    }
}
