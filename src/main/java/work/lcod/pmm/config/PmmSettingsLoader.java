package work.lcod.pmm.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.pmm.model.Arguments;
import work.lcod.pmm.model.FlatFileFormat;

/**
 * Reads {@link PmmSettings} from a {@code pmm.toml} file:
 *
 * <pre>
 * [sidecar]
 * date_tag_format = "%Y-%m-%d %H:%M:%S"
 * null_marker = "∅"
 * table_extension = ".csv"
 *
 * [csv]
 * encoding = "UTF-8"
 * separator = ","
 * quote = "\""
 * escape = "\\"
 * null_marker = ""
 * </pre>
 *
 * Absent keys keep their defaults.
 */
public final class PmmSettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(PmmSettingsLoader.class);

    public static final String FILE_NAME = "pmm.toml";

    private PmmSettingsLoader() {}

    public static Optional<PmmSettings> load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            TomlParseResult result = Toml.parse(Files.readString(path, StandardCharsets.UTF_8));
            if (result == null || result.hasErrors()) {
                log.warn("Ignoring {}: {}", path, result == null ? "no content" : result.errors());
                return Optional.empty();
            }
            return Optional.of(fromToml(result));
        } catch (IOException ex) {
            log.warn("Unable to read {}", path, ex);
            return Optional.empty();
        }
    }

    public static PmmSettings loadOrDefaults(Path path) {
        return load(path).orElseGet(PmmSettings::defaults);
    }

    public static PmmSettings fromToml(TomlParseResult result) {
        PmmSettings.Builder builder = PmmSettings.builder();
        TomlTable sidecar = result.getTable("sidecar");
        if (sidecar != null) {
            stringValue(sidecar, "date_tag_format").ifPresent(builder::dateTagFormat);
            stringValue(sidecar, "null_marker").ifPresent(builder::nullMarker);
            stringValue(sidecar, "table_extension").ifPresent(builder::tableExtension);
        }
        TomlTable csv = result.getTable("csv");
        if (csv != null) {
            Map<String, Object> format = new LinkedHashMap<>();
            stringValue(csv, "encoding").ifPresent(value -> format.put("encoding", value));
            stringValue(csv, "separator").ifPresent(value -> format.put("separator", value));
            stringValue(csv, "quote").ifPresent(value -> format.put("quote", value));
            stringValue(csv, "escape").ifPresent(value -> format.put("escape", value));
            stringValue(csv, "null_marker").ifPresent(value -> format.put("nullmarker", value));
            builder.csvFormat(new FlatFileFormat(Arguments.named(format)));
        }
        return builder.build();
    }

    private static Optional<String> stringValue(TomlTable table, String key) {
        return table.isString(key) ? Optional.ofNullable(table.getString(key)) : Optional.empty();
    }
}
