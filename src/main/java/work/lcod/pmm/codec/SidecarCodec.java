package work.lcod.pmm.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Collectors;
import work.lcod.pmm.model.Arguments;
import work.lcod.pmm.model.Metadata;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

/**
 * Reads and writes the canonical JSON text of a sidecar file.
 *
 * <p>Two logically identical documents render to byte-identical text: four-space indentation, attributes
 * in declaration order, tag keys sorted, trailing whitespace stripped and no final newline. Non-finite
 * reals are written as the bare tokens {@code NaN}, {@code Infinity} and {@code -Infinity}.
 */
public final class SidecarCodec {
    private static final ObjectMapper JSON = JsonMapper.builder()
        .enable(DeserializationFeature.USE_LONG_FOR_INTS)
        .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .build();
    private static final ObjectWriter WRITER = JSON.writer(new CanonicalPrettyPrinter());

    private final DateTagTranscoder transcoder;

    public SidecarCodec() {
        this(new DateTagTranscoder());
    }

    public SidecarCodec(DateTagTranscoder transcoder) {
        this.transcoder = transcoder;
    }

    public String toCanonicalJson(Metadata metadata) {
        String text;
        try (DateTagTranscoder.Conversion ignored = transcoder.convert(metadata)) {
            text = WRITER.writeValueAsString(RecordSerializer.toWire(metadata));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to render metadata " + metadata.name(), ex);
        }
        return text.lines().map(String::stripTrailing).collect(Collectors.joining("\n"));
    }

    public Metadata fromJson(String text) {
        Object parsed;
        try {
            parsed = JSON.readValue(text, Object.class);
        } catch (JsonProcessingException ex) {
            throw new PmmException(PmmErrorCode.MALFORMED_SIDECAR, "Invalid sidecar JSON: " + ex.getOriginalMessage(), ex);
        }
        if (!(parsed instanceof Map<?, ?> map)) {
            throw new PmmException(PmmErrorCode.MALFORMED_SIDECAR, "Sidecar JSON must be an object");
        }
        RecordSerializer.restoreUntaggedDates(map);
        Metadata metadata = new Metadata(Arguments.named(map));
        transcoder.restore(metadata);
        return metadata;
    }

    public void save(Metadata metadata, Path path) throws IOException {
        Files.writeString(path, toCanonicalJson(metadata), StandardCharsets.UTF_8);
    }

    public Metadata load(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }
}
