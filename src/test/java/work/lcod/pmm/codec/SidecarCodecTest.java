package work.lcod.pmm.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.pmm.model.Arguments;
import work.lcod.pmm.model.Data;
import work.lcod.pmm.model.Field;
import work.lcod.pmm.model.FieldType;
import work.lcod.pmm.model.FlatFile;
import work.lcod.pmm.model.FlatFileFormat;
import work.lcod.pmm.model.Metadata;
import work.lcod.pmm.model.Role;
import work.lcod.pmm.model.Stats;
import work.lcod.pmm.model.Tag;
import work.lcod.pmm.model.TagValue;
import work.lcod.pmm.model.Tags;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

class SidecarCodecTest {
    private final SidecarCodec codec = new SidecarCodec();

    static String fixture(String name) throws IOException {
        try (InputStream in = SidecarCodecTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertTrue(in != null, () -> "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void hillstromReloadsToIdenticalText() throws IOException {
        var text = fixture("hillstrom.pmm");
        var metadata = codec.fromJson(text);

        assertEquals(64000L, metadata.recordCount());
        assertEquals(12L, metadata.fieldCount());
        var types = metadata.fields().stream().map(Field::type).toList();
        assertEquals(List.of(
            "integer", "string", "real", "boolean", "boolean", "string",
            "boolean", "string", "string", "boolean", "boolean", "real"
        ), types);
        assertEquals("hillstrom.csv", metadata.data().orElseThrow().flatFile().name());

        assertEquals(text, codec.toCanonicalJson(metadata));
    }

    @Test
    void victorloReloadsToIdenticalText() throws IOException {
        var text = fixture("victorlo.pmm");
        var metadata = codec.fromJson(text);

        assertEquals(
            new TagValue.Date(LocalDateTime.of(2017, 1, 23, 14, 5)),
            metadata.tags().get("audited")
        );
        assertEquals(new TagValue.Text("Victor Lo"), metadata.tags().get("owner"));
        var first = assertInstanceOf(TagValue.Nested.class, metadata.field("joined").tags().get("first"));
        assertInstanceOf(TagValue.Date.class, first.entries().get("at"));
        assertEquals(Role.DEPENDENT, metadata.field("score").role());
        assertEquals("Credit score", metadata.field("score").longName().orElseThrow());
        assertEquals(77.5, ((TagValue.Real) metadata.field("age").stats().max().orElseThrow()).value());

        assertEquals(text, codec.toCanonicalJson(metadata));
    }

    @Test
    void renderingLayout() {
        var metadata = Metadata.of("tiny", 0, List.of(Field.of("flag", FieldType.BOOLEAN, Role.UNSPECIFIED)));
        var expected = String.join("\n",
            "{",
            "    \"pmmversion\": \"0.1\",",
            "    \"name\": \"tiny\",",
            "    \"recordcount\": 0,",
            "    \"fieldcount\": 1,",
            "    \"fields\": [",
            "        {",
            "            \"name\": \"flag\",",
            "            \"type\": \"boolean\",",
            "            \"role\": \"\",",
            "            \"tags\": {},",
            "            \"stats\": {}",
            "        }",
            "    ],",
            "    \"tags\": {}",
            "}"
        );
        assertEquals(expected, codec.toCanonicalJson(metadata));
    }

    @Test
    void structuralRoundTrip() {
        var age = Field.of("age", FieldType.REAL, Role.INDEPENDENT);
        age.setTag(Tag.MAXIMIZE, true);
        age.setTag("range", List.of(0, 120.5));
        age.setDescription("Age in years");
        var metadata = Metadata.of("people", 3, List.of(age, Field.of("name", FieldType.STRING, Role.IGNORE)));
        metadata.setTag("zeta", Map.of("nested", "value"));
        metadata.setTag("alpha", LocalDateTime.of(2020, 5, 17, 8, 0, 1));
        metadata.setCreator("someone");
        metadata.setData(Data.of(FlatFile.of("people.csv", FlatFileFormat.defaults())));

        var decoded = codec.fromJson(codec.toCanonicalJson(metadata));

        assertEquals(metadata, decoded);
        assertEquals(List.of("alpha", "zeta"), List.copyOf(decoded.tags().names()));
    }

    @Test
    void dateTagsAreOnlyTransformedAroundTheWrite() {
        var when = LocalDateTime.of(2016, 2, 1, 9, 30);
        var metadata = Metadata.of("events", 0, List.of());
        metadata.setTag("created", when);

        var text = codec.toCanonicalJson(metadata);

        assertTrue(text.contains("\"created\": \"2016-02-01 09:30:00\""), text);
        assertTrue(text.contains("\"datetagformat\": \"%Y-%m-%d %H:%M:%S\""), text);
        assertEquals(new TagValue.Date(when), metadata.tags().get("created"));
        assertEquals("%Y-%m-%d %H:%M:%S", metadata.dateTagFormat().orElseThrow());
    }

    @Test
    void nonFiniteRealsAreWrittenBareAndReadBack() {
        var metadata = Metadata.of("ratios", 0, List.of());
        metadata.setTag("ratio", Double.NaN);
        metadata.setTag("ceiling", Double.POSITIVE_INFINITY);
        metadata.setTag("floor", Double.NEGATIVE_INFINITY);

        var text = codec.toCanonicalJson(metadata);

        assertTrue(text.contains("\"ratio\": NaN"), text);
        assertTrue(text.contains("\"ceiling\": Infinity"), text);
        assertTrue(text.contains("\"floor\": -Infinity"), text);
        var decoded = codec.fromJson(text);
        assertEquals(new TagValue.Real(Double.NaN), decoded.tags().get("ratio"));
        assertEquals(new TagValue.Real(Double.NEGATIVE_INFINITY), decoded.tags().get("floor"));
        assertEquals(metadata, decoded);
    }

    @Test
    void datesInStatsAndSampleValuesAreReadBackAsDates() {
        var first = LocalDateTime.of(2020, 1, 2, 3, 4, 5);
        var last = LocalDateTime.of(2021, 6, 30, 23, 59, 59, 500_000_000);
        var stats = new Stats(Arguments.named(Map.of("min", first, "max", last)));
        var when = new Field(Arguments.of(
            "when", "datestamp", Role.UNSPECIFIED, Tags.empty(), stats, List.of(first, "2020-01-02T03:04", last)
        ));
        var metadata = Metadata.of("events", 3, List.of(when));

        var text = codec.toCanonicalJson(metadata);

        assertTrue(text.contains("\"min\": \"2020-01-02T03:04:05\""), text);
        var decoded = codec.fromJson(text);
        assertEquals(metadata, decoded);
        assertEquals(new TagValue.Date(last), decoded.field("when").stats().max().orElseThrow());
        assertEquals(new TagValue.Text("2020-01-02T03:04"), decoded.field("when").sampleValues().orElseThrow().get(1));
        assertFalse(decoded.dateTagFormat().isPresent());
    }

    @Test
    void sidecarWithUnreadableDateTagFormatStillLoads() {
        var metadata = Metadata.of("events", 0, List.of());
        metadata.setDateTagFormat("%Y-%m-%d %z");
        metadata.setTag("created", "2016-02-01 +0000");

        var decoded = codec.fromJson(codec.toCanonicalJson(metadata));

        assertEquals(new TagValue.Text("2016-02-01 +0000"), decoded.tags().get("created"));
        assertEquals("%Y-%m-%d %z", decoded.dateTagFormat().orElseThrow());
    }

    @Test
    void noDateTagsMeansNoRecordedFormat() {
        var metadata = Metadata.of("plain", 0, List.of());
        metadata.setTag("note", "2016-02-01 09:30:00");
        assertFalse(codec.toCanonicalJson(metadata).contains("datetagformat"));
    }

    @Test
    void malformedSidecarsAreRejected() {
        var notJson = assertThrows(PmmException.class, () -> codec.fromJson("{\"name\": "));
        assertEquals(PmmErrorCode.MALFORMED_SIDECAR, notJson.code());
        var notObject = assertThrows(PmmException.class, () -> codec.fromJson("[1, 2]"));
        assertEquals(PmmErrorCode.MALFORMED_SIDECAR, notObject.code());
        var incomplete = assertThrows(PmmException.class, () -> codec.fromJson("{\"name\": \"x\"}"));
        assertEquals(PmmErrorCode.MISSING_REQUIRED_ATTRIBUTE, incomplete.code());
    }

    @Test
    void savesWithoutTrailingNewline() throws IOException {
        var dir = Files.createTempDirectory("pmm-codec");
        var path = dir.resolve("tiny.pmm");
        var metadata = Metadata.of("tiny", 1, List.of(Field.of("x", FieldType.INTEGER, Role.UNSPECIFIED)));
        codec.save(metadata, path);
        var written = Files.readString(path, StandardCharsets.UTF_8);
        assertTrue(written.endsWith("}"));
        assertEquals(metadata, codec.load(path));
    }
}
