package work.lcod.pmm.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.pmm.model.Field;
import work.lcod.pmm.model.FieldType;
import work.lcod.pmm.model.Metadata;
import work.lcod.pmm.model.Role;
import work.lcod.pmm.model.TagValue;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

class DateTagTranscoderTest {
    private static final LocalDateTime WHEN = LocalDateTime.of(2017, 1, 23, 14, 5, 9);

    private static Metadata sample() {
        var metadata = Metadata.of("dated", 0, List.of(Field.of("age", FieldType.REAL, Role.UNSPECIFIED)));
        metadata.setTag("when", WHEN);
        metadata.setFieldTag("age", "history", List.of(WHEN, Map.of("at", WHEN)));
        return metadata;
    }

    @Test
    void convertsEveryDateAndUndoesOnClose() {
        var metadata = sample();
        var transcoder = new DateTagTranscoder();
        try (var conversion = transcoder.convert(metadata)) {
            assertEquals(3, conversion.converted());
            assertEquals(new TagValue.Text("2017-01-23 14:05:09"), metadata.tags().get("when"));
            assertEquals(
                List.of("2017-01-23 14:05:09", Map.of("at", "2017-01-23 14:05:09")),
                metadata.field("age").tags().get("history").toPlain()
            );
        }
        assertEquals(new TagValue.Date(WHEN), metadata.tags().get("when"));
        assertEquals(List.of(WHEN, Map.of("at", WHEN)), metadata.field("age").tags().get("history").toPlain());
        assertEquals(StrftimePattern.DEFAULT_FORMAT, metadata.dateTagFormat().orElseThrow());
    }

    @Test
    void declaredFormatWins() {
        var metadata = sample();
        metadata.setDateTagFormat("%d/%m/%Y");
        try (var ignored = new DateTagTranscoder().convert(metadata)) {
            assertEquals(new TagValue.Text("23/01/2017"), metadata.tags().get("when"));
        }
        assertEquals("%d/%m/%Y", metadata.dateTagFormat().orElseThrow());
    }

    @Test
    void restoreLeavesUnparsableStringsAlone() {
        var metadata = Metadata.of("dated", 0, List.of());
        metadata.setTag("when", "2017-01-23 14:05:09");
        metadata.setTag("who", "Victor");
        metadata.setTag("list", List.of("2017-01-23 14:05:09", "later"));

        int restored = new DateTagTranscoder().restore(metadata);

        assertEquals(2, restored);
        assertEquals(new TagValue.Date(WHEN), metadata.tags().get("when"));
        assertEquals(new TagValue.Text("Victor"), metadata.tags().get("who"));
        assertEquals(List.of(WHEN, "later"), metadata.tags().get("list").toPlain());
    }

    @Test
    void restoreUsesRecordedFormat() {
        var metadata = Metadata.of("dated", 0, List.of());
        metadata.setDateTagFormat("%d/%m/%Y");
        metadata.setTag("when", "23/01/2017");
        metadata.setTag("iso", "2017-01-23 14:05:09");
        new DateTagTranscoder().restore(metadata);
        assertEquals(new TagValue.Date(LocalDateTime.of(2017, 1, 23, 0, 0)), metadata.tags().get("when"));
        assertTrue(metadata.tags().get("iso") instanceof TagValue.Text);
    }

    @Test
    void unreadableFormatLeavesStringsAlone() {
        var metadata = Metadata.of("dated", 0, List.of());
        metadata.setDateTagFormat("%d %Z");
        metadata.setTag("when", "23 UTC");

        assertEquals(0, new DateTagTranscoder().restore(metadata));
        assertEquals(new TagValue.Text("23 UTC"), metadata.tags().get("when"));
    }

    @Test
    void unwritableFormatFailsWithCodeAndKeepsDates() {
        var metadata = sample();
        metadata.setDateTagFormat("%U");

        var error = assertThrows(PmmException.class, () -> new DateTagTranscoder().convert(metadata));

        assertEquals(PmmErrorCode.UNSUPPORTED_DATE_TAG_FORMAT, error.code());
        assertEquals(new TagValue.Date(WHEN), metadata.tags().get("when"));
        assertEquals(List.of(WHEN, Map.of("at", WHEN)), metadata.field("age").tags().get("history").toPlain());
    }

    @Test
    void unwritableFormatIsIgnoredWithoutDates() {
        var metadata = Metadata.of("plain", 0, List.of());
        metadata.setDateTagFormat("%U");
        metadata.setTag("note", "week 3");
        try (var conversion = new DateTagTranscoder().convert(metadata)) {
            assertEquals(0, conversion.converted());
        }
    }
}
