package work.lcod.pmm.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.pmm.model.Field;
import work.lcod.pmm.model.Metadata;
import work.lcod.pmm.model.TagValue;
import work.lcod.pmm.model.Tags;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

/**
 * Turns date tag values into formatted strings around a write, and back into dates after a read.
 *
 * <p>The format is the metadata's {@code datetagformat} when declared, otherwise the default one. Once a
 * date has been converted, the format used is recorded on the metadata so readers can reverse it.
 */
public final class DateTagTranscoder {
    private static final Logger log = LoggerFactory.getLogger(DateTagTranscoder.class);

    private final String defaultFormat;

    public DateTagTranscoder() {
        this(StrftimePattern.DEFAULT_FORMAT);
    }

    public DateTagTranscoder(String defaultFormat) {
        this.defaultFormat = defaultFormat;
    }

    /**
     * Replaces every date tag value (nested ones included) with its formatted string. Closing the
     * returned handle puts the original values back.
     *
     * @throws PmmException {@link PmmErrorCode#UNSUPPORTED_DATE_TAG_FORMAT} when there is a date to
     *     write and the format uses a directive that cannot be rendered; the metadata is left unchanged
     */
    public Conversion convert(Metadata metadata) {
        String format = metadata.dateTagFormat().orElse(defaultFormat);
        Conversion conversion = new Conversion();
        try {
            for (Tags tags : tagMaps(metadata)) {
                rewrite(tags, conversion, value -> value instanceof TagValue.Date date
                    ? new TagValue.Text(writePattern(format).format(date.value()))
                    : value);
            }
        } catch (RuntimeException ex) {
            conversion.close();
            throw ex;
        }
        if (conversion.converted() > 0 && metadata.dateTagFormat().isEmpty()) {
            metadata.setDateTagFormat(format);
        }
        return conversion;
    }

    /**
     * Re-parses every string tag value against the date tag format; strings that do not parse stay strings,
     * and so do all of them when the format cannot be read.
     *
     * @return number of values turned back into dates
     */
    public int restore(Metadata metadata) {
        String format = metadata.dateTagFormat().orElse(defaultFormat);
        Optional<StrftimePattern> compiled = readPattern(format);
        if (compiled.isEmpty()) {
            return 0;
        }
        StrftimePattern pattern = compiled.get();
        Conversion conversion = new Conversion();
        for (Tags tags : tagMaps(metadata)) {
            rewrite(tags, conversion, value -> {
                if (value instanceof TagValue.Text text) {
                    return pattern.parse(text.value()).<TagValue>map(TagValue.Date::new).orElse(value);
                }
                return value;
            });
        }
        return conversion.converted();
    }

    private static StrftimePattern writePattern(String format) {
        try {
            return StrftimePattern.compile(format);
        } catch (IllegalArgumentException ex) {
            throw new PmmException(PmmErrorCode.UNSUPPORTED_DATE_TAG_FORMAT, ex.getMessage(), ex);
        }
    }

    private static Optional<StrftimePattern> readPattern(String format) {
        try {
            return Optional.of(StrftimePattern.compile(format));
        } catch (IllegalArgumentException ex) {
            log.debug("Leaving date tags as strings: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    private static List<Tags> tagMaps(Metadata metadata) {
        List<Tags> maps = new ArrayList<>();
        maps.add(metadata.tags());
        for (Field field : metadata.fields()) {
            maps.add(field.tags());
        }
        return maps;
    }

    private static void rewrite(Tags tags, Conversion conversion, UnaryOperator<TagValue> scalar) {
        for (String name : new ArrayList<>(tags.names())) {
            TagValue original = tags.get(name);
            int before = conversion.converted;
            TagValue rewritten = original.mapScalars(value -> {
                TagValue mapped = scalar.apply(value);
                if (mapped != value) {
                    conversion.converted++;
                }
                return mapped;
            });
            if (conversion.converted > before) {
                tags.put(name, rewritten);
                conversion.undo.add(() -> tags.put(name, original));
            }
        }
    }

    /**
     * Undo handle for a conversion.
     */
    public static final class Conversion implements AutoCloseable {
        private final List<Runnable> undo = new ArrayList<>();
        private int converted;

        private Conversion() {}

        public int converted() {
            return converted;
        }

        @Override
        public void close() {
            for (int i = undo.size() - 1; i >= 0; i--) {
                undo.get(i).run();
            }
            undo.clear();
        }
    }
}
