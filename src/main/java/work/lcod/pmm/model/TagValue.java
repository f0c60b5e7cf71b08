package work.lcod.pmm.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

/**
 * Closed set of values a tag (or an untyped attribute such as {@code stats.min}) can hold.
 */
public sealed interface TagValue
    permits TagValue.Null, TagValue.Bool, TagValue.Int, TagValue.Real, TagValue.Text, TagValue.Date,
        TagValue.Seq, TagValue.Nested {

    Null NULL = new Null();

    /**
     * Plain Java form: {@code null}, Boolean, Long, Double, String, LocalDateTime, List or ordered Map.
     */
    Object toPlain();

    /**
     * Applies {@code fn} to every scalar, rebuilding sequences and nested maps around the results.
     */
    default TagValue mapScalars(UnaryOperator<TagValue> fn) {
        return fn.apply(this);
    }

    static TagValue of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof TagValue value) {
            return value;
        }
        if (raw instanceof Boolean b) {
            return new Bool(b);
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return new Int(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float) {
            return new Real(((Number) raw).doubleValue());
        }
        if (raw instanceof CharSequence text) {
            return new Text(text.toString());
        }
        if (raw instanceof LocalDateTime dateTime) {
            return new Date(dateTime);
        }
        if (raw instanceof List<?> list) {
            List<TagValue> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(of(item));
            }
            return new Seq(items);
        }
        if (raw instanceof Tags tags) {
            return new Nested(tags);
        }
        if (raw instanceof Map<?, ?> map) {
            return new Nested(Tags.from(map));
        }
        throw new PmmException(
            PmmErrorCode.TYPE_MISMATCH,
            "Unsupported tag value type " + raw.getClass().getName()
        );
    }

    record Null() implements TagValue {
        @Override
        public Object toPlain() {
            return null;
        }
    }

    record Bool(boolean value) implements TagValue {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Int(long value) implements TagValue {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Real(double value) implements TagValue {
        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Text(String value) implements TagValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Date(LocalDateTime value) implements TagValue {
        public Date {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Seq(List<TagValue> items) implements TagValue {
        public Seq {
            items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        @Override
        public Object toPlain() {
            List<Object> plain = new ArrayList<>(items.size());
            for (TagValue item : items) {
                plain.add(item.toPlain());
            }
            return plain;
        }

        @Override
        public TagValue mapScalars(UnaryOperator<TagValue> fn) {
            List<TagValue> mapped = new ArrayList<>(items.size());
            for (TagValue item : items) {
                mapped.add(item.mapScalars(fn));
            }
            return new Seq(mapped);
        }
    }

    record Nested(Tags entries) implements TagValue {
        public Nested {
            Objects.requireNonNull(entries, "entries");
        }

        @Override
        public Object toPlain() {
            return entries.toPlain(false);
        }

        @Override
        public TagValue mapScalars(UnaryOperator<TagValue> fn) {
            Tags mapped = new Tags();
            entries.forEach((key, value) -> mapped.put(key, value.mapScalars(fn)));
            return new Nested(mapped);
        }
    }
}
