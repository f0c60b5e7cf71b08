package work.lcod.pmm.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

/**
 * Ordered, string-keyed tag map. Keys keep insertion order in memory and are sorted when rendered.
 */
public final class Tags {
    private final Map<String, TagValue> entries = new LinkedHashMap<>();

    public Tags() {}

    public static Tags empty() {
        return new Tags();
    }

    public static Tags from(Map<?, ?> raw) {
        Tags tags = new Tags();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new PmmException(PmmErrorCode.TYPE_MISMATCH, "Tag keys must be strings, got " + entry.getKey());
            }
            tags.put(key, TagValue.of(entry.getValue()));
        }
        return tags;
    }

    public Tags put(String name, Object value) {
        entries.put(name, TagValue.of(value));
        return this;
    }

    public TagValue get(String name) {
        return entries.get(name);
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public TagValue remove(String name) {
        return entries.remove(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public void forEach(BiConsumer<String, TagValue> consumer) {
        entries.forEach(consumer);
    }

    public Map<String, TagValue> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Plain map form; {@code sorted} orders keys lexicographically, otherwise insertion order is kept.
     */
    public Map<String, Object> toPlain(boolean sorted) {
        Map<String, TagValue> source = sorted ? new TreeMap<>(entries) : entries;
        Map<String, Object> plain = new LinkedHashMap<>();
        source.forEach((key, value) -> plain.put(key, value.toPlain()));
        return plain;
    }

    public Tags copy() {
        Tags copy = new Tags();
        copy.entries.putAll(entries);
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Tags tags && entries.equals(tags.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
