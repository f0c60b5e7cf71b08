package work.lcod.pmm.codec;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.pmm.model.Attribute;
import work.lcod.pmm.model.PmmRecord;
import work.lcod.pmm.model.Role;
import work.lcod.pmm.model.TagValue;
import work.lcod.pmm.model.Tags;

/**
 * Converts records to ordered plain maps: required, then defaulted, then optional attributes, each
 * emitted only when present. Attribute tag maps are emitted with sorted keys.
 */
public final class RecordSerializer {
    // Dates outside tag maps (stats bounds, sample values) are not covered by the date tag format.
    private static final DateTimeFormatter UNTAGGED_DATES = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private RecordSerializer() {}

    public static Map<String, Object> toWire(PmmRecord record) {
        Map<String, Object> wire = new LinkedHashMap<>();
        Map<String, Object> values = record.values();
        for (Attribute attribute : record.schema().attributes()) {
            if (values.containsKey(attribute.name())) {
                wire.put(attribute.name(), wireValue(values.get(attribute.name())));
            }
        }
        return wire;
    }

    private static Object wireValue(Object value) {
        if (value instanceof PmmRecord record) {
            return toWire(record);
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(wireValue(item));
            }
            return items;
        }
        if (value instanceof Tags tags) {
            return tags.toPlain(true);
        }
        if (value instanceof TagValue tagValue) {
            return tagValue.mapScalars(RecordSerializer::isoDate).toPlain();
        }
        if (value instanceof Role role) {
            return role.wireName();
        }
        return value;
    }

    private static TagValue isoDate(TagValue value) {
        if (value instanceof TagValue.Date date) {
            return new TagValue.Text(UNTAGGED_DATES.format(date.value()));
        }
        return value;
    }

    /**
     * Turns the ISO-8601 strings written for field stats bounds and sample values in a parsed document
     * back into dates. Only strings in exactly the written form are converted.
     */
    @SuppressWarnings("unchecked")
    static void restoreUntaggedDates(Map<?, ?> document) {
        if (!(document.get("fields") instanceof List<?> fields)) {
            return;
        }
        for (Object entry : fields) {
            if (!(entry instanceof Map<?, ?> field)) {
                continue;
            }
            if (field.get("stats") instanceof Map<?, ?> stats) {
                ((Map<Object, Object>) stats).replaceAll(
                    (name, value) -> "min".equals(name) || "max".equals(name) ? untaggedDate(value) : value
                );
            }
            if (field.get("values") instanceof List<?> values) {
                ((Map<Object, Object>) field).put("values", untaggedDate(values));
            }
        }
    }

    private static Object untaggedDate(Object value) {
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(untaggedDate(item));
            }
            return items;
        }
        if (!(value instanceof String text)) {
            return value;
        }
        try {
            LocalDateTime date = LocalDateTime.parse(text, UNTAGGED_DATES);
            return UNTAGGED_DATES.format(date).equals(text) ? date : text;
        } catch (DateTimeParseException ex) {
            return text;
        }
    }
}
