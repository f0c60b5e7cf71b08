package work.lcod.pmm.model;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

/**
 * Column-level descriptor: declared canonical type, role, tags and statistics.
 */
public final class Field extends PmmRecord {
    public static final RecordSchema SCHEMA = RecordSchema.builder("Field")
        .required("name", AttributeType.string())
        .required("type", AttributeType.string())
        .required("role", AttributeType.enumeration(Role.class, Role::fromWire))
        .required("tags", AttributeType.tags())
        .required("stats", AttributeType.record(Stats.class, Stats::new))
        .optional("values", AttributeType.listOf(AttributeType.any()))
        .optional("longname", AttributeType.string())
        .optional("description", AttributeType.string())
        .build();

    public Field(Arguments arguments) {
        super(SCHEMA, arguments);
    }

    public static Field of(String name, FieldType type, Role role) {
        return new Field(Arguments.of(name, type.wireName(), role, Tags.empty(), Stats.empty()));
    }

    public String name() {
        return (String) get("name");
    }

    /**
     * Declared type exactly as stored; see {@link #fieldType()} for the checked form.
     */
    public String type() {
        return (String) get("type");
    }

    public FieldType fieldType() {
        return FieldType.fromWire(type()).orElseThrow(() -> new PmmException(
            PmmErrorCode.UNKNOWN_CANONICAL_TYPE,
            "Unknown type " + type() + " for field " + name()
        ));
    }

    public Role role() {
        return (Role) get("role");
    }

    public Tags tags() {
        return (Tags) get("tags");
    }

    public Stats stats() {
        return (Stats) get("stats");
    }

    @SuppressWarnings("unchecked")
    public Optional<List<TagValue>> sampleValues() {
        return optional("values").map(list -> Collections.unmodifiableList((List<TagValue>) list));
    }

    public Optional<String> longName() {
        return optional("longname");
    }

    public Optional<String> description() {
        return optional("description");
    }

    /**
     * Copy owning its own tag map, for handing a field to another metadata record.
     */
    public Field copy() {
        return new Field(Arguments.named(values()).with("tags", tags().copy()));
    }

    public void setTag(String tag, Object value) {
        tags().put(tag, value);
    }

    public void setDescription(String description) {
        set("description", description);
    }

    public void setLongName(String longName) {
        set("longname", longName);
    }
}
