package work.lcod.pmm.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

/**
 * Dataset-level descriptor persisted as the sidecar file.
 *
 * <p>The field list and the dataset tag map are owned by this record; {@code fieldcount} is kept equal
 * to the number of fields by every mutator.
 */
public final class Metadata extends PmmRecord {
    public static final String PMM_VERSION = "0.1";

    public static final RecordSchema SCHEMA = RecordSchema.builder("Metadata")
        .required("pmmversion", AttributeType.string())
        .required("name", AttributeType.string())
        .required("recordcount", AttributeType.integer())
        .required("fieldcount", AttributeType.integer())
        .required("fields", AttributeType.listOf(AttributeType.record(Field.class, Field::new)))
        .required("tags", AttributeType.tags())
        .optional("data", AttributeType.record(Data.class, Data::new))
        .optional("description", AttributeType.string())
        .optional("creator", AttributeType.string())
        .optional("contributor", AttributeType.string())
        .optional("permissions", AttributeType.string())
        .optional("datetagformat", AttributeType.string())
        .build();

    /**
     * Builds metadata from positional and named arguments. With at least two positional arguments
     * ({@code name, recordcount[, fields]}) the format version is supplied and the field count derived
     * from the field list, so callers never pass them directly.
     */
    public Metadata(Arguments arguments) {
        super(SCHEMA, withImplicitCounts(arguments));
        long declared = fieldCount();
        if (declared != fieldList().size()) {
            throw new PmmException(
                PmmErrorCode.FIELD_COUNT_MISMATCH,
                "Metadata fieldcount " + declared + " <> number of fields " + fieldList().size()
            );
        }
        if (!isSupportedVersion(pmmVersion())) {
            throw new PmmException(
                PmmErrorCode.UNSUPPORTED_FORMAT_VERSION,
                "Can't handle pmmversion " + pmmVersion() + " (vs " + PMM_VERSION + ")"
            );
        }
    }

    public static Metadata of(String name, long recordCount, List<Field> fields) {
        return new Metadata(Arguments.of(name, recordCount, fields).with("tags", Tags.empty()));
    }

    private static Arguments withImplicitCounts(Arguments arguments) {
        List<Object> positional = arguments.positional();
        if (positional.size() < 2) {
            return arguments;
        }
        List<Object> expanded = new ArrayList<>(positional);
        expanded.add(0, PMM_VERSION);
        if (expanded.size() >= 4) {
            Object fields = expanded.get(3);
            expanded.add(3, fields instanceof List<?> list ? (Object) (long) list.size() : null);
        }
        return arguments.withPositional(expanded);
    }

    private static boolean isSupportedVersion(String version) {
        try {
            return Double.parseDouble(version.trim()) == Double.parseDouble(PMM_VERSION);
        } catch (NumberFormatException ex) {
            return false;
        }
    }

    public String pmmVersion() {
        return (String) get("pmmversion");
    }

    public String name() {
        return (String) get("name");
    }

    public long recordCount() {
        return (Long) get("recordcount");
    }

    public long fieldCount() {
        return (Long) get("fieldcount");
    }

    public List<Field> fields() {
        return Collections.unmodifiableList(fieldList());
    }

    public List<String> fieldNames() {
        List<String> names = new ArrayList<>();
        for (Field field : fieldList()) {
            names.add(field.name());
        }
        return names;
    }

    public Tags tags() {
        return (Tags) get("tags");
    }

    public Optional<Data> data() {
        return optional("data");
    }

    public Optional<String> description() {
        return optional("description");
    }

    public Optional<String> creator() {
        return optional("creator");
    }

    public Optional<String> contributor() {
        return optional("contributor");
    }

    public Optional<String> permissions() {
        return optional("permissions");
    }

    public Optional<String> dateTagFormat() {
        return optional("datetagformat");
    }

    public void setName(String name) {
        set("name", name);
    }

    public void setRecordCount(long recordCount) {
        set("recordcount", recordCount);
    }

    public void setData(Data data) {
        set("data", data);
    }

    public void setDescription(String description) {
        set("description", description);
    }

    public void setCreator(String creator) {
        set("creator", creator);
    }

    public void setContributor(String contributor) {
        set("contributor", contributor);
    }

    public void setPermissions(String permissions) {
        set("permissions", permissions);
    }

    public void setDateTagFormat(String format) {
        set("datetagformat", format);
    }

    public Optional<Field> findField(String name) {
        for (Field field : fieldList()) {
            if (field.name().equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    public Field field(String name) {
        return findField(name).orElseThrow(() -> new PmmException(PmmErrorCode.UNKNOWN_FIELD, "No field named " + name));
    }

    public boolean hasField(String name) {
        return findField(name).isPresent();
    }

    /**
     * Replaces the field with the same name in place, or appends it.
     */
    public void addField(Field field) {
        List<Field> fields = fieldList();
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(field.name())) {
                fields.set(i, field);
                return;
            }
        }
        fields.add(field);
        syncFieldCount();
    }

    public boolean removeField(String name) {
        boolean removed = fieldList().removeIf(field -> field.name().equals(name));
        syncFieldCount();
        return removed;
    }

    /**
     * Rebuilds the field list in {@code order}, which must name every field exactly once.
     */
    public void reorderFields(List<String> order) {
        Map<String, Field> byName = new LinkedHashMap<>();
        for (Field field : fieldList()) {
            if (byName.put(field.name(), field) != null) {
                throw new PmmException(PmmErrorCode.DUPLICATE_FIELD_NAME, "Field " + field.name() + " is declared twice");
            }
        }
        if (order.size() != byName.size() || !byName.keySet().containsAll(order)) {
            throw new IllegalArgumentException("Field order " + order + " does not match fields " + byName.keySet());
        }
        List<Field> fields = fieldList();
        fields.clear();
        for (String name : order) {
            fields.add(byName.get(name));
        }
    }

    public void setTag(String tag, Object value) {
        tags().put(tag, value);
    }

    public void setFieldTag(String fieldName, String tag, Object value) {
        field(fieldName).setTag(tag, value);
    }

    /**
     * Checks that every field has a canonical type and that field names are unique.
     */
    public void validate() {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (Field field : fieldList()) {
            field.fieldType();
            if (!seen.add(field.name())) {
                duplicates.add(field.name());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new PmmException(
                PmmErrorCode.DUPLICATE_FIELD_NAME,
                "Not all field names are unique: " + String.join(" ", duplicates)
            );
        }
    }

    @SuppressWarnings("unchecked")
    private List<Field> fieldList() {
        return (List<Field>) get("fields");
    }

    private void syncFieldCount() {
        set("fieldcount", (long) fieldList().size());
    }
}
