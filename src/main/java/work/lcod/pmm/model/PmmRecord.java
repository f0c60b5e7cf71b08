package work.lcod.pmm.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

/**
 * Base class of every metadata entity. Values are assigned through the owning {@link RecordSchema}:
 * positional arguments fill required then defaulted attributes, named arguments override them,
 * remaining defaulted attributes get their defaults and every required attribute must end up set.
 */
public abstract class PmmRecord {
    private final RecordSchema schema;
    private final Map<String, Object> values = new LinkedHashMap<>();

    protected PmmRecord(RecordSchema schema, Arguments arguments) {
        this.schema = Objects.requireNonNull(schema, "schema");
        List<Attribute> positional = schema.positionalAttributes();
        List<Object> supplied = arguments.positional();
        if (supplied.size() > positional.size()) {
            throw new PmmException(
                PmmErrorCode.TOO_MANY_ARGUMENTS,
                "Constructor for " + schema.recordName() + " takes at most " + positional.size()
                    + " positional arguments, " + supplied.size() + " given"
            );
        }
        for (int i = 0; i < supplied.size(); i++) {
            assign(positional.get(i), supplied.get(i));
        }
        for (Map.Entry<String, Object> entry : arguments.named().entrySet()) {
            Attribute attribute = schema.attribute(entry.getKey()).orElseThrow(() -> new PmmException(
                PmmErrorCode.UNKNOWN_ATTRIBUTE,
                "Unknown attribute " + entry.getKey() + " for " + schema.recordName()
            ));
            assign(attribute, entry.getValue());
        }
        for (Attribute attribute : schema.attributes()) {
            if (attribute.kind() == AttributeKind.DEFAULTED && !values.containsKey(attribute.name())) {
                assign(attribute, attribute.defaultValue());
            }
        }
        for (Attribute attribute : schema.attributes()) {
            if (attribute.kind() == AttributeKind.REQUIRED && !values.containsKey(attribute.name())) {
                throw new PmmException(
                    PmmErrorCode.MISSING_REQUIRED_ATTRIBUTE,
                    "Constructor for " + schema.recordName() + " missing required argument " + attribute.name()
                );
            }
        }
    }

    public final RecordSchema schema() {
        return schema;
    }

    public final boolean has(String name) {
        return values.containsKey(name);
    }

    /**
     * Present attribute values keyed by name, in assignment order.
     */
    public final Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    protected final Object get(String name) {
        return values.get(name);
    }

    @SuppressWarnings("unchecked")
    protected final <T> Optional<T> optional(String name) {
        return Optional.ofNullable((T) values.get(name));
    }

    /**
     * Assigns through the schema so the value is coerced like a constructor argument; {@code null} clears it.
     */
    protected final void set(String name, Object value) {
        Attribute attribute = schema.attribute(name).orElseThrow(() -> new PmmException(
            PmmErrorCode.UNKNOWN_ATTRIBUTE,
            "Unknown attribute " + name + " for " + schema.recordName()
        ));
        if (value == null) {
            values.remove(name);
        } else {
            assign(attribute, value);
        }
    }

    private void assign(Attribute attribute, Object value) {
        if (value == null) {
            return;
        }
        values.put(attribute.name(), attribute.type().coerce(value, attribute.name(), schema.recordName()));
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        return values.equals(((PmmRecord) other).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), values);
    }

    @Override
    public String toString() {
        return schema.recordName() + values;
    }
}
