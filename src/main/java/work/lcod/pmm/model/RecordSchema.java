package work.lcod.pmm.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative attribute table of a record type: required, then defaulted, then optional attributes.
 * Built once per entity in a static initializer.
 */
public final class RecordSchema {
    private final String recordName;
    private final List<Attribute> attributes;
    private final List<Attribute> positional;
    private final Map<String, Attribute> byName;

    private RecordSchema(String recordName, List<Attribute> attributes) {
        this.recordName = recordName;
        this.attributes = Collections.unmodifiableList(attributes);
        List<Attribute> positionalAttributes = new ArrayList<>();
        Map<String, Attribute> index = new LinkedHashMap<>();
        for (Attribute attribute : attributes) {
            if (attribute.kind() != AttributeKind.OPTIONAL) {
                positionalAttributes.add(attribute);
            }
            if (index.put(attribute.name(), attribute) != null) {
                throw new IllegalStateException("Duplicate attribute " + attribute.name() + " in " + recordName);
            }
        }
        this.positional = Collections.unmodifiableList(positionalAttributes);
        this.byName = Collections.unmodifiableMap(index);
    }

    public static Builder builder(String recordName) {
        return new Builder(recordName);
    }

    public String recordName() {
        return recordName;
    }

    /**
     * All attributes in serialization order.
     */
    public List<Attribute> attributes() {
        return attributes;
    }

    /**
     * Required then defaulted attributes, the ones positional arguments fill.
     */
    public List<Attribute> positionalAttributes() {
        return positional;
    }

    public Optional<Attribute> attribute(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public static final class Builder {
        private final String recordName;
        private final List<Attribute> required = new ArrayList<>();
        private final List<Attribute> defaulted = new ArrayList<>();
        private final List<Attribute> optional = new ArrayList<>();

        private Builder(String recordName) {
            this.recordName = recordName;
        }

        public Builder required(String name, AttributeType type) {
            required.add(new Attribute(name, AttributeKind.REQUIRED, type, null));
            return this;
        }

        public Builder defaulted(String name, AttributeType type, Object defaultValue) {
            defaulted.add(new Attribute(name, AttributeKind.DEFAULTED, type, defaultValue));
            return this;
        }

        public Builder optional(String name, AttributeType type) {
            optional.add(new Attribute(name, AttributeKind.OPTIONAL, type, null));
            return this;
        }

        public RecordSchema build() {
            List<Attribute> all = new ArrayList<>(required);
            all.addAll(defaulted);
            all.addAll(optional);
            return new RecordSchema(recordName, all);
        }
    }
}
