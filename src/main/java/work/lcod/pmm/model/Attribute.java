package work.lcod.pmm.model;

import java.util.Objects;

/**
 * One declared attribute: name, group, type and (for defaulted attributes) the default value.
 */
public record Attribute(String name, AttributeKind kind, AttributeType type, Object defaultValue) {
    public Attribute {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(type, "type");
    }
}
