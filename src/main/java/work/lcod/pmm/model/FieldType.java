package work.lcod.pmm.model;

import java.util.Optional;

/**
 * Canonical column types tracked by the sidecar, independent of physical storage.
 */
public enum FieldType {
    BOOLEAN("boolean"),
    INTEGER("integer"),
    REAL("real"),
    STRING("string"),
    DATESTAMP("datestamp");

    private final String wireName;

    FieldType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<FieldType> fromWire(String value) {
        for (FieldType type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
