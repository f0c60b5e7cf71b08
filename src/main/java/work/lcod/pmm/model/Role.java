package work.lcod.pmm.model;

/**
 * Modelling role of a field.
 */
public enum Role {
    /** Predictor. */
    INDEPENDENT("independent"),
    /** Outcome. */
    DEPENDENT("dependent"),
    /** Which treatment, if any, was applied. */
    TREATMENT("treatment"),
    WEIGHT("weight"),
    /** Auxiliary field, e.g. a value field. */
    AUXILIARY("auxiliary"),
    /** Cross-validation partition. */
    VALIDATION("validation"),
    IGNORE("ignore"),
    UNSPECIFIED("");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Role fromWire(String value) {
        for (Role role : values()) {
            if (role.wireName.equals(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
