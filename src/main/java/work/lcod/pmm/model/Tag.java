package work.lcod.pmm.model;

/**
 * Well-known tag names.
 */
public final class Tag {
    public static final String CATEGORICAL = "categorical";
    public static final String ORDINAL = "ordinal";
    public static final String UNIQUE = "unique";

    public static final String MAXIMIZE = "maximize";
    public static final String MINIMIZE = "minimize";

    private Tag() {}
}
