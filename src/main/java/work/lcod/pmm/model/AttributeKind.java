package work.lcod.pmm.model;

/**
 * Attribute groups of a record schema, in the order they are consumed and serialized.
 */
public enum AttributeKind {
    REQUIRED,
    DEFAULTED,
    OPTIONAL
}
