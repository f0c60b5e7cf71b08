package work.lcod.pmm.shared;

/**
 * Stable error codes carried by {@link PmmException}.
 */
public enum PmmErrorCode {
    UNKNOWN_ATTRIBUTE,
    TOO_MANY_ARGUMENTS,
    MISSING_REQUIRED_ATTRIBUTE,
    TYPE_MISMATCH,
    FIELD_COUNT_MISMATCH,
    UNSUPPORTED_FORMAT_VERSION,
    DUPLICATE_FIELD_NAME,
    UNKNOWN_CANONICAL_TYPE,
    UNKNOWN_STORAGE_TYPE,
    UNKNOWN_TYPE,
    UNKNOWN_FIELD,
    TABLE_UNAVAILABLE,
    MALFORMED_SIDECAR,
    UNSUPPORTED_DATE_TAG_FORMAT
}
