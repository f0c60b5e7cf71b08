package work.lcod.pmm.table;

import java.util.Locale;
import work.lcod.pmm.shared.PmmErrorCode;
import work.lcod.pmm.shared.PmmException;

/**
 * Physical storage type of a table column, named after the dataframe dtype it corresponds to.
 */
public enum StorageType {
    BOOL("bool"),
    INT8("int8"),
    INT16("int16"),
    INT32("int32"),
    INT64("int64"),
    UINT8("uint8"),
    UINT16("uint16"),
    UINT32("uint32"),
    UINT64("uint64"),
    FLOAT16("float16"),
    FLOAT32("float32"),
    FLOAT64("float64"),
    DATETIME("datetime64[ns]"),
    OBJECT("object"),
    CATEGORY("category"),
    TIMEDELTA("timedelta64[ns]"),
    COMPLEX128("complex128");

    private final String dtype;

    StorageType(String dtype) {
        this.dtype = dtype;
    }

    public String dtype() {
        return dtype;
    }

    public boolean isInteger() {
        return dtype.startsWith("int") || dtype.startsWith("uint");
    }

    public boolean isFloat() {
        return dtype.startsWith("float");
    }

    public boolean isDateTime() {
        return this == DATETIME;
    }

    public static StorageType fromDtype(String dtype) {
        String normalized = dtype == null ? "" : dtype.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("datetime64")) {
            return DATETIME;
        }
        for (StorageType type : values()) {
            if (type.dtype.equals(normalized)) {
                return type;
            }
        }
        throw new PmmException(PmmErrorCode.UNKNOWN_STORAGE_TYPE, "Unknown storage type: " + dtype);
    }

    @Override
    public String toString() {
        return dtype;
    }
}
