package work.lcod.pmm.shared;

/**
 * Exception carrying a {@link PmmErrorCode} for construction, validation and boundary failures.
 */
public final class PmmException extends RuntimeException {
    private final PmmErrorCode code;

    public PmmException(PmmErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public PmmException(PmmErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public PmmErrorCode code() {
        return code;
    }
}
