package io.recallr.memory;

/**
 * Unchecked failure of a memory engine operation, tagged with an {@link ErrorCode}.
 */
public class MemoryException extends RuntimeException {

    private final ErrorCode code;

    public MemoryException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public MemoryException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    @Override
    public String getMessage() {
        return code + ": " + super.getMessage();
    }
}
