package ai.reanalyze.tools;

import org.jetbrains.annotations.Nullable;

/**
 * Structured error or warning payload.
 *
 * @param code The error code (e.g., "NOT_FOUND", "INVALID_STATE", "INTERNAL_ERROR").
 * @param message A human-readable error message.
 * @param details Additional details; null if no extra information is available.
 */
public record ErrorPayload(String code, String message, @Nullable String details) {

    public ErrorPayload {
        if (code.isBlank()) {
            throw new IllegalArgumentException("code must not be blank");
        }
        if (message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
    }

    public static class Code {
        public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
        public static final String NOT_FOUND = "NOT_FOUND";
        public static final String INVALID_STATE = "INVALID_STATE";
        public static final String GRAPH_UNAVAILABLE = "GRAPH_UNAVAILABLE";
        public static final String WORKSPACE_LOAD_FAILED = "WORKSPACE_LOAD_FAILED";
        public static final String CANCELLED = "CANCELLED";
        public static final String UNAUTHORIZED = "UNAUTHORIZED";
        public static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
        public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

        // warnings attached to successful results
        public static final String PARTIAL_MAPPING = "PARTIAL_MAPPING";
        public static final String WATCH_SETUP_FAILED = "WATCH_SETUP_FAILED";
        public static final String OVERFLOW = "OVERFLOW";
        public static final String PREWARM_FAILED = "PREWARM_FAILED";

        private Code() {}
    }

    public static ErrorPayload of(String code, String message) {
        return new ErrorPayload(code, message, null);
    }

    public static ErrorPayload validationError(String message) {
        return of(Code.VALIDATION_ERROR, message);
    }

    /**
     * Create an internal error.
     * @param message The error message.
     * @param throwable The underlying exception (for details).
     * @return A new ErrorPayload with code INTERNAL_ERROR and details from the exception.
     */
    public static ErrorPayload internalError(String message, Throwable throwable) {
        return new ErrorPayload(
                Code.INTERNAL_ERROR, message, throwable.getClass().getSimpleName() + ": " + throwable.getMessage());
    }
}
