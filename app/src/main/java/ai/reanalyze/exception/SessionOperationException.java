package ai.reanalyze.exception;

/**
 * Expected failure of a session or graph operation. These are reported to the caller as structured
 * failures and never take the server down.
 */
public abstract class SessionOperationException extends RuntimeException {

    protected SessionOperationException(String message) {
        super(message);
    }

    protected SessionOperationException(String message, Throwable cause) {
        super(message, cause);
    }

    /** One of the {@link ai.reanalyze.tools.ErrorPayload.Code} constants. */
    public abstract String code();
}
