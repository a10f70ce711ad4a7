package ai.reanalyze.exception;

import ai.reanalyze.sessions.SessionState;
import ai.reanalyze.tools.ErrorPayload;
import java.util.Locale;

/** Thrown when a lifecycle transition is not legal from the session's current state. */
public class InvalidSessionStateException extends SessionOperationException {
    private final SessionState actual;

    public InvalidSessionStateException(String sessionId, SessionState actual, String message) {
        super("Session " + sessionId + " is " + actual.name().toLowerCase(Locale.ROOT) + ": " + message);
        this.actual = actual;
    }

    public SessionState getActualState() {
        return actual;
    }

    @Override
    public String code() {
        return ErrorPayload.Code.INVALID_STATE;
    }
}
