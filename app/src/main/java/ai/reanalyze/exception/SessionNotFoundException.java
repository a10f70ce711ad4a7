package ai.reanalyze.exception;

import ai.reanalyze.tools.ErrorPayload;

public class SessionNotFoundException extends SessionOperationException {
    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    @Override
    public String code() {
        return ErrorPayload.Code.NOT_FOUND;
    }
}
