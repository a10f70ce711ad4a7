package ai.reanalyze.exception;

import ai.reanalyze.tools.ErrorPayload;

public class GraphUnavailableException extends SessionOperationException {

    public GraphUnavailableException(String sessionId) {
        super("Dependency graph has not been built for session " + sessionId + "; refresh the session first");
    }

    @Override
    public String code() {
        return ErrorPayload.Code.GRAPH_UNAVAILABLE;
    }
}
