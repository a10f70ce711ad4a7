package ai.reanalyze.exception;

import ai.reanalyze.tools.ErrorPayload;
import java.nio.file.Path;

public class WorkspaceLoadException extends SessionOperationException {

    public WorkspaceLoadException(Path source, Throwable cause) {
        super("Failed to load workspace from " + source + ": " + cause.getMessage(), cause);
    }

    @Override
    public String code() {
        return ErrorPayload.Code.WORKSPACE_LOAD_FAILED;
    }
}
