package ai.reanalyze.sessions;

import ai.reanalyze.tools.ErrorPayload;
import java.util.List;

/**
 * Value of a successful operation together with the non-fatal problems met on the way, such as
 * changed files no unit owns or a watch that could not be started.
 */
public record OperationResult<T>(T value, List<ErrorPayload> warnings) {

    public OperationResult {
        warnings = List.copyOf(warnings);
    }
}
