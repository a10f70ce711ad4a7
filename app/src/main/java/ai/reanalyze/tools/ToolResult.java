package ai.reanalyze.tools;

import ai.reanalyze.exception.GraphCycleException;
import ai.reanalyze.exception.SessionOperationException;
import ai.reanalyze.sessions.OperationResult;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Uniform envelope returned by every tool: either {@code data} or {@code error} is set, and warnings may
 * accompany a success.
 */
public record ToolResult<T>(
        boolean success, @Nullable T data, @Nullable ErrorPayload error, List<ErrorPayload> warnings) {
    private static final Logger logger = LogManager.getLogger(ToolResult.class);

    public ToolResult {
        warnings = List.copyOf(warnings);
    }

    public static <T> ToolResult<T> ok(T data) {
        return new ToolResult<>(true, data, null, List.of());
    }

    public static <T> ToolResult<T> ok(OperationResult<T> result) {
        return new ToolResult<>(true, result.value(), null, result.warnings());
    }

    public static <T> ToolResult<T> failure(ErrorPayload error) {
        return new ToolResult<>(false, null, error, List.of());
    }

    /** Run a tool body, turning any exception into a failure envelope. */
    public static <T> ToolResult<T> call(String toolName, Supplier<T> body) {
        try {
            return ok(body.get());
        } catch (RuntimeException e) {
            return fromException(toolName, e);
        }
    }

    public static <T> ToolResult<T> callOperation(String toolName, Supplier<OperationResult<T>> body) {
        try {
            return ok(body.get());
        } catch (RuntimeException e) {
            return fromException(toolName, e);
        }
    }

    static <T> ToolResult<T> fromException(String toolName, RuntimeException e) {
        if (e instanceof SessionOperationException soe) {
            logger.debug("{} failed with {}: {}", toolName, soe.code(), soe.getMessage());
            return failure(new ErrorPayload(soe.code(), soe.getMessage(), causeDetails(soe)));
        }
        if (e instanceof GraphCycleException cycle) {
            logger.error("{} hit a dependency cycle among {}", toolName, cycle.getUnresolvedUnits(), cycle);
            return failure(ErrorPayload.internalError(cycle.getMessage(), cycle));
        }
        if (e instanceof IllegalArgumentException) {
            return failure(ErrorPayload.validationError(e.getMessage() == null ? "Invalid argument" : e.getMessage()));
        }
        if (e instanceof CancellationException) {
            return failure(ErrorPayload.of(ErrorPayload.Code.CANCELLED, "Operation was cancelled"));
        }
        logger.error("Unexpected failure in {}", toolName, e);
        return failure(ErrorPayload.internalError("Unexpected error in " + toolName, e));
    }

    private static @Nullable String causeDetails(Throwable e) {
        var cause = e.getCause();
        return cause == null ? null : cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
