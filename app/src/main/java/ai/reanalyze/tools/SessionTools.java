package ai.reanalyze.tools;

import ai.reanalyze.SessionOrchestrator;
import ai.reanalyze.cache.CacheStats;
import ai.reanalyze.sessions.PauseChangesPreview;
import ai.reanalyze.sessions.PauseResult;
import ai.reanalyze.sessions.RefreshResult;
import ai.reanalyze.sessions.ResumeResult;
import ai.reanalyze.sessions.SessionStartResult;
import ai.reanalyze.sessions.SessionSummary;
import java.nio.file.Path;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Session lifecycle, pause/resume and cache tools. */
public class SessionTools {
    private static final Logger logger = LogManager.getLogger(SessionTools.class);

    private final SessionOrchestrator orchestrator;

    public record ClearCacheResult(@Nullable String sessionId, int clearedEntries) {}

    public SessionTools(SessionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public ToolResult<SessionStartResult> startSession(@Nullable String workspacePath, boolean prewarm) {
        return ToolResult.callOperation("startSession", () -> {
            var path = Path.of(requireArg("workspacePath", workspacePath));
            return orchestrator.startSession(path, prewarm);
        });
    }

    public ToolResult<SessionSummary> endSession(@Nullable String sessionId) {
        return ToolResult.call("endSession", () -> orchestrator.endSession(requireArg("sessionId", sessionId)));
    }

    public ToolResult<RefreshResult> refreshSession(@Nullable String sessionId) {
        return ToolResult.callOperation(
                "refreshSession", () -> orchestrator.refreshSession(requireArg("sessionId", sessionId)));
    }

    public ToolResult<SessionSummary> getSessionStatus(@Nullable String sessionId) {
        return ToolResult.call(
                "getSessionStatus", () -> orchestrator.getSessionStatus(requireArg("sessionId", sessionId)));
    }

    public ToolResult<List<SessionSummary>> listSessions() {
        return ToolResult.call("listSessions", orchestrator::listSessions);
    }

    public ToolResult<PauseResult> pause(@Nullable String sessionId, boolean watchFiles) {
        return ToolResult.callOperation(
                "pause", () -> orchestrator.pause(requireArg("sessionId", sessionId), watchFiles));
    }

    public ToolResult<ResumeResult> resume(@Nullable String sessionId, boolean forceFullRebuild) {
        return ToolResult.callOperation(
                "resume", () -> orchestrator.resume(requireArg("sessionId", sessionId), forceFullRebuild));
    }

    public ToolResult<PauseChangesPreview> previewPauseChanges(@Nullable String sessionId) {
        return ToolResult.callOperation(
                "previewPauseChanges", () -> orchestrator.previewPauseChanges(requireArg("sessionId", sessionId)));
    }

    public ToolResult<CacheStats> getCacheStats() {
        return ToolResult.call("getCacheStats", () -> orchestrator.getCache().getStats());
    }

    /** Clear one session's entries, or the whole cache when no session is given. */
    public ToolResult<ClearCacheResult> clearCache(@Nullable String sessionId) {
        return ToolResult.call("clearCache", () -> {
            var cache = orchestrator.getCache();
            if (sessionId == null || sessionId.isBlank()) {
                int cleared = cache.clear();
                logger.info("Cleared compilation cache ({} entries)", cleared);
                return new ClearCacheResult(null, cleared);
            }
            orchestrator.getRegistry().peek(sessionId);
            int cleared = cache.invalidateAll(sessionId);
            logger.info("Cleared {} cache entries of session {}", cleared, sessionId);
            return new ClearCacheResult(sessionId, cleared);
        });
    }

    static String requireArg(String name, @Nullable String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }
}
