package ai.reanalyze.sessions;

import java.util.List;

/**
 * @param resumeType "incremental" or "full_rebuild"
 * @param changedFiles number of distinct files changed while paused
 * @param affectedProjects number of units whose cache entries were invalidated
 * @param fileList the first changed files, most recent first
 * @param projectList the first affected unit ids
 */
public record ResumeResult(
        String sessionId,
        String resumeType,
        int changedFiles,
        int affectedProjects,
        List<String> fileList,
        List<String> projectList,
        int invalidatedEntries,
        long pausedDurationSeconds,
        RebuildStats rebuildStats) {

    public static final String INCREMENTAL = "incremental";
    public static final String FULL_REBUILD = "full_rebuild";
    public static final int LIST_LIMIT = 10;

    public record RebuildStats(boolean fullRebuild, boolean incrementalChanges, boolean noChangesDetected) {}
}
