package ai.reanalyze.sessions;

import java.time.Instant;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public record PauseChangesPreview(
        String sessionId,
        boolean isPaused,
        @Nullable Instant pausedAt,
        double pausedDurationMinutes,
        boolean watchingFiles,
        ChangedFiles changedFiles,
        AffectedProjects affectedProjects,
        Impact impact) {

    public static final int FILE_LIMIT = 20;
    public static final int PROJECT_LIMIT = 10;

    public record ChangedFiles(int count, List<String> files) {}

    public record AffectedProjects(int count, List<String> projects) {}

    /** Rough size of the pending rebuild, from the number of changed files. */
    public record Impact(String level, boolean low, boolean medium, boolean high) {

        public static Impact forChangedFiles(int count) {
            if (count <= 5) {
                return new Impact("low", true, false, false);
            }
            if (count <= 20) {
                return new Impact("medium", false, true, false);
            }
            return new Impact("high", false, false, true);
        }
    }
}
