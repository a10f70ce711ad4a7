package ai.reanalyze.sessions;

import java.nio.file.Path;
import java.time.Instant;
import org.jetbrains.annotations.Nullable;

public record SessionSummary(
        String sessionId,
        Path source,
        Path root,
        SessionState state,
        boolean paused,
        @Nullable Instant pausedAt,
        boolean watchingFiles,
        Instant createdAt,
        Instant lastAccessedAt,
        int unitCount,
        boolean graphBuilt) {}
