package ai.reanalyze.sessions;

import java.time.Instant;

public record PauseResult(String sessionId, boolean success, boolean watchingFiles, Instant pausedAt, String instruction) {}
