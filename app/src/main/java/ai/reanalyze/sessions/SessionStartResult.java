package ai.reanalyze.sessions;

public record SessionStartResult(SessionSummary session, int prewarmedUnits) {}
