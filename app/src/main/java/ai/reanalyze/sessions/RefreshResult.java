package ai.reanalyze.sessions;

public record RefreshResult(SessionSummary session, int previousUnitCount, int invalidatedEntries, int prewarmedUnits) {}
