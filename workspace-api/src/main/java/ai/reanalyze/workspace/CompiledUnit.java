package ai.reanalyze.workspace;

import java.time.Instant;

/** Compiled artifact of a single unit, as stored in the compilation cache. */
public record CompiledUnit(UnitId unitId, String contentHash, int documentCount, Instant compiledAt) {}
