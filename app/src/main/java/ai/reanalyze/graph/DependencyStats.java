package ai.reanalyze.graph;

import java.time.Instant;

/**
 * Summary numbers for a dependency graph.
 *
 * @param maxDepth length, in units, of the longest dependency chain; a unit without dependencies has depth 1
 */
public record DependencyStats(int totalUnits, int leafUnits, int rootUnits, int maxDepth, Instant createdAt) {}
