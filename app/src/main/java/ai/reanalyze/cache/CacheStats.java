package ai.reanalyze.cache;

import java.util.Map;

/**
 * Point-in-time view of the compilation cache.
 *
 * @param perSession number of cached units for each session that has any
 */
public record CacheStats(int totalEntries, int sessionCount, int maxEntries, Map<String, Integer> perSession) {}
