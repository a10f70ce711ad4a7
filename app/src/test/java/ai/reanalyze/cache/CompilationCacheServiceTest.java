package ai.reanalyze.cache;

import static ai.reanalyze.testutil.TestWorkspaces.id;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.reanalyze.graph.DependencyGraphService;
import ai.reanalyze.testutil.MutableClock;
import ai.reanalyze.testutil.TestWorkspaces;
import ai.reanalyze.workspace.CompilationUnit;
import ai.reanalyze.workspace.CompiledUnit;
import ai.reanalyze.workspace.UnitCompiler;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompilationCacheServiceTest {

    @TempDir
    Path root;

    private final MutableClock clock = new MutableClock();
    private CompilationCacheService cache = new CompilationCacheService(100, clock);

    @AfterEach
    void tearDown() {
        cache.close();
    }

    private CompiledUnit artifact(String unit) {
        return new CompiledUnit(id(unit), "hash-" + unit, 1, clock.instant());
    }

    /** Counts compilations so tests can tell hits from misses. */
    private static final class CountingCompiler implements UnitCompiler {
        final FingerprintUnitCompiler delegate = new FingerprintUnitCompiler();
        final AtomicInteger compilations = new AtomicInteger();

        @Override
        public String contentHash(CompilationUnit unit) throws IOException {
            return delegate.contentHash(unit);
        }

        @Override
        public CompiledUnit compile(CompilationUnit unit) throws IOException {
            compilations.incrementAndGet();
            return delegate.compile(unit);
        }
    }

    @Test
    void invalidateUnitIsIdempotent() {
        cache.put("s1", artifact("A"));

        assertTrue(cache.invalidateUnit("s1", id("A")));
        assertFalse(cache.invalidateUnit("s1", id("A")));
        assertFalse(cache.invalidateUnit("s1", id("never-cached")));
        assertTrue(cache.get("s1", id("A")).isEmpty());
    }

    @Test
    void invalidateAllOnlyTouchesOneSession() {
        cache.put("s1", artifact("A"));
        cache.put("s1", artifact("B"));
        cache.put("s2", artifact("A"));

        assertEquals(2, cache.invalidateAll("s1"));
        assertEquals(0, cache.invalidateAll("s1"));
        assertTrue(cache.get("s2", id("A")).isPresent());
    }

    @Test
    void statsGroupEntriesBySession() {
        cache.put("s1", artifact("A"));
        cache.put("s1", artifact("B"));
        cache.put("s2", artifact("A"));

        var stats = cache.getStats();
        assertEquals(3, stats.totalEntries());
        assertEquals(2, stats.sessionCount());
        assertEquals(100, stats.maxEntries());
        assertEquals(Map.of("s1", 2, "s2", 1), stats.perSession());

        assertEquals(3, cache.clear());
        assertEquals(0, cache.getStats().totalEntries());
    }

    @Test
    void getOrCompileRecompilesOnlyWhenContentChanges() throws IOException {
        var unit = TestWorkspaces.unit(root, "A");
        var compiler = new CountingCompiler();

        var first = cache.getOrCompile("s1", unit, compiler);
        var second = cache.getOrCompile("s1", unit, compiler);
        assertSame(first, second);
        assertEquals(1, compiler.compilations.get());

        Files.writeString(unit.documents().get(0), "class A { int x; }\n");
        var third = cache.getOrCompile("s1", unit, compiler);
        assertNotEquals(first.contentHash(), third.contentHash());
        assertEquals(2, compiler.compilations.get());
    }

    @Test
    void evictsLeastRecentlyUsedWhenNearCapacity() {
        cache = new CompilationCacheService(10, clock);
        for (int i = 0; i < 7; i++) {
            cache.put("s1", artifact("U" + i));
            clock.advance(Duration.ofSeconds(1));
        }
        // touch the oldest so U1 becomes least recently used
        cache.get("s1", id("U0"));
        clock.advance(Duration.ofSeconds(1));

        cache.put("s1", artifact("U7"));

        assertEquals(7, cache.getStats().totalEntries());
        assertTrue(cache.get("s1", id("U0")).isPresent());
        assertTrue(cache.get("s1", id("U1")).isEmpty());
        assertTrue(cache.get("s1", id("U7")).isPresent());
    }

    @Test
    void smallestCacheKeepsTheEntryJustInserted() {
        cache = new CompilationCacheService(1, clock);

        cache.put("s1", artifact("A"));
        assertTrue(cache.get("s1", id("A")).isPresent());

        clock.advance(Duration.ofSeconds(1));
        cache.put("s1", artifact("B"));

        assertEquals(1, cache.getStats().totalEntries());
        assertTrue(cache.get("s1", id("B")).isPresent());
        assertTrue(cache.get("s1", id("A")).isEmpty());
    }

    @Test
    void evictStaleRemovesEntriesNotAccessedRecently() {
        cache.put("s1", artifact("A"));
        cache.put("s1", artifact("B"));
        clock.advance(Duration.ofMinutes(90));
        cache.get("s1", id("B"));
        clock.advance(Duration.ofMinutes(60));

        assertEquals(1, cache.evictStale(Duration.ofHours(2)));
        assertTrue(cache.get("s1", id("A")).isEmpty());
        assertTrue(cache.get("s1", id("B")).isPresent());
    }

    @Test
    void prewarmCompilesLeafUnitsOnly() {
        var snapshot = TestWorkspaces.chain(root);
        var graph = new DependencyGraphService().buildGraph(snapshot);
        var compiler = new CountingCompiler();

        var result = cache.prewarm("s1", graph, snapshot, compiler);

        assertEquals(1, result.compiled());
        assertEquals(List.of(), result.failed());
        assertTrue(cache.get("s1", id("A")).isPresent());
        assertTrue(cache.get("s1", id("B")).isEmpty());
    }

    @Test
    void prewarmReportsFailuresWithoutThrowing() {
        var snapshot = TestWorkspaces.chain(root);
        var graph = new DependencyGraphService().buildGraph(snapshot);
        UnitCompiler broken = new UnitCompiler() {
            @Override
            public String contentHash(CompilationUnit unit) throws IOException {
                throw new IOException("disk on fire");
            }

            @Override
            public CompiledUnit compile(CompilationUnit unit) throws IOException {
                throw new IOException("disk on fire");
            }
        };

        var result = cache.prewarm("s1", graph, snapshot, broken);

        assertEquals(0, result.compiled());
        assertEquals(List.of(id("A")), result.failed());
    }
}
