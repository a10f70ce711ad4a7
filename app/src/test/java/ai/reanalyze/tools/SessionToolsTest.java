package ai.reanalyze.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.reanalyze.ChangeTracker;
import ai.reanalyze.FileWatcherHelper;
import ai.reanalyze.SessionOrchestrator;
import ai.reanalyze.cache.CompilationCacheService;
import ai.reanalyze.cache.FingerprintUnitCompiler;
import ai.reanalyze.graph.DependencyGraphService;
import ai.reanalyze.sessions.SessionRegistry;
import ai.reanalyze.testutil.ManualWatchService;
import ai.reanalyze.testutil.TestWorkspaces;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionToolsTest {

    @TempDir
    Path root;

    private final List<ManualWatchService> watchers = new ArrayList<>();
    private CompilationCacheService cache;
    private SessionOrchestrator orchestrator;
    private SessionTools tools;

    @BeforeEach
    void setUp() {
        var workspace = TestWorkspaces.chain(root);
        cache = new CompilationCacheService(100);
        orchestrator = new SessionOrchestrator(
                new SessionRegistry(),
                new DependencyGraphService(),
                cache,
                new ChangeTracker(ManualWatchService.factory(watchers)),
                source -> workspace,
                new FingerprintUnitCompiler(),
                FileWatcherHelper.DEFAULT_PATTERNS);
        tools = new SessionTools(orchestrator);
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
        cache.close();
    }

    private String start() {
        return tools.startSession(root.toString(), true).data().session().sessionId();
    }

    @Test
    void missingArgumentsAreValidationErrors() {
        assertEquals(ErrorPayload.Code.VALIDATION_ERROR, tools.startSession(null, true).error().code());
        assertEquals(ErrorPayload.Code.VALIDATION_ERROR, tools.pause(" ", true).error().code());
        assertEquals(ErrorPayload.Code.VALIDATION_ERROR, tools.resume(null, false).error().code());
    }

    @Test
    void unknownSessionIsNotFound() {
        var result = tools.getSessionStatus("nope");

        assertFalse(result.success());
        assertEquals(ErrorPayload.Code.NOT_FOUND, result.error().code());
        assertEquals(ErrorPayload.Code.NOT_FOUND, tools.clearCache("nope").error().code());
    }

    @Test
    void pauseResumeEnvelopes() {
        var id = start();

        var paused = tools.pause(id, true);
        assertTrue(paused.success());
        assertTrue(paused.data().watchingFiles());
        assertEquals(ErrorPayload.Code.INVALID_STATE, tools.pause(id, true).error().code());

        var preview = tools.previewPauseChanges(id);
        assertTrue(preview.success());
        assertEquals(0, preview.data().changedFiles().count());

        var resumed = tools.resume(id, false);
        assertTrue(resumed.success());
        assertEquals(ErrorPayload.Code.INVALID_STATE, tools.resume(id, false).error().code());
        assertEquals(ErrorPayload.Code.INVALID_STATE, tools.previewPauseChanges(id).error().code());
    }

    @Test
    void listStatusAndEnd() {
        var first = start();
        var second = start();

        assertEquals(2, tools.listSessions().data().size());
        assertTrue(tools.getSessionStatus(first).data().graphBuilt());

        assertTrue(tools.endSession(first).success());
        assertEquals(List.of(second), tools.listSessions().data().stream().map(s -> s.sessionId()).toList());
        assertEquals(ErrorPayload.Code.NOT_FOUND, tools.endSession(first).error().code());
    }

    @Test
    void cacheStatsAndClear() {
        var first = start();
        var second = start();
        assertEquals(2, tools.getCacheStats().data().totalEntries());

        var cleared = tools.clearCache(first).data();
        assertEquals(first, cleared.sessionId());
        assertEquals(1, cleared.clearedEntries());
        assertEquals(1, tools.getCacheStats().data().perSession().get(second));

        var all = tools.clearCache(null).data();
        assertNull(all.sessionId());
        assertEquals(1, all.clearedEntries());
        assertEquals(0, tools.getCacheStats().data().totalEntries());
    }
}
