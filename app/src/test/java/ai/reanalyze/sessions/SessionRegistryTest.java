package ai.reanalyze.sessions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.reanalyze.exception.InvalidSessionStateException;
import ai.reanalyze.exception.SessionNotFoundException;
import ai.reanalyze.testutil.MutableClock;
import ai.reanalyze.testutil.TestWorkspaces;
import ai.reanalyze.workspace.InMemoryWorkspaceSnapshot;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionRegistryTest {

    @TempDir
    Path root;

    private final MutableClock clock = new MutableClock();
    private final SessionRegistry registry = new SessionRegistry(clock);

    private String activeSession() {
        var session = registry.create(root, TestWorkspaces.chain(root));
        registry.runWithSessionLock(session.getId(), () -> registry.activate(session.getId()));
        return session.getId();
    }

    @Test
    void newSessionStartsCreatedThenActivates() {
        var session = registry.create(root, TestWorkspaces.chain(root));
        assertEquals(SessionState.CREATED, session.getState());
        assertEquals(32, session.getId().length());

        registry.runWithSessionLock(session.getId(), () -> registry.activate(session.getId()));

        assertEquals(SessionState.ACTIVE, registry.get(session.getId()).getState());
        assertEquals(3, session.toSummary(false).unitCount());
    }

    @Test
    void pauseThenResumeRoundTrip() {
        var id = activeSession();
        var pausedAt = clock.instant();

        registry.runWithSessionLock(id, () -> registry.markPaused(id, pausedAt, true));
        var paused = registry.peek(id);
        assertTrue(paused.isPaused());
        assertEquals(pausedAt, paused.getPausedAt());
        assertTrue(paused.isWatchingFiles());

        registry.runWithSessionLock(id, () -> registry.markResumed(id));
        var resumed = registry.peek(id);
        assertEquals(SessionState.ACTIVE, resumed.getState());
        assertNull(resumed.getPausedAt());
        assertFalse(resumed.isWatchingFiles());
    }

    @Test
    void pausingTwiceFailsAndKeepsOriginalPauseTime() {
        var id = activeSession();
        var first = clock.instant();
        registry.runWithSessionLock(id, () -> registry.markPaused(id, first, false));
        clock.advance(Duration.ofMinutes(5));

        var e = assertThrows(
                InvalidSessionStateException.class,
                () -> registry.runWithSessionLock(id, () -> registry.markPaused(id, clock.instant(), false)));

        assertTrue(e.getMessage().contains("already paused"));
        assertEquals(SessionState.PAUSED, e.getActualState());
        assertEquals(first, registry.peek(id).getPausedAt());
    }

    @Test
    void resumingAnActiveSessionFails() {
        var id = activeSession();

        assertThrows(InvalidSessionStateException.class, () -> registry.checkCanResume(id));
        assertEquals(SessionState.ACTIVE, registry.peek(id).getState());
    }

    @Test
    void createdSessionCannotBePaused() {
        var session = registry.create(root, TestWorkspaces.chain(root));

        assertThrows(InvalidSessionStateException.class, () -> registry.checkCanPause(session.getId()));
    }

    @Test
    void disposedSessionIsGone() {
        var id = activeSession();

        var disposed = registry.withSessionLock(id, () -> registry.dispose(id));

        assertEquals(SessionState.DISPOSED, disposed.getState());
        var missing = assertThrows(SessionNotFoundException.class, () -> registry.get(id));
        assertEquals(id, missing.getSessionId());
        assertThrows(SessionNotFoundException.class, () -> registry.withSessionLock(id, () -> 1));
        assertTrue(registry.find(id).isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void replaceSnapshotSwapsWorkspace() {
        var id = activeSession();
        var empty = InMemoryWorkspaceSnapshot.builder(root).build();

        registry.runWithSessionLock(id, () -> registry.replaceSnapshot(id, empty));

        assertEquals(0, registry.peek(id).getSnapshot().unitCount());
    }

    @Test
    void listIsOrderedByCreationAndIdleSessionsAreFound() {
        var first = activeSession();
        clock.advance(Duration.ofMinutes(1));
        var second = activeSession();
        clock.advance(Duration.ofHours(1));
        registry.get(second);

        assertEquals(List.of(first, second), registry.list().stream().map(WorkspaceSession::getId).toList());
        var idle = registry.findIdle(Duration.ofMinutes(30));
        assertEquals(List.of(first), idle.stream().map(WorkspaceSession::getId).toList());
    }

    @Test
    void peekDoesNotCountAsAccess() {
        var id = activeSession();
        var before = registry.peek(id).getLastAccessedAt();
        clock.advance(Duration.ofMinutes(10));

        registry.peek(id);
        assertEquals(before, registry.peek(id).getLastAccessedAt());

        registry.get(id);
        assertEquals(clock.instant(), registry.peek(id).getLastAccessedAt());
    }

    @Test
    void operationsOnOneSessionAreSerialized() throws Exception {
        var id = activeSession();
        var inside = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var secondRan = new AtomicBoolean(false);
        var executor = Executors.newFixedThreadPool(2);
        try {
            executor.submit(() -> registry.runWithSessionLock(id, () -> {
                inside.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertTrue(inside.await(5, TimeUnit.SECONDS));

            var second = executor.submit(() -> registry.runWithSessionLock(id, () -> secondRan.set(true)));
            Thread.sleep(200);
            assertFalse(secondRan.get(), "second operation must wait for the first");

            release.countDown();
            second.get(5, TimeUnit.SECONDS);
            assertTrue(secondRan.get());
        } finally {
            executor.shutdownNow();
        }
    }
}
