package ai.reanalyze.sessions;

import ai.reanalyze.exception.InvalidSessionStateException;
import ai.reanalyze.exception.SessionNotFoundException;
import ai.reanalyze.workspace.WorkspaceSnapshot;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Owns every {@link WorkspaceSession} and is the only place their state changes.
 *
 * <p>Lock discipline: each session has its own {@link ReentrantLock}. Compound operations on a session
 * (pause, resume, refresh, end) run inside {@link #withSessionLock}, and the mutating methods below must
 * be called while holding that lock. Different sessions never contend with each other; there is no
 * registry-wide lock. Lookups and listing are lock-free reads of the concurrent map.
 */
public class SessionRegistry {
    private static final Logger logger = LogManager.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, WorkspaceSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionRegistry() {
        this(Clock.systemUTC());
    }

    public SessionRegistry(Clock clock) {
        this.clock = clock;
    }

    public Instant now() {
        return clock.instant();
    }

    /** Register a new session in {@link SessionState#CREATED}. */
    public WorkspaceSession create(Path source, WorkspaceSnapshot snapshot) {
        var id = UUID.randomUUID().toString().replace("-", "");
        var session = new WorkspaceSession(id, source.toAbsolutePath().normalize(), snapshot, clock.instant());
        locks.put(id, new ReentrantLock());
        sessions.put(id, session);
        logger.info("Created session {} for {} ({} units)", id, session.getSource(), snapshot.unitCount());
        return session;
    }

    /**
     * Run {@code action} while holding the session's lock. The session's existence is checked after the
     * lock is acquired, so an action never runs against a session ended by a concurrent caller.
     *
     * @throws SessionNotFoundException if the session does not exist
     */
    public <T> T withSessionLock(String sessionId, Supplier<T> action) {
        var lock = locks.get(sessionId);
        if (lock == null) {
            throw new SessionNotFoundException(sessionId);
        }
        lock.lock();
        try {
            if (!sessions.containsKey(sessionId)) {
                throw new SessionNotFoundException(sessionId);
            }
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithSessionLock(String sessionId, Runnable action) {
        withSessionLock(sessionId, () -> {
            action.run();
            return null;
        });
    }

    /** Look up a session and record the access. */
    public WorkspaceSession get(String sessionId) {
        var session = peek(sessionId);
        session.setLastAccessedAt(clock.instant());
        return session;
    }

    /** Look up a session without counting it as an access. */
    public WorkspaceSession peek(String sessionId) {
        var session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public Optional<WorkspaceSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /** All sessions, oldest first. */
    public List<WorkspaceSession> list() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(WorkspaceSession::getCreatedAt).thenComparing(WorkspaceSession::getId))
                .toList();
    }

    public int size() {
        return sessions.size();
    }

    /** Sessions not accessed within {@code timeout}. */
    public List<WorkspaceSession> findIdle(Duration timeout) {
        var cutoff = clock.instant().minus(timeout);
        return sessions.values().stream()
                .filter(s -> s.getLastAccessedAt().isBefore(cutoff))
                .toList();
    }

    public void activate(String sessionId) {
        var session = lockedSession(sessionId);
        requireState(session, SessionState.CREATED, "only a newly created session can be activated");
        session.setState(SessionState.ACTIVE);
        session.setLastAccessedAt(clock.instant());
    }

    /**
     * Fail unless the session can be paused. Changes nothing.
     *
     * @throws InvalidSessionStateException if the session is already paused or not active
     */
    public void checkCanPause(String sessionId) {
        var session = peek(sessionId);
        if (session.isPaused()) {
            throw new InvalidSessionStateException(
                    sessionId, session.getState(), "already paused since " + session.getPausedAt());
        }
        requireState(session, SessionState.ACTIVE, "only an active session can be paused");
    }

    /**
     * Fail unless the session can be resumed. Changes nothing.
     *
     * @throws InvalidSessionStateException if the session is not paused
     */
    public void checkCanResume(String sessionId) {
        requireState(peek(sessionId), SessionState.PAUSED, "only a paused session can be resumed");
    }

    public void markPaused(String sessionId, Instant pausedAt, boolean watchingFiles) {
        checkCanPause(sessionId);
        var session = lockedSession(sessionId);
        session.setPause(pausedAt, watchingFiles);
        session.setState(SessionState.PAUSED);
        session.setLastAccessedAt(clock.instant());
        logger.info("Session {} paused at {} (watching files: {})", sessionId, pausedAt, watchingFiles);
    }

    public void markResumed(String sessionId) {
        checkCanResume(sessionId);
        var session = lockedSession(sessionId);
        session.setPause(null, false);
        session.setState(SessionState.ACTIVE);
        session.setLastAccessedAt(clock.instant());
        logger.info("Session {} resumed", sessionId);
    }

    public void replaceSnapshot(String sessionId, WorkspaceSnapshot snapshot) {
        var session = lockedSession(sessionId);
        session.setSnapshot(snapshot);
        session.setLastAccessedAt(clock.instant());
    }

    /** Mark the session disposed and forget it. */
    public WorkspaceSession dispose(String sessionId) {
        var session = lockedSession(sessionId);
        session.setState(SessionState.DISPOSED);
        sessions.remove(sessionId);
        locks.remove(sessionId);
        logger.info("Disposed session {}", sessionId);
        return session;
    }

    private WorkspaceSession lockedSession(String sessionId) {
        var lock = locks.get(sessionId);
        assert lock == null || lock.isHeldByCurrentThread() : "session lock must be held to mutate " + sessionId;
        return peek(sessionId);
    }

    private static void requireState(WorkspaceSession session, SessionState expected, String message) {
        if (session.getState() != expected) {
            throw new InvalidSessionStateException(session.getId(), session.getState(), message);
        }
    }
}
