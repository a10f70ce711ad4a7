package ai.reanalyze.sessions;

/** Lifecycle: CREATED -> ACTIVE <-> PAUSED -> DISPOSED. */
public enum SessionState {
    CREATED,
    ACTIVE,
    PAUSED,
    DISPOSED
}
