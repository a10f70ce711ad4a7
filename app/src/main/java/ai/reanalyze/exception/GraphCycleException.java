package ai.reanalyze.exception;

import ai.reanalyze.workspace.UnitId;
import java.util.List;

/**
 * The dependency graph contains a cycle, so no compilation order exists. Workspaces are expected to be
 * acyclic; seeing this means the workspace model handed us an inconsistent snapshot.
 */
public class GraphCycleException extends IllegalStateException {
    private final List<UnitId> unresolved;

    public GraphCycleException(List<UnitId> unresolved) {
        super("Dependency cycle detected among units " + unresolved);
        this.unresolved = List.copyOf(unresolved);
    }

    /** Units that could not be ordered: members of a cycle and everything downstream of one. */
    public List<UnitId> getUnresolvedUnits() {
        return unresolved;
    }
}
