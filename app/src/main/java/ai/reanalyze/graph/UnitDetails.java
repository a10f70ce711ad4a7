package ai.reanalyze.graph;

import ai.reanalyze.workspace.UnitId;
import java.util.List;

public record UnitDetails(
        CompilationUnitInfo unit, List<UnitId> dependencies, List<UnitId> dependents, int transitiveDependentCount) {}
