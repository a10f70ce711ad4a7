package ai.reanalyze.graph;

import ai.reanalyze.workspace.CompilationUnit;
import ai.reanalyze.workspace.UnitId;

/** Graph node: the parts of a {@link CompilationUnit} that graph queries report on. */
public record CompilationUnitInfo(UnitId id, String name, String language, int documentCount, int referenceCount) {

    public static CompilationUnitInfo of(CompilationUnit unit) {
        return new CompilationUnitInfo(
                unit.id(), unit.name(), unit.language(), unit.documentCount(), unit.referenceCount());
    }
}
