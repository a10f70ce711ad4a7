package ai.reanalyze.graph;

import static ai.reanalyze.testutil.TestWorkspaces.id;
import static ai.reanalyze.testutil.TestWorkspaces.unit;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.reanalyze.exception.GraphCycleException;
import ai.reanalyze.exception.UnitNotFoundException;
import ai.reanalyze.testutil.TestWorkspaces;
import ai.reanalyze.workspace.InMemoryWorkspaceSnapshot;
import ai.reanalyze.workspace.UnitId;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DependencyGraphTest {

    @TempDir
    Path root;

    private final DependencyGraphService service = new DependencyGraphService();

    /*
     *   A <- B <- D
     *   ^         |
     *   +-- C <---+      E (isolated)
     */
    private DependencyGraph diamond() {
        return service.buildGraph(InMemoryWorkspaceSnapshot.builder(root)
                .unit(unit(root, "A"))
                .unit(unit(root, "B", "A"))
                .unit(unit(root, "C", "A"))
                .unit(unit(root, "D", "B", "C"))
                .unit(unit(root, "E"))
                .build());
    }

    @Test
    void chainAffectedUnitsAndOrder() {
        var graph = service.buildGraph(TestWorkspaces.chain(root));

        assertEquals(Set.of(id("A"), id("B"), id("C")), graph.getAffectedUnits(List.of(id("A"))));
        assertEquals(List.of(id("A"), id("B"), id("C")), graph.getCompilationOrder());
    }

    @Test
    void affectedUnitsOfMiddleUnitExcludeItsDependencies() {
        var graph = service.buildGraph(TestWorkspaces.chain(root));

        assertEquals(Set.of(id("B"), id("C")), graph.getAffectedUnits(List.of(id("B"))));
        assertEquals(Set.of(id("C")), graph.getAffectedUnits(List.of(id("C"))));
    }

    @Test
    void reverseIndexIsExactInverseOfForward() {
        var graph = diamond();
        for (var a : graph.unitIds()) {
            for (var b : graph.unitIds()) {
                assertEquals(
                        graph.getDirectDependencies(a).contains(b),
                        graph.getDirectDependents(b).contains(a),
                        a + " -> " + b);
            }
        }
    }

    @Test
    void affectedUnitsAreClosedUnderDependents() {
        var graph = diamond();
        for (var changed : graph.unitIds()) {
            var affected = graph.getAffectedUnits(List.of(changed));
            assertTrue(affected.contains(changed));
            for (var u : affected) {
                assertTrue(affected.containsAll(graph.getDirectDependents(u)), "closure broken at " + u);
            }
        }
        assertEquals(Set.of(id("A"), id("B"), id("C"), id("D")), graph.getAffectedUnits(List.of(id("A"))));
        assertEquals(Set.of(id("E")), graph.getAffectedUnits(List.of(id("E"))));
    }

    @Test
    void compilationOrderRespectsEveryEdge() {
        var graph = diamond();
        var order = graph.getCompilationOrder();

        assertEquals(graph.size(), order.size());
        for (var unit : order) {
            for (var dep : graph.getDirectDependencies(unit)) {
                assertTrue(order.indexOf(dep) < order.indexOf(unit), dep + " must precede " + unit);
            }
        }
        // ties are broken by enumeration order
        assertEquals(List.of(id("A"), id("B"), id("C"), id("D"), id("E")), order);
    }

    @Test
    void cycleIsReportedWithUnresolvedUnits() {
        var graph = service.buildGraph(InMemoryWorkspaceSnapshot.builder(root)
                .unit(unit(root, "A"))
                .unit(unit(root, "X", "A", "Y"))
                .unit(unit(root, "Y", "X"))
                .build());

        var e = assertThrows(GraphCycleException.class, graph::getCompilationOrder);
        assertEquals(List.of(id("X"), id("Y")), e.getUnresolvedUnits());
        // closure still terminates on a cyclic graph
        assertEquals(Set.of(id("A"), id("X"), id("Y")), graph.getAffectedUnits(List.of(id("A"))));
    }

    @Test
    void selfAndUnknownReferencesAreDropped() {
        var graph = service.buildGraph(InMemoryWorkspaceSnapshot.builder(root)
                .unit(unit(root, "A", "A", "missing"))
                .unit(unit(root, "B", "A"))
                .build());

        assertTrue(graph.getDirectDependencies(id("A")).isEmpty());
        assertFalse(graph.contains(id("missing")));
        assertEquals(List.of(id("A"), id("B")), graph.getCompilationOrder());
    }

    @Test
    void leafAndRootUnits() {
        var graph = diamond();

        assertEquals(List.of(id("A"), id("E")), graph.getLeafUnits());
        assertEquals(List.of(id("D"), id("E")), graph.getRootUnits());
    }

    @Test
    void statsReportLongestChain() {
        var stats = diamond().getStats();

        assertEquals(5, stats.totalUnits());
        assertEquals(2, stats.leafUnits());
        assertEquals(2, stats.rootUnits());
        assertEquals(3, stats.maxDepth());
    }

    @Test
    void emptyAndUnknownInputsYieldNothing() {
        var graph = diamond();

        assertTrue(graph.getAffectedUnits(List.of()).isEmpty());
        assertTrue(graph.getAffectedUnits(List.of(UnitId.of("nope"))).isEmpty());
        assertEquals(Set.of(id("E")), graph.getAffectedUnits(List.of(UnitId.of("nope"), id("E"))));
    }

    @Test
    void unknownUnitLookupsThrow() {
        var graph = diamond();

        assertThrows(UnitNotFoundException.class, () -> graph.getDirectDependencies(id("Z")));
        assertThrows(UnitNotFoundException.class, () -> graph.getDirectDependents(id("Z")));
        assertThrows(UnitNotFoundException.class, () -> graph.getUnitDetails(id("Z")));
    }

    @Test
    void unitDetailsCountTransitiveDependents() {
        var details = diamond().getUnitDetails(id("A"));

        assertEquals("A", details.unit().name());
        assertTrue(details.dependencies().isEmpty());
        assertEquals(List.of(id("B"), id("C")), details.dependents());
        assertEquals(3, details.transitiveDependentCount());
    }

    @Test
    void emptyWorkspaceGivesEmptyGraph() {
        var graph = service.buildGraph(InMemoryWorkspaceSnapshot.builder(root).build());

        assertEquals(0, graph.size());
        assertEquals(new ArrayList<UnitId>(), graph.getCompilationOrder());
        assertEquals(0, graph.getStats().maxDepth());
    }
}
