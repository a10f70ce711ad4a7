package ai.reanalyze.tools;

import static ai.reanalyze.tools.SessionTools.requireArg;

import ai.reanalyze.SessionOrchestrator;
import ai.reanalyze.exception.UnitNotFoundException;
import ai.reanalyze.graph.CompilationUnitInfo;
import ai.reanalyze.graph.DependencyStats;
import ai.reanalyze.graph.UnitDetails;
import ai.reanalyze.workspace.UnitId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** Read-only views of a session's dependency graph. The graph is built on first use. */
public class DependencyTools {

    private final SessionOrchestrator orchestrator;

    public record GraphOverview(
            DependencyStats stats,
            List<UnitId> leafUnitIds,
            List<UnitId> rootUnitIds,
            List<CompilationUnitInfo> unitInfo) {}

    public record ImpactAnalysis(UnitId targetUnit, int affectedUnitCount, List<UnitId> affectedUnits) {}

    public record OrderedUnit(int order, UnitId unitId, String name) {}

    public record CompilationOrder(List<OrderedUnit> units) {}

    public DependencyTools(SessionOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public ToolResult<GraphOverview> getDependencyGraph(@Nullable String sessionId) {
        return ToolResult.call("getDependencyGraph", () -> {
            var graph = orchestrator.getOrBuildGraph(requireArg("sessionId", sessionId));
            return new GraphOverview(
                    graph.getStats(), graph.getLeafUnits(), graph.getRootUnits(), List.copyOf(graph.units()));
        });
    }

    /** Units that must be rebuilt if {@code unitId} changes, not counting the unit itself. */
    public ToolResult<ImpactAnalysis> getImpactAnalysis(@Nullable String sessionId, @Nullable String unitId) {
        return ToolResult.call("getImpactAnalysis", () -> {
            var graph = orchestrator.getOrBuildGraph(requireArg("sessionId", sessionId));
            var target = UnitId.of(requireArg("unitId", unitId));
            if (!graph.contains(target)) {
                throw new UnitNotFoundException(target);
            }
            var affected = new ArrayList<>(graph.getAffectedUnits(Set.of(target)));
            affected.remove(target);
            return new ImpactAnalysis(target, affected.size(), affected);
        });
    }

    public ToolResult<CompilationOrder> getCompilationOrder(@Nullable String sessionId) {
        return ToolResult.call("getCompilationOrder", () -> {
            var graph = orchestrator.getOrBuildGraph(requireArg("sessionId", sessionId));
            var order = graph.getCompilationOrder();
            var units = new ArrayList<OrderedUnit>(order.size());
            for (int i = 0; i < order.size(); i++) {
                var id = order.get(i);
                var name = graph.info(id).map(CompilationUnitInfo::name).orElse(id.value());
                units.add(new OrderedUnit(i + 1, id, name));
            }
            return new CompilationOrder(units);
        });
    }

    public ToolResult<UnitDetails> getUnitDetails(@Nullable String sessionId, @Nullable String unitId) {
        return ToolResult.call("getUnitDetails", () -> {
            var graph = orchestrator.getOrBuildGraph(requireArg("sessionId", sessionId));
            return graph.getUnitDetails(UnitId.of(requireArg("unitId", unitId)));
        });
    }
}
