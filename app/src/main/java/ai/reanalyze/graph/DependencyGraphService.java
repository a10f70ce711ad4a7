package ai.reanalyze.graph;

import ai.reanalyze.exception.GraphUnavailableException;
import ai.reanalyze.workspace.UnitId;
import ai.reanalyze.workspace.WorkspaceSnapshot;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds dependency graphs from workspace snapshots and holds the current graph of each session.
 *
 * <p>Graphs are immutable; a refresh builds a complete new graph and then replaces the session's entry in
 * one map write, so readers see either the old graph or the new one and never a mix.
 */
public class DependencyGraphService {
    private static final Logger logger = LogManager.getLogger(DependencyGraphService.class);

    private final ConcurrentMap<String, DependencyGraph> graphs = new ConcurrentHashMap<>();

    /**
     * Build a graph from the snapshot's units and their declared references. Self references and
     * references to units outside the snapshot are dropped.
     */
    public DependencyGraph buildGraph(WorkspaceSnapshot snapshot) {
        long start = System.nanoTime();
        var units = snapshot.units();

        var infos = new LinkedHashMap<UnitId, CompilationUnitInfo>();
        for (var unit : units) {
            if (infos.putIfAbsent(unit.id(), CompilationUnitInfo.of(unit)) != null) {
                logger.warn("Duplicate unit id {} in workspace {}; keeping the first", unit.id(), snapshot.root());
            }
        }

        Map<UnitId, Set<UnitId>> forward = new LinkedHashMap<>();
        Map<UnitId, Set<UnitId>> reverse = new LinkedHashMap<>();
        for (var id : infos.keySet()) {
            forward.put(id, new LinkedHashSet<>());
            reverse.put(id, new LinkedHashSet<>());
        }

        var processed = new LinkedHashSet<UnitId>();
        for (var unit : units) {
            if (!processed.add(unit.id())) {
                continue;
            }
            var deps = forward.get(unit.id());
            for (var ref : unit.references()) {
                if (ref.equals(unit.id())) {
                    logger.warn("Ignoring self reference of unit {}", unit.id());
                } else if (!infos.containsKey(ref)) {
                    logger.debug("Unit {} references {} which is not part of the workspace", unit.id(), ref);
                } else {
                    deps.add(ref);
                }
            }
        }

        // reverse refs follow the enumeration order of the dependents
        for (var entry : forward.entrySet()) {
            for (var dep : entry.getValue()) {
                reverse.get(dep).add(entry.getKey());
            }
        }

        var graph = new DependencyGraph(
                ImmutableMap.copyOf(infos), freeze(forward), freeze(reverse), Instant.now());
        logger.debug("Built {} from {} in {} ms", graph, snapshot.root(), (System.nanoTime() - start) / 1_000_000);
        return graph;
    }

    /** Return the session's graph, building it from the snapshot on first request. */
    public DependencyGraph getOrBuildGraph(String sessionId, WorkspaceSnapshot snapshot) {
        return graphs.computeIfAbsent(sessionId, id -> {
            logger.info("Building dependency graph for session {}", id);
            return buildGraph(snapshot);
        });
    }

    /** Build a fresh graph and swap it in for the session, replacing any previous one. */
    public DependencyGraph rebuildGraph(String sessionId, WorkspaceSnapshot snapshot) {
        var graph = buildGraph(snapshot);
        var previous = graphs.put(sessionId, graph);
        logger.info("Rebuilt dependency graph for session {} ({} -> {} units)",
                sessionId, previous == null ? 0 : previous.size(), graph.size());
        return graph;
    }

    public Optional<DependencyGraph> getGraph(String sessionId) {
        return Optional.ofNullable(graphs.get(sessionId));
    }

    public boolean hasGraph(String sessionId) {
        return graphs.containsKey(sessionId);
    }

    /**
     * @throws GraphUnavailableException if no graph has been built for the session
     */
    public DependencyGraph requireGraph(String sessionId) {
        var graph = graphs.get(sessionId);
        if (graph == null) {
            throw new GraphUnavailableException(sessionId);
        }
        return graph;
    }

    public void invalidateGraph(String sessionId) {
        if (graphs.remove(sessionId) != null) {
            logger.debug("Dropped dependency graph for session {}", sessionId);
        }
    }

    public Set<UnitId> getAffectedUnits(String sessionId, Collection<UnitId> changed) {
        return requireGraph(sessionId).getAffectedUnits(changed);
    }

    public List<UnitId> getCompilationOrder(String sessionId) {
        return requireGraph(sessionId).getCompilationOrder();
    }

    public Set<UnitId> getDirectDependencies(String sessionId, UnitId unitId) {
        return requireGraph(sessionId).getDirectDependencies(unitId);
    }

    public Set<UnitId> getDirectDependents(String sessionId, UnitId unitId) {
        return requireGraph(sessionId).getDirectDependents(unitId);
    }

    private static ImmutableMap<UnitId, ImmutableSet<UnitId>> freeze(Map<UnitId, Set<UnitId>> adjacency) {
        var builder = ImmutableMap.<UnitId, ImmutableSet<UnitId>>builderWithExpectedSize(adjacency.size());
        adjacency.forEach((id, edges) -> builder.put(id, ImmutableSet.copyOf(edges)));
        return builder.buildOrThrow();
    }
}
