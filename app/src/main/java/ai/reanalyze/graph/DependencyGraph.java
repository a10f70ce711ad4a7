package ai.reanalyze.graph;

import ai.reanalyze.exception.GraphCycleException;
import ai.reanalyze.exception.UnitNotFoundException;
import ai.reanalyze.workspace.UnitId;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Immutable compilation-unit dependency graph.
 *
 * <p>{@code forward.get(a)} holds the units {@code a} depends on; {@code reverse} is its exact inverse.
 * Iteration over units follows the workspace's enumeration order, which is also the tie-breaker for
 * {@link #getCompilationOrder()}. Instances are never modified after construction, so a graph can be
 * shared freely between threads and replaced wholesale when the workspace changes.
 */
public final class DependencyGraph {
    private static final Logger logger = LogManager.getLogger(DependencyGraph.class);

    private final ImmutableMap<UnitId, CompilationUnitInfo> units;
    private final ImmutableMap<UnitId, ImmutableSet<UnitId>> forward;
    private final ImmutableMap<UnitId, ImmutableSet<UnitId>> reverse;
    private final ImmutableMap<UnitId, Integer> enumerationIndex;
    private final Instant createdAt;

    DependencyGraph(
            ImmutableMap<UnitId, CompilationUnitInfo> units,
            ImmutableMap<UnitId, ImmutableSet<UnitId>> forward,
            ImmutableMap<UnitId, ImmutableSet<UnitId>> reverse,
            Instant createdAt) {
        this.units = units;
        this.forward = forward;
        this.reverse = reverse;
        this.createdAt = createdAt;

        var index = ImmutableMap.<UnitId, Integer>builder();
        int i = 0;
        for (var id : units.keySet()) {
            index.put(id, i++);
        }
        this.enumerationIndex = index.buildOrThrow();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public int size() {
        return units.size();
    }

    public boolean contains(UnitId id) {
        return units.containsKey(id);
    }

    /** Unit ids in enumeration order. */
    public List<UnitId> unitIds() {
        return units.keySet().asList();
    }

    public Collection<CompilationUnitInfo> units() {
        return units.values();
    }

    public Optional<CompilationUnitInfo> info(UnitId id) {
        return Optional.ofNullable(units.get(id));
    }

    public Set<UnitId> getDirectDependencies(UnitId id) {
        var deps = forward.get(id);
        if (deps == null) {
            throw new UnitNotFoundException(id);
        }
        return deps;
    }

    public Set<UnitId> getDirectDependents(UnitId id) {
        var dependents = reverse.get(id);
        if (dependents == null) {
            throw new UnitNotFoundException(id);
        }
        return dependents;
    }

    /**
     * Every unit whose compiled output may be stale after the given units change: the changed units
     * themselves plus all of their transitive dependents. Ids unknown to this graph are skipped.
     * Results are in breadth-first discovery order.
     */
    public Set<UnitId> getAffectedUnits(Collection<UnitId> changed) {
        if (changed.isEmpty()) {
            return Set.of();
        }
        var affected = new LinkedHashSet<UnitId>();
        var queue = new ArrayDeque<UnitId>();
        for (var id : changed) {
            if (!units.containsKey(id)) {
                logger.warn("Skipping unit {} not present in the dependency graph", id);
                continue;
            }
            if (affected.add(id)) {
                queue.add(id);
            }
        }
        while (!queue.isEmpty()) {
            var current = queue.poll();
            for (var dependent : reverse.get(current)) {
                if (affected.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return Collections.unmodifiableSet(affected);
    }

    /** Units that depend on nothing. */
    public List<UnitId> getLeafUnits() {
        return units.keySet().stream()
                .filter(id -> forward.get(id).isEmpty())
                .toList();
    }

    /** Units nothing depends on. */
    public List<UnitId> getRootUnits() {
        return units.keySet().stream()
                .filter(id -> reverse.get(id).isEmpty())
                .toList();
    }

    /**
     * Order in which units can be compiled so that every unit comes after all of its dependencies.
     *
     * @throws GraphCycleException if the graph is not acyclic
     */
    public List<UnitId> getCompilationOrder() {
        var order = topologicalOrder();
        if (order.size() != units.size()) {
            var placed = Set.copyOf(order);
            var unresolved =
                    unitIds().stream().filter(id -> !placed.contains(id)).toList();
            logger.error("Dependency cycle detected; {} of {} units cannot be ordered: {}",
                    unresolved.size(), units.size(), unresolved);
            throw new GraphCycleException(unresolved);
        }
        return order;
    }

    public DependencyStats getStats() {
        return new DependencyStats(
                units.size(), getLeafUnits().size(), getRootUnits().size(), maxDepth(), createdAt);
    }

    public UnitDetails getUnitDetails(UnitId id) {
        var info = units.get(id);
        if (info == null) {
            throw new UnitNotFoundException(id);
        }
        return new UnitDetails(
                info,
                ImmutableList.copyOf(forward.get(id)),
                ImmutableList.copyOf(reverse.get(id)),
                getAffectedUnits(List.of(id)).size() - 1);
    }

    /*
     * Kahn's algorithm. The ready set is a priority queue over enumeration index, so among units whose
     * dependencies are all placed, the one enumerated first goes next. Returns a partial order when the
     * graph has a cycle.
     */
    private List<UnitId> topologicalOrder() {
        var remaining = new HashMap<UnitId, Integer>();
        var ready = new PriorityQueue<UnitId>((a, b) -> Integer.compare(enumerationIndex.get(a), enumerationIndex.get(b)));
        for (var entry : forward.entrySet()) {
            int inDegree = entry.getValue().size();
            remaining.put(entry.getKey(), inDegree);
            if (inDegree == 0) {
                ready.add(entry.getKey());
            }
        }

        var order = new ArrayList<UnitId>(units.size());
        while (!ready.isEmpty()) {
            var next = ready.poll();
            order.add(next);
            for (var dependent : reverse.get(next)) {
                int left = remaining.merge(dependent, -1, Integer::sum);
                if (left == 0) {
                    ready.add(dependent);
                }
            }
        }
        return order;
    }

    /* Longest chain over the orderable part of the graph; units caught in a cycle do not contribute. */
    private int maxDepth() {
        Map<UnitId, Integer> depth = new HashMap<>();
        int max = 0;
        for (var id : topologicalOrder()) {
            int d = 1;
            for (var dep : forward.get(id)) {
                d = Math.max(d, depth.getOrDefault(dep, 0) + 1);
            }
            depth.put(id, d);
            max = Math.max(max, d);
        }
        return max;
    }

    @Override
    public String toString() {
        return "DependencyGraph{units=" + units.size() + ", edges="
                + forward.values().stream().mapToInt(Set::size).sum() + ", createdAt=" + createdAt + '}';
    }
}
