package ai.reanalyze.workspace;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link WorkspaceSnapshot} backed by precomputed indexes. File ownership is resolved by document path
 * first, then by unit build descriptor, then by the deepest unit directory containing the file.
 */
public final class InMemoryWorkspaceSnapshot implements WorkspaceSnapshot {
    private static final Logger logger = LogManager.getLogger(InMemoryWorkspaceSnapshot.class);

    private final Path root;
    private final Instant loadedAt;
    private final ImmutableList<CompilationUnit> units;
    private final ImmutableMap<UnitId, CompilationUnit> unitsById;
    private final ImmutableSetMultimap<Path, UnitId> documentOwners;
    private final ImmutableSetMultimap<Path, UnitId> projectFileOwners;

    private InMemoryWorkspaceSnapshot(Path root, Instant loadedAt, List<CompilationUnit> units) {
        this.root = root.toAbsolutePath().normalize();
        this.loadedAt = loadedAt;
        this.units = ImmutableList.copyOf(units);

        var byId = ImmutableMap.<UnitId, CompilationUnit>builder();
        var docs = ImmutableSetMultimap.<Path, UnitId>builder();
        var projectFiles = ImmutableSetMultimap.<Path, UnitId>builder();
        for (var unit : units) {
            byId.put(unit.id(), unit);
            unit.documents().forEach(d -> docs.put(d, unit.id()));
            if (unit.projectFile() != null) {
                projectFiles.put(unit.projectFile(), unit.id());
            }
        }
        try {
            this.unitsById = byId.buildOrThrow();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Duplicate unit id in workspace " + root, e);
        }
        this.documentOwners = docs.build();
        this.projectFileOwners = projectFiles.build();
    }

    public static Builder builder(Path root) {
        return new Builder(root);
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public List<CompilationUnit> units() {
        return units;
    }

    @Override
    public Instant loadedAt() {
        return loadedAt;
    }

    @Override
    public Optional<CompilationUnit> findUnit(UnitId id) {
        return Optional.ofNullable(unitsById.get(id));
    }

    @Override
    public Set<UnitId> unitsContainingFile(Path file) {
        var normalized = file.toAbsolutePath().normalize();

        var byDocument = documentOwners.get(normalized);
        if (!byDocument.isEmpty()) {
            return byDocument;
        }
        var byProjectFile = projectFileOwners.get(normalized);
        if (!byProjectFile.isEmpty()) {
            return byProjectFile;
        }

        // new or untracked files belong to the innermost unit directory that contains them
        var owners = new LinkedHashSet<UnitId>();
        int bestDepth = -1;
        for (var unit : units) {
            var dir = unit.directory();
            if (dir == null || !normalized.startsWith(dir)) {
                continue;
            }
            int depth = dir.getNameCount();
            if (depth > bestDepth) {
                owners.clear();
                bestDepth = depth;
            }
            if (depth == bestDepth) {
                owners.add(unit.id());
            }
        }
        if (owners.isEmpty()) {
            logger.trace("No unit owns {}", normalized);
        }
        return Set.copyOf(owners);
    }

    @Override
    public String toString() {
        return "InMemoryWorkspaceSnapshot{root=" + root + ", units=" + units.size() + ", loadedAt=" + loadedAt + '}';
    }

    public static final class Builder {
        private final Path root;
        private final List<CompilationUnit> units = new ArrayList<>();
        private Instant loadedAt = Instant.now();

        private Builder(Path root) {
            this.root = root;
        }

        public Builder unit(CompilationUnit unit) {
            units.add(unit);
            return this;
        }

        public Builder loadedAt(Instant loadedAt) {
            this.loadedAt = loadedAt;
            return this;
        }

        public InMemoryWorkspaceSnapshot build() {
            return new InMemoryWorkspaceSnapshot(root, loadedAt, units);
        }
    }
}
