package ai.reanalyze.manifest;

import ai.reanalyze.FileWatcherHelper;
import ai.reanalyze.util.Json;
import ai.reanalyze.workspace.CompilationUnit;
import ai.reanalyze.workspace.InMemoryWorkspaceSnapshot;
import ai.reanalyze.workspace.UnitId;
import ai.reanalyze.workspace.WorkspaceLoader;
import ai.reanalyze.workspace.WorkspaceSnapshot;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads a workspace from a {@code workspace.json} manifest. The source may be the manifest itself or the
 * directory containing it; the manifest's directory becomes the workspace root.
 */
public class ManifestWorkspaceLoader implements WorkspaceLoader {
    private static final Logger logger = LogManager.getLogger(ManifestWorkspaceLoader.class);

    public static final String MANIFEST_FILE_NAME = "workspace.json";

    private final Clock clock;

    public ManifestWorkspaceLoader() {
        this(Clock.systemUTC());
    }

    public ManifestWorkspaceLoader(Clock clock) {
        this.clock = clock;
    }

    @Override
    public WorkspaceSnapshot load(Path source) throws IOException {
        var manifestFile = resolveManifest(source);
        var root = manifestFile.getParent();
        WorkspaceManifest manifest;
        try {
            manifest = Json.getMapper().readValue(manifestFile.toFile(), WorkspaceManifest.class);
        } catch (IOException e) {
            throw new IOException("Invalid workspace manifest " + manifestFile + ": " + e.getMessage(), e);
        }

        var builder = InMemoryWorkspaceSnapshot.builder(root).loadedAt(clock.instant());
        int documents = 0;
        for (var entry : manifest.units()) {
            var unit = toUnit(root, entry);
            documents += unit.documentCount();
            builder.unit(unit);
        }
        var snapshot = builder.build();
        logger.info("Loaded workspace {} from {}: {} units, {} documents",
                manifest.name() == null ? root.getFileName() : manifest.name(),
                manifestFile,
                snapshot.unitCount(),
                documents);
        return snapshot;
    }

    static Path resolveManifest(Path source) throws NoSuchFileException {
        var path = source.toAbsolutePath().normalize();
        if (Files.isDirectory(path)) {
            path = path.resolve(MANIFEST_FILE_NAME);
        }
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "workspace manifest not found");
        }
        return path;
    }

    private CompilationUnit toUnit(Path root, WorkspaceManifest.UnitEntry entry) throws IOException {
        var directory = root.resolve(entry.directory() == null ? entry.id() : entry.directory()).normalize();
        var projectFile = entry.projectFile() == null ? null : root.resolve(entry.projectFile()).normalize();
        var documents = Files.isDirectory(directory) ? findDocuments(directory, entry.include()) : List.<Path>of();
        if (documents.isEmpty()) {
            logger.warn("Unit {} has no documents under {}", entry.id(), directory);
        }
        return new CompilationUnit(
                UnitId.of(entry.id()),
                entry.name() == null ? entry.id() : entry.name(),
                entry.language() == null ? WorkspaceManifest.UnitEntry.DEFAULT_LANGUAGE : entry.language(),
                projectFile,
                directory,
                documents,
                entry.references().stream().map(UnitId::of).toList());
    }

    /* Files under the unit directory matching the include globs, skipping build output and VCS directories. */
    private static List<Path> findDocuments(Path directory, List<String> include) throws IOException {
        var helper = new FileWatcherHelper(directory, include);
        var documents = new ArrayList<Path>();
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(directory) && FileWatcherHelper.isExcludedDirectoryName(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && helper.isRelevant(file)) {
                    documents.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        documents.sort(null);
        return documents;
    }
}
