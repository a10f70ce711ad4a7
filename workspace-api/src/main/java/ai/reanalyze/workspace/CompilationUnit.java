package ai.reanalyze.workspace;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * A buildable grouping of source documents with declared references to other units.
 *
 * @param id stable identifier, unique within a snapshot
 * @param name display name
 * @param language source language, e.g. "java"
 * @param projectFile the build descriptor that declares this unit, if any
 * @param directory root directory of the unit's sources; files created later under it belong to the unit
 * @param documents absolute, normalized paths of the unit's source documents
 * @param references ids of the units this unit depends on, in declaration order
 */
public record CompilationUnit(
        UnitId id,
        String name,
        String language,
        @Nullable Path projectFile,
        @Nullable Path directory,
        List<Path> documents,
        List<UnitId> references) {

    public CompilationUnit {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(language, "language");
        projectFile = projectFile == null ? null : normalize(projectFile);
        directory = directory == null ? null : normalize(directory);
        documents = documents.stream().map(CompilationUnit::normalize).toList();
        references = List.copyOf(references);
    }

    public int documentCount() {
        return documents.size();
    }

    public int referenceCount() {
        return references.size();
    }

    static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
