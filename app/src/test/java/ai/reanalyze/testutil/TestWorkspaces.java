package ai.reanalyze.testutil;

import ai.reanalyze.workspace.CompilationUnit;
import ai.reanalyze.workspace.InMemoryWorkspaceSnapshot;
import ai.reanalyze.workspace.UnitId;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/** On-disk workspaces for tests: one directory and one source file per unit. */
public final class TestWorkspaces {

    private TestWorkspaces() {}

    /** A unit in {@code root/<id>} with a single document {@code <id>.java}, created on disk. */
    public static CompilationUnit unit(Path root, String id, String... references) {
        var dir = root.resolve(id);
        var doc = dir.resolve("src").resolve(id + ".java");
        try {
            Files.createDirectories(doc.getParent());
            if (!Files.exists(doc)) {
                Files.writeString(doc, "class " + id + " {}\n");
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new CompilationUnit(
                UnitId.of(id),
                id,
                "java",
                dir.resolve("pom.xml"),
                dir,
                List.of(doc),
                Arrays.stream(references).map(UnitId::of).toList());
    }

    /** A depends on nothing, B on A, C on B. */
    public static InMemoryWorkspaceSnapshot chain(Path root) {
        return InMemoryWorkspaceSnapshot.builder(root)
                .unit(unit(root, "A"))
                .unit(unit(root, "B", "A"))
                .unit(unit(root, "C", "B"))
                .build();
    }

    public static Path document(Path root, String id) {
        return root.resolve(id).resolve("src").resolve(id + ".java").toAbsolutePath().normalize();
    }

    public static UnitId id(String value) {
        return UnitId.of(value);
    }
}
