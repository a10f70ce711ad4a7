package ai.reanalyze.workspace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InMemoryWorkspaceSnapshotTest {

    @TempDir
    Path root;

    private CompilationUnit unit(String id, Path dir, List<Path> docs, String... refs) {
        return new CompilationUnit(
                UnitId.of(id),
                id,
                "java",
                dir.resolve("pom.xml"),
                dir,
                docs,
                java.util.Arrays.stream(refs).map(UnitId::of).toList());
    }

    @Test
    void resolvesOwnerByDocumentPath() {
        var coreDir = root.resolve("core");
        var doc = coreDir.resolve("src/Foo.java");
        var snapshot = InMemoryWorkspaceSnapshot.builder(root)
                .unit(unit("core", coreDir, List.of(doc)))
                .build();

        assertEquals(Set.of(UnitId.of("core")), snapshot.unitsContainingFile(doc));
        // relative segments are normalized away
        assertEquals(Set.of(UnitId.of("core")), snapshot.unitsContainingFile(coreDir.resolve("src/../src/Foo.java")));
    }

    @Test
    void linkedDocumentBelongsToEveryUnitThatListsIt() {
        var shared = root.resolve("shared/Shared.java");
        var snapshot = InMemoryWorkspaceSnapshot.builder(root)
                .unit(unit("a", root.resolve("a"), List.of(shared)))
                .unit(unit("b", root.resolve("b"), List.of(shared)))
                .build();

        assertEquals(Set.of(UnitId.of("a"), UnitId.of("b")), snapshot.unitsContainingFile(shared));
    }

    @Test
    void resolvesProjectFileAndNewFilesUnderInnermostDirectory() {
        var outer = root.resolve("app");
        var inner = outer.resolve("plugins/inner");
        var snapshot = InMemoryWorkspaceSnapshot.builder(root)
                .unit(unit("app", outer, List.of()))
                .unit(unit("inner", inner, List.of()))
                .build();

        assertEquals(Set.of(UnitId.of("app")), snapshot.unitsContainingFile(outer.resolve("pom.xml")));
        assertEquals(Set.of(UnitId.of("inner")), snapshot.unitsContainingFile(inner.resolve("src/New.java")));
        assertEquals(Set.of(UnitId.of("app")), snapshot.unitsContainingFile(outer.resolve("src/Other.java")));
    }

    @Test
    void fileOutsideAllUnitsHasNoOwner() {
        var snapshot = InMemoryWorkspaceSnapshot.builder(root)
                .unit(unit("core", root.resolve("core"), List.of()))
                .build();

        assertTrue(snapshot.unitsContainingFile(root.resolve("README.md")).isEmpty());
    }

    @Test
    void preservesEnumerationOrderAndLooksUpById() {
        var snapshot = InMemoryWorkspaceSnapshot.builder(root)
                .unit(unit("c", root.resolve("c"), List.of(), "b"))
                .unit(unit("a", root.resolve("a"), List.of()))
                .unit(unit("b", root.resolve("b"), List.of(), "a"))
                .build();

        assertEquals(
                List.of("c", "a", "b"),
                snapshot.units().stream().map(u -> u.id().value()).toList());
        assertEquals(3, snapshot.unitCount());
        assertEquals(List.of(UnitId.of("a")), snapshot.findUnit(UnitId.of("b")).orElseThrow().references());
        assertTrue(snapshot.findUnit(UnitId.of("missing")).isEmpty());
    }

    @Test
    void rejectsDuplicateUnitIds() {
        var builder = InMemoryWorkspaceSnapshot.builder(root)
                .unit(unit("dup", root.resolve("one"), List.of()))
                .unit(unit("dup", root.resolve("two"), List.of()));

        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
