package ai.reanalyze;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileWatcherHelperTest {

    @TempDir
    Path root;

    @Test
    void emptyPatternListMeansDefaults() {
        var helper = new FileWatcherHelper(root, List.of());

        assertEquals(FileWatcherHelper.DEFAULT_PATTERNS, helper.getPatterns());
        assertTrue(helper.isRelevant(root.resolve("core/src/main/java/Foo.java")));
        assertTrue(helper.isRelevant(root.resolve("core/pom.xml")));
        assertTrue(helper.isRelevant(root.resolve("build.gradle.kts")));
        assertFalse(helper.isRelevant(root.resolve("README.md")));
    }

    @Test
    void doubleStarPatternsMatchFilesDirectlyUnderRoot() {
        var helper = new FileWatcherHelper(root, List.of("**/*.java"));

        assertTrue(helper.isRelevant(root.resolve("Main.java")));
        assertTrue(helper.isRelevant(root.resolve("a/b/Main.java")));
    }

    @Test
    void excludedDirectoriesAndOutsidePathsAreNeverRelevant() {
        var helper = new FileWatcherHelper(root, List.of());

        assertTrue(helper.isInExcludedDirectory(root.resolve("target/generated/Foo.java")));
        assertTrue(helper.isInExcludedDirectory(root.resolve("web/node_modules/x/Foo.java")));
        assertTrue(helper.isInExcludedDirectory(root.resolve(".git/HEAD")));
        assertFalse(helper.isRelevant(root.resolve("target/generated/Foo.java")));
        assertTrue(helper.isInExcludedDirectory(root.resolveSibling("elsewhere/Foo.java")));
        // a file merely named like an excluded directory is fine
        assertFalse(helper.isInExcludedDirectory(root.resolve("src/build")));
    }

    @Test
    void customPatternsAreRelativeToRoot() {
        var helper = new FileWatcherHelper(root, List.of("src/main/java/**"));

        assertTrue(helper.isRelevant(root.resolve("src/main/java/a/A.java")));
        assertFalse(helper.isRelevant(root.resolve("src/test/java/a/ATest.java")));
    }

    @Test
    void excludedDirectoryNames() {
        assertTrue(FileWatcherHelper.isExcludedDirectoryName("target"));
        assertFalse(FileWatcherHelper.isExcludedDirectoryName("src"));
    }
}
