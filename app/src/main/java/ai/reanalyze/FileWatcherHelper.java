package ai.reanalyze;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides which paths under a watch root are interesting: glob patterns select files (matched against
 * the path relative to the root), and build-output, dependency and VCS directories are always excluded.
 */
public class FileWatcherHelper {

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "**/*.java",
            "**/*.kt",
            "**/*.groovy",
            "**/*.scala",
            "**/pom.xml",
            "**/*.gradle",
            "**/*.gradle.kts",
            "**/workspace.json");

    static final Set<String> EXCLUDED_DIR_NAMES = Set.of(
            // Build directories
            "target",
            "build",
            "out",
            "dist",
            "bin",
            ".gradle",
            ".maven",
            // Dependencies
            "node_modules",
            "vendor",
            // IDE
            ".idea",
            ".vscode",
            ".settings",
            // VCS
            ".git",
            ".svn",
            ".hg");

    private final Path root;
    private final List<String> patterns;
    private final List<PathMatcher> matchers;

    public FileWatcherHelper(Path root, List<String> patterns) {
        this.root = root.toAbsolutePath().normalize();
        this.patterns = List.copyOf(patterns.isEmpty() ? DEFAULT_PATTERNS : patterns);
        var fs = FileSystems.getDefault();
        var compiled = new ArrayList<PathMatcher>();
        for (var pattern : this.patterns) {
            compiled.add(fs.getPathMatcher("glob:" + pattern));
            // glob "**/" needs at least one directory; let such patterns match files in the root too
            if (pattern.startsWith("**/")) {
                compiled.add(fs.getPathMatcher("glob:" + pattern.substring(3)));
            }
        }
        this.matchers = List.copyOf(compiled);
    }

    public Path getRoot() {
        return root;
    }

    public List<String> getPatterns() {
        return patterns;
    }

    public static boolean isExcludedDirectoryName(String name) {
        return EXCLUDED_DIR_NAMES.contains(name);
    }

    /** True if the path is outside the root or inside one of the excluded directories. */
    public boolean isInExcludedDirectory(Path path) {
        Path relative;
        try {
            relative = root.relativize(path.toAbsolutePath().normalize());
        } catch (IllegalArgumentException e) {
            return true;
        }
        if (relative.startsWith("..")) {
            return true;
        }
        int dirSegments = relative.getNameCount() - 1;
        for (int i = 0; i < dirSegments; i++) {
            if (EXCLUDED_DIR_NAMES.contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }

    /** True if the file lies under the root, outside excluded directories, and matches one of the patterns. */
    public boolean isRelevant(Path path) {
        if (isInExcludedDirectory(path)) {
            return false;
        }
        var relative = root.relativize(path.toAbsolutePath().normalize());
        return matchers.stream().anyMatch(m -> m.matches(relative));
    }
}
