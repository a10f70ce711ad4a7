package ai.reanalyze.manifest;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Contents of a {@code workspace.json} file. Paths are relative to the directory holding the manifest.
 *
 * <pre>{@code
 * {
 *   "name": "shop",
 *   "units": [
 *     {"id": "core", "language": "java", "directory": "core", "projectFile": "core/pom.xml"},
 *     {"id": "web", "directory": "web", "include": ["src/main/java/**"], "references": ["core"]}
 *   ]
 * }
 * }</pre>
 */
public record WorkspaceManifest(@Nullable String name, List<UnitEntry> units) {

    public WorkspaceManifest {
        units = units == null ? List.of() : List.copyOf(units);
    }

    /**
     * @param include glob patterns relative to the unit directory; the default watch patterns when empty
     */
    public record UnitEntry(
            String id,
            @Nullable String name,
            @Nullable String language,
            @Nullable String directory,
            @Nullable String projectFile,
            List<String> include,
            List<String> references) {

        public static final String DEFAULT_LANGUAGE = "java";

        public UnitEntry {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("every unit needs an id");
            }
            include = include == null ? List.of() : List.copyOf(include);
            references = references == null ? List.of() : List.copyOf(references);
        }
    }
}
