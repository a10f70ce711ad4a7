package ai.reanalyze.workspace;

import java.io.IOException;
import java.nio.file.Path;

/** Loads a {@link WorkspaceSnapshot} from a workspace source, such as a manifest file or directory. */
@FunctionalInterface
public interface WorkspaceLoader {
    WorkspaceSnapshot load(Path source) throws IOException;
}
