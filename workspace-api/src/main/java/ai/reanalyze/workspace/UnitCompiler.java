package ai.reanalyze.workspace;

import java.io.IOException;

/**
 * The compiler collaborator that produces cached artifacts. Compilation must be deterministic given
 * unit content, so recomputing a dropped artifact is always safe.
 */
public interface UnitCompiler {

    /** Hash of everything that influences the compiled artifact. Equal hashes mean the artifact can be reused. */
    String contentHash(CompilationUnit unit) throws IOException;

    CompiledUnit compile(CompilationUnit unit) throws IOException;
}
