package ai.reanalyze;

import java.nio.file.Path;
import java.time.Instant;

public record ChangeRecord(Path filePath, Instant timestamp) {}
