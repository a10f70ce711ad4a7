package ai.reanalyze.exception;

import java.nio.file.Path;

/** A file watch could not be started. Callers degrade to not watching rather than failing. */
public class WatchSetupException extends Exception {

    public WatchSetupException(Path root, Throwable cause) {
        super("Failed to watch " + root + ": " + cause.getMessage(), cause);
    }

    public WatchSetupException(Path root, String reason) {
        super("Failed to watch " + root + ": " + reason);
    }
}
