package ai.pyflow.model;

import java.nio.file.Path;

/**
 * A source file excluded from the run, with the reason it could not be read or parsed.
 */
public record ParseWarning(Path file, String reason) {
}
