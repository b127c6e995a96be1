package ai.pyflow.scan;

import java.nio.file.Path;

/**
 * A file's text is not valid Python, or could not be read.
 */
public final class SourceParseException extends Exception {

    private final Path file;

    public SourceParseException(Path file, String reason) {
        super(reason);
        this.file = file;
    }

    public SourceParseException(Path file, String reason, Throwable cause) {
        super(reason, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
