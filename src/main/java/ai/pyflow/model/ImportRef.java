package ai.pyflow.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One import statement target as written: {@code import a.b} gives {@code a.b},
 * {@code from a import b} gives {@code a.b}. Resolved to a file only at assembly time.
 */
public record ImportRef(
        Path importer,
        String moduleName
) {
    public ImportRef {
        Objects.requireNonNull(importer, "importer");
        Objects.requireNonNull(moduleName, "moduleName");
    }
}
