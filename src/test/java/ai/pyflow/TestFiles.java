package ai.pyflow;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes small Python fixtures into a test directory.
 */
public final class TestFiles {

    private TestFiles() {
    }

    public static Path write(Path dir, String relativePath, String... lines) throws IOException {
        final Path file = dir.resolve(relativePath).toAbsolutePath().normalize();
        Files.createDirectories(file.getParent());
        Files.writeString(file, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return file;
    }
}
