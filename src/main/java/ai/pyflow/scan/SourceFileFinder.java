package ai.pyflow.scan;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import ai.pyflow.model.Ids;

/**
 * Finds all Python source files under a root, once per run.
 * The returned list is sorted by root-relative path and never changes afterwards.
 */
public final class SourceFileFinder {

    public static final String SOURCE_EXTENSION = ".py";

    private static final Set<String> SKIPPED_DIRS = Set.of(
            ".git", ".hg", ".svn", ".idea", "__pycache__", "node_modules", ".tox", ".mypy_cache");

    private final Path root;

    public SourceFileFinder(Path root) {
        this.root = Ids.canonical(Objects.requireNonNull(root, "root"));
    }

    public Path root() {
        return root;
    }

    public List<Path> findAll() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }
        final List<Path> out = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                final String name = dir.getFileName() != null ? dir.getFileName().toString() : "";
                if (SKIPPED_DIRS.contains(name)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && Ids.fileName(file).endsWith(SOURCE_EXTENSION)) {
                    out.add(Ids.canonical(file));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                System.err.println("WARN: cannot access " + file + " -> " + exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        out.sort(Comparator.comparing(this::relativeKey));
        return List.copyOf(out);
    }

    private String relativeKey(Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
