package ai.pyflow.model;

import java.nio.file.Path;
import java.util.Objects;

public final class Ids {

    private Ids() {
    }

    /** Graph node id of a source file: its canonical absolute path. */
    public static String nodeId(Path file) {
        Objects.requireNonNull(file, "file");
        return canonical(file).toString();
    }

    public static Path canonical(Path file) {
        return file.toAbsolutePath().normalize();
    }

    public static String fileName(Path file) {
        final Path name = file.getFileName();
        return name != null ? name.toString() : file.toString();
    }

    /**
     * Splits a dotted module name into path segments.
     * Returns null for names that cannot map to a file ("", "a..b", "pkg.*").
     */
    public static String[] moduleSegments(String moduleName) {
        if (moduleName == null || moduleName.isBlank()) {
            return null;
        }
        final String[] parts = moduleName.split("\\.", -1);
        for (String part : parts) {
            if (part.isEmpty() || !isIdentifier(part)) {
                return null;
            }
        }
        return parts;
    }

    public static String qualified(String owner, String member) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(member, "member");
        return owner + "." + member;
    }

    private static boolean isIdentifier(String s) {
        if (!Character.isJavaIdentifierStart(s.codePointAt(0)) || s.charAt(0) == '$') {
            return false;
        }
        for (int i = 1; i < s.length(); i++) {
            final char c = s.charAt(i);
            if (!Character.isJavaIdentifierPart(c) || c == '$') {
                return false;
            }
        }
        return true;
    }
}
