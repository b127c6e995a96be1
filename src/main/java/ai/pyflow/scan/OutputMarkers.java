package ai.pyflow.scan;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Call names that count as output side effects (console print, logging).
 * Matching is on the resolved call name, exact and case-sensitive.
 */
public final class OutputMarkers {

    public static final List<String> DEFAULT_NAMES = List.of(
            "print", "logging.info", "logging.debug", "logging.error");

    private final Set<String> names;

    private OutputMarkers(Set<String> names) {
        this.names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    public static OutputMarkers defaults() {
        return new OutputMarkers(new LinkedHashSet<>(DEFAULT_NAMES));
    }

    public static OutputMarkers of(Collection<String> names) {
        Objects.requireNonNull(names, "names");
        final Set<String> out = new LinkedHashSet<>();
        for (String n : names) {
            if (n != null && !n.isBlank()) {
                out.add(n.trim());
            }
        }
        return new OutputMarkers(out);
    }

    /**
     * Reads markers from a file: one or more per line, comma or whitespace separated,
     * '#' starts a comment.
     */
    public static OutputMarkers load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Output marker file not found: " + file);
        }
        final Set<String> out = new LinkedHashSet<>();
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = br.readLine()) != null) {
                String trimmed = line.trim();
                final int hash = trimmed.indexOf('#');
                if (hash >= 0) {
                    trimmed = trimmed.substring(0, hash).trim();
                }
                if (trimmed.isEmpty()) {
                    continue;
                }
                for (String token : trimmed.split("[,\\s]+")) {
                    if (!token.isEmpty()) {
                        out.add(token);
                    }
                }
            }
        }
        return new OutputMarkers(out);
    }

    public boolean contains(String name) {
        return name != null && names.contains(name);
    }

    public Set<String> names() {
        return names;
    }
}
