package ai.pyflow.graph;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public final class SymbolCollisionException extends RuntimeException {

    private final Map<String, List<Path>> collisions;

    public SymbolCollisionException(Map<String, List<Path>> collisions) {
        super(describe(collisions));
        this.collisions = Map.copyOf(collisions);
    }

    public Map<String, List<Path>> collisions() {
        return collisions;
    }

    private static String describe(Map<String, List<Path>> collisions) {
        final var sb = new StringBuilder();
        sb.append(collisions.size()).append(" symbol(s) defined in more than one file:");
        collisions.keySet().stream().sorted().forEach(name ->
                sb.append(' ').append(name).append(' ').append(collisions.get(name)).append(';'));
        return sb.toString();
    }
}
