package ai.pyflow.graph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Repository-wide symbol table, built in one pass and then frozen:
 * - "name" -> defining files (top-level functions, classes)
 * - "Class.method" -> defining files (methods declared directly in a class body)
 * <p>
 * Lookup is exact and case-sensitive. Every candidate is kept; {@link CollisionPolicy}
 * decides what a lookup returns when a name has several defining files.
 */
public final class SymbolTable {

    private final CollisionPolicy policy;
    private final Map<String, List<Path>> candidates = new HashMap<>();
    private Map<String, Path> resolved;

    public SymbolTable(CollisionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public void register(String name, Path file) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(file, "file");
        if (isFrozen()) {
            throw new IllegalStateException("symbol table is frozen; cannot register " + name);
        }
        final List<Path> files = candidates.computeIfAbsent(name, k -> new ArrayList<>());
        // keep registration order; re-registering moves the file to the end (last writer)
        files.remove(file);
        files.add(file);
    }

    /**
     * Ends the build pass. Lookups are only allowed after this call.
     *
     * @throws SymbolCollisionException under {@link CollisionPolicy#FAIL} if any name collides
     */
    public void freeze() {
        if (isFrozen()) {
            return;
        }
        final Map<String, List<Path>> collisions = collisions();
        if (policy == CollisionPolicy.FAIL && !collisions.isEmpty()) {
            throw new SymbolCollisionException(collisions);
        }
        final Map<String, Path> out = new HashMap<>();
        for (var e : candidates.entrySet()) {
            final List<Path> files = e.getValue();
            if (files.size() > 1 && policy == CollisionPolicy.AMBIGUOUS) {
                continue;
            }
            out.put(e.getKey(), files.get(files.size() - 1));
        }
        resolved = Map.copyOf(out);
    }

    public boolean isFrozen() {
        return resolved != null;
    }

    public Optional<Path> lookup(String name) {
        if (!isFrozen()) {
            throw new IllegalStateException("symbol table must be frozen before lookup");
        }
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(resolved.get(name));
    }

    public List<Path> candidates(String name) {
        final List<Path> files = candidates.get(name);
        return files == null ? List.of() : Collections.unmodifiableList(files);
    }

    /** Names with more than one defining file, sorted by name. */
    public Map<String, List<Path>> collisions() {
        final Map<String, List<Path>> out = new TreeMap<>();
        for (var e : candidates.entrySet()) {
            if (e.getValue().size() > 1) {
                out.put(e.getKey(), List.copyOf(e.getValue()));
            }
        }
        return out;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(candidates.keySet()));
    }

    public CollisionPolicy policy() {
        return policy;
    }

    public int size() {
        return candidates.size();
    }
}
