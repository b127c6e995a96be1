package ai.pyflow.modules;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import ai.pyflow.model.Ids;

/**
 * Resolves module names against an ordered list of search roots, the way the Python
 * import system does for source modules:
 * 1) {@code <root>/a/b/c.py}
 * 2) {@code <root>/a/b/c/__init__.py}
 * First root with a hit wins. Results are cached per name.
 */
public final class SearchPathModuleResolver implements ModuleResolver {

    private static final String PACKAGE_INIT = "__init__.py";

    private final List<Path> searchRoots;
    private final Map<String, Optional<Path>> cache = new HashMap<>();

    public SearchPathModuleResolver(List<Path> searchRoots) {
        Objects.requireNonNull(searchRoots, "searchRoots");
        final Set<Path> roots = new LinkedHashSet<>();
        for (Path p : searchRoots) {
            roots.add(Ids.canonical(p));
        }
        this.searchRoots = List.copyOf(roots);
    }

    /** Project root first, then the extra roots; relative extras are taken against the project root. */
    public static SearchPathModuleResolver forProject(Path projectRoot, List<Path> extraRoots) {
        Objects.requireNonNull(projectRoot, "projectRoot");
        final List<Path> roots = new ArrayList<>();
        roots.add(projectRoot);
        for (Path extra : extraRoots) {
            roots.add(extra.isAbsolute() ? extra : projectRoot.resolve(extra));
        }
        return new SearchPathModuleResolver(roots);
    }

    public List<Path> searchRoots() {
        return searchRoots;
    }

    @Override
    public Optional<Path> resolve(String moduleName) {
        return cache.computeIfAbsent(moduleName, this::lookup);
    }

    private Optional<Path> lookup(String moduleName) {
        final String[] segments = Ids.moduleSegments(moduleName);
        if (segments == null) {
            return Optional.empty();
        }
        for (Path root : searchRoots) {
            Path base = root;
            for (String segment : segments) {
                base = base.resolve(segment);
            }
            final Path module = base.resolveSibling(segments[segments.length - 1] + ".py");
            if (Files.isRegularFile(module)) {
                return Optional.of(Ids.canonical(module));
            }
            final Path init = base.resolve(PACKAGE_INIT);
            if (Files.isRegularFile(init)) {
                return Optional.of(Ids.canonical(init));
            }
        }
        return Optional.empty();
    }
}
