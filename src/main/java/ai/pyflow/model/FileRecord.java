package ai.pyflow.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Result of analyzing one source file. Immutable once built.
 */
public record FileRecord(
        Path file,
        List<ImportRef> imports,      // in source order
        SortedSet<String> classes,
        SortedSet<String> functions,  // functions outside any class body
        List<CallEdge> callEdges,     // in visit order
        SortedSet<String> outputs,
        int unresolvedCalls
) {
    public FileRecord {
        Objects.requireNonNull(file, "file");
        imports = List.copyOf(imports);
        classes = Collections.unmodifiableSortedSet(new TreeSet<>(classes));
        functions = Collections.unmodifiableSortedSet(new TreeSet<>(functions));
        callEdges = List.copyOf(callEdges);
        outputs = Collections.unmodifiableSortedSet(new TreeSet<>(outputs));
    }
}
