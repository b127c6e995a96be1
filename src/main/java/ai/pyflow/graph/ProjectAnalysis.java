package ai.pyflow.graph;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import ai.pyflow.model.FileRecord;
import ai.pyflow.model.ParseWarning;

/**
 * Output of the two analysis passes.
 * - records: analyzed files in discovery order (files that failed to parse are absent)
 * - symbols: the frozen table used for resolution
 */
public record ProjectAnalysis(
        Path root,
        Map<Path, FileRecord> records,
        SymbolTable symbols,
        List<ParseWarning> parseWarnings
) {
    public ProjectAnalysis {
        records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        parseWarnings = List.copyOf(parseWarnings);
    }

    public Set<Path> analyzedFiles() {
        return records.keySet();
    }
}
