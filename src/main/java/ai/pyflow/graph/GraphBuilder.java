package ai.pyflow.graph;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import ai.pyflow.model.FileRecord;
import ai.pyflow.model.Ids;
import ai.pyflow.model.ParseWarning;
import ai.pyflow.scan.FileAnalyzer;
import ai.pyflow.scan.ParsedSource;
import ai.pyflow.scan.PythonParser;
import ai.pyflow.scan.SourceFileFinder;
import ai.pyflow.scan.SourceParseException;
import ai.pyflow.scan.SymbolScanner;

/**
 * Runs the analysis in strict two-pass order:
 * 1) discover files, parse each, register definitions; then freeze the symbol table
 * 2) analyze each parsed file against the frozen table
 * Full scan every run; nothing is cached between runs.
 */
public final class GraphBuilder {

    private final Path root;
    private final AnalysisOptions options;

    public GraphBuilder(Path root, AnalysisOptions options) {
        this.root = Objects.requireNonNull(root, "root");
        this.options = Objects.requireNonNull(options, "options");
    }

    public ProjectAnalysis build() throws IOException {
        final SourceFileFinder finder = new SourceFileFinder(root);
        final List<Path> files = finder.findAll();
        return analyze(finder.root(), files);
    }

    /** Analyzes a fixed file list, in the given order. */
    public ProjectAnalysis analyze(Path projectRoot, List<Path> sourceFiles) {
        Objects.requireNonNull(sourceFiles, "sourceFiles");
        final List<Path> files = sourceFiles.stream().map(Ids::canonical).toList();

        // Step 1: parse + symbol pass
        final PythonParser parser = new PythonParser();
        final SymbolTable symbols = new SymbolTable(options.collisionPolicy());
        final SymbolScanner symbolScanner = new SymbolScanner(symbols);
        final List<ParsedSource> parsed = new ArrayList<>(files.size());
        final List<ParseWarning> warnings = new ArrayList<>();

        for (Path file : files) {
            try {
                final ParsedSource source = parser.parse(file);
                symbolScanner.scan(source);
                parsed.add(source);
            } catch (SourceParseException ex) {
                warnings.add(new ParseWarning(file, ex.getMessage()));
                System.err.println("WARN: failed to parse " + file + " -> " + safeMsg(ex.getMessage()));
            }
        }

        symbols.freeze();
        reportAmbiguities(symbols);

        // Step 2: per-file analysis against the frozen table
        final FileAnalyzer analyzer = new FileAnalyzer(options.outputMarkers());
        final SequenceCounter sequence = new SequenceCounter();
        final Map<Path, FileRecord> records = new LinkedHashMap<>();
        for (ParsedSource source : parsed) {
            records.put(source.file(), analyzer.analyze(source, symbols, sequence));
        }

        return new ProjectAnalysis(Ids.canonical(projectRoot), records, symbols, warnings);
    }

    private static void reportAmbiguities(SymbolTable symbols) {
        if (symbols.policy() != CollisionPolicy.AMBIGUOUS) {
            return;
        }
        for (var e : symbols.collisions().entrySet()) {
            System.err.println("WARN: ambiguous symbol " + e.getKey() + " defined in " + e.getValue()
                    + "; calls to it stay unresolved");
        }
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
