package ai.pyflow.graph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

import ai.pyflow.model.CallEdge;
import ai.pyflow.model.FileRecord;
import ai.pyflow.model.Ids;
import ai.pyflow.model.ImportRef;
import ai.pyflow.modules.ModuleResolver;

/**
 * Turns per-file records into one node/edge graph. Imports are resolved here, not earlier.
 * Output is deterministic for the same records.
 */
public final class GraphAssembler {

    public static final String DIVIDER = "-".repeat(20);
    public static final String EMPTY_MARKER = "(No classes or functions)";
    public static final String OUTPUTS_HEADER = "Outputs:";

    public static final String IMPORT_LABEL = "imports";
    public static final String CALL_LABEL = "calls";
    public static final String IMPORT_COLOR = "blue";
    public static final String CALL_COLOR = "black";

    private static final Comparator<List<String>> PAIR_ORDER =
            Comparator.<List<String>, String>comparing(p -> p.get(0)).thenComparing(p -> p.get(1));

    private final ModuleResolver resolver;
    private final boolean sequenced;

    public GraphAssembler(ModuleResolver resolver, boolean sequenced) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.sequenced = sequenced;
    }

    public Graph assemble(ProjectAnalysis analysis) {
        Objects.requireNonNull(analysis, "analysis");
        final Set<Path> analyzed = analysis.analyzedFiles();

        final List<Graph.Node> nodes = new ArrayList<>(analyzed.size());
        for (FileRecord rec : analysis.records().values()) {
            nodes.add(new Graph.Node(Ids.nodeId(rec.file()), nodeLabel(rec)));
        }

        final List<Graph.Edge> edges = new ArrayList<>();

        // imports: one edge per distinct (importer, target) inside the analyzed set
        final Set<List<String>> importPairs = new LinkedHashSet<>();
        int dropped = 0;
        for (FileRecord rec : analysis.records().values()) {
            for (ImportRef imp : rec.imports()) {
                final Optional<Path> target = resolver.resolve(imp.moduleName());
                if (target.isEmpty() || !analyzed.contains(target.get())) {
                    dropped++;
                    continue;
                }
                importPairs.add(List.of(Ids.nodeId(imp.importer()), Ids.nodeId(target.get())));
            }
        }
        importPairs.stream()
                .sorted(PAIR_ORDER)
                .forEach(p -> edges.add(new Graph.Edge(p.get(0), p.get(1), EdgeKind.IMPORTS,
                        IMPORT_LABEL, IMPORT_COLOR, null)));

        // calls
        final List<CallEdge> calls = new ArrayList<>();
        for (FileRecord rec : analysis.records().values()) {
            for (CallEdge call : rec.callEdges()) {
                if (analyzed.contains(call.callee())) {
                    calls.add(call);
                }
            }
        }
        if (sequenced) {
            calls.sort(Comparator.comparingInt(CallEdge::sequence));
            for (CallEdge call : calls) {
                edges.add(new Graph.Edge(Ids.nodeId(call.caller()), Ids.nodeId(call.callee()), EdgeKind.CALLS,
                        "call " + call.sequence(), CALL_COLOR, call.sequence()));
            }
        } else {
            final Set<List<String>> callPairs = new LinkedHashSet<>();
            for (CallEdge call : calls) {
                callPairs.add(List.of(Ids.nodeId(call.caller()), Ids.nodeId(call.callee())));
            }
            callPairs.stream()
                    .sorted(PAIR_ORDER)
                    .forEach(p -> edges.add(new Graph.Edge(p.get(0), p.get(1), EdgeKind.CALLS,
                            CALL_LABEL, CALL_COLOR, null)));
        }

        return new Graph(nodes, edges, sequenced, dropped, analysis.parseWarnings());
    }

    /**
     * File name, then classes (or functions, or a placeholder), then outputs if any,
     * each section closed by a divider line.
     */
    public static String nodeLabel(FileRecord rec) {
        final var sb = new StringBuilder();
        sb.append(Ids.fileName(rec.file()));
        divider(sb);
        if (!rec.classes().isEmpty()) {
            appendLines(sb, rec.classes());
        } else if (!rec.functions().isEmpty()) {
            appendLines(sb, rec.functions());
        } else {
            sb.append(EMPTY_MARKER);
        }
        if (!rec.outputs().isEmpty()) {
            divider(sb);
            sb.append(OUTPUTS_HEADER).append('\n');
            appendLines(sb, rec.outputs());
        }
        divider(sb);
        return sb.toString();
    }

    private static void divider(StringBuilder sb) {
        sb.append('\n').append(DIVIDER).append('\n');
    }

    private static void appendLines(StringBuilder sb, SortedSet<String> values) {
        sb.append(String.join("\n", values));
    }
}
