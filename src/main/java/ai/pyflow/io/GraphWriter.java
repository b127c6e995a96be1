package ai.pyflow.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.pyflow.graph.EdgeKind;
import ai.pyflow.graph.Graph;
import ai.pyflow.graph.ProjectAnalysis;
import ai.pyflow.model.CallEdge;
import ai.pyflow.model.FileRecord;
import ai.pyflow.model.Ids;
import ai.pyflow.model.ImportRef;
import ai.pyflow.model.ParseWarning;

/**
 * Writes the graph and the per-file records as one JSON document, {@code <name>.json}.
 */
public final class GraphWriter {

    public static final String SCHEMA_VERSION = "pyflow-graph/v1";

    private final Path outDir;
    private final ObjectMapper jsonMapper;

    public GraphWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path write(String baseName, ProjectAnalysis analysis, Graph graph, String generatedAt) throws IOException {
        Objects.requireNonNull(baseName, "baseName");
        Objects.requireNonNull(analysis, "analysis");
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Files.createDirectories(outDir);
        final Path file = outDir.resolve(baseName + ".json");
        jsonMapper.writeValue(file.toFile(), toDocument(analysis, graph, generatedAt));
        return file;
    }

    GraphDocument toDocument(ProjectAnalysis analysis, Graph graph, String generatedAt) {
        final List<FileEntry> files = new ArrayList<>(analysis.records().size());
        int unresolvedCalls = 0;
        for (FileRecord rec : analysis.records().values()) {
            unresolvedCalls += rec.unresolvedCalls();
            files.add(new FileEntry(
                    Ids.nodeId(rec.file()),
                    rec.imports().stream().map(ImportRef::moduleName).toList(),
                    List.copyOf(rec.classes()),
                    List.copyOf(rec.functions()),
                    List.copyOf(rec.outputs()),
                    rec.callEdges().stream()
                            .map(c -> new CallEntry(c.name(), Ids.nodeId(c.callee()), c.sequence()))
                            .toList(),
                    rec.unresolvedCalls()
            ));
        }

        final List<WarningEntry> warnings = new ArrayList<>();
        for (ParseWarning w : graph.parseWarnings()) {
            warnings.add(new WarningEntry(Ids.nodeId(w.file()), w.reason()));
        }

        final Map<String, List<String>> collisions = new TreeMap<>();
        for (var e : analysis.symbols().collisions().entrySet()) {
            collisions.put(e.getKey(), e.getValue().stream().map(Ids::nodeId).toList());
        }

        final Summary summary = new Summary(
                graph.nodes().size(),
                warnings.size(),
                graph.edges(EdgeKind.IMPORTS).size(),
                graph.edges(EdgeKind.CALLS).size(),
                unresolvedCalls,
                graph.droppedImports(),
                collisions.size()
        );

        return new GraphDocument(
                SCHEMA_VERSION,
                generatedAt,
                Ids.nodeId(analysis.root()),
                graph.sequenced() ? "sequenced" : "plain",
                analysis.symbols().policy().name(),
                graph.nodes(),
                graph.edges(),
                files,
                warnings,
                collisions,
                summary
        );
    }

    // --- document records ---

    public record GraphDocument(
            String schema,
            String generatedAt,
            String root,
            String mode,
            String collisionPolicy,
            List<Graph.Node> nodes,
            List<Graph.Edge> edges,
            List<FileEntry> files,
            List<WarningEntry> parseWarnings,
            Map<String, List<String>> symbolCollisions,
            Summary summary
    ) {
    }

    public record FileEntry(
            String path,
            List<String> imports,
            List<String> classes,
            List<String> functions,
            List<String> outputs,
            List<CallEntry> calls,
            int unresolvedCalls
    ) {
    }

    public record CallEntry(
            String name,
            String callee,
            int sequence
    ) {
    }

    public record WarningEntry(
            String file,
            String reason
    ) {
    }

    public record Summary(
            int files,
            int parseWarnings,
            int importEdges,
            int callEdges,
            int unresolvedCalls,
            int droppedImports,
            int symbolCollisions
    ) {
    }
}
