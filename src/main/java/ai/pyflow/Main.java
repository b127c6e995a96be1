package ai.pyflow;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import ai.pyflow.graph.AnalysisOptions;
import ai.pyflow.graph.CollisionPolicy;
import ai.pyflow.graph.EdgeKind;
import ai.pyflow.graph.Graph;
import ai.pyflow.graph.GraphAssembler;
import ai.pyflow.graph.GraphBuilder;
import ai.pyflow.graph.ProjectAnalysis;
import ai.pyflow.io.GraphWriter;
import ai.pyflow.io.GraphvizRenderer;
import ai.pyflow.io.RenderResult;
import ai.pyflow.io.RendererException;
import ai.pyflow.modules.SearchPathModuleResolver;
import ai.pyflow.scan.OutputMarkers;

public final class Main {

    static final String DEFAULT_NAME = "execution_flow";

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path root = null;
        Path outDir = null;
        Path outputsFile = null;
        String name = DEFAULT_NAME;
        String format = GraphvizRenderer.DEFAULT_FORMAT;
        String dotCommand = GraphvizRenderer.DEFAULT_COMMAND;
        boolean writeJson = true;
        AnalysisOptions options = AnalysisOptions.defaults();
        List<String> outputs = null;
        final List<Path> searchPath = new ArrayList<>();

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = Paths.get(arg.substring("--outDir=".length()));
                    continue;
                }
                if (arg.startsWith("--name=")) {
                    name = arg.substring("--name=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--format=")) {
                    format = arg.substring("--format=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--dot=")) {
                    dotCommand = arg.substring("--dot=".length()).trim();
                    continue;
                }
                if (arg.startsWith("--json=")) {
                    writeJson = Boolean.parseBoolean(arg.substring("--json=".length()));
                    continue;
                }
                if (arg.startsWith("--sequenced=")) {
                    options = options.withSequenced(Boolean.parseBoolean(arg.substring("--sequenced=".length())));
                    continue;
                }
                if (arg.startsWith("--collisions=")) {
                    options = options.withCollisionPolicy(
                            CollisionPolicy.parse(arg.substring("--collisions=".length())));
                    continue;
                }
                if (arg.startsWith("--outputs=")) {
                    outputs = splitList(arg.substring("--outputs=".length()));
                    continue;
                }
                if (arg.startsWith("--outputsFile=")) {
                    outputsFile = Paths.get(arg.substring("--outputsFile=".length()));
                    continue;
                }
                if (arg.startsWith("--searchPath=")) {
                    splitList(arg.substring("--searchPath=".length())).forEach(p -> searchPath.add(Paths.get(p)));
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (root == null) {
                    root = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (name.isEmpty() || format.isEmpty() || dotCommand.isEmpty()) {
                System.err.println("ERROR: --name, --format and --dot must not be empty");
                return 2;
            }

            if (root == null) {
                root = Paths.get(".");
            }
            root = root.toAbsolutePath().normalize();

            if (outDir == null) {
                outDir = root;
            } else if (!outDir.isAbsolute()) {
                outDir = root.resolve(outDir).normalize();
            }

            if (outputsFile != null) {
                final Path markerPath = outputsFile.isAbsolute() ? outputsFile : root.resolve(outputsFile).normalize();
                final List<String> fromFile = new ArrayList<>(OutputMarkers.load(markerPath).names());
                if (outputs != null) {
                    fromFile.addAll(outputs);
                }
                outputs = fromFile;
            }
            if (outputs != null) {
                options = options.withOutputMarkers(OutputMarkers.of(outputs));
            }

            final ProjectAnalysis analysis = new GraphBuilder(root, options).build();
            final var resolver = SearchPathModuleResolver.forProject(root, searchPath);
            final Graph graph = new GraphAssembler(resolver, options.sequenced()).assemble(analysis);

            final RenderResult result = new GraphvizRenderer(outDir, name, format, dotCommand).render(graph);
            System.out.println("Execution diagram generated: " + result.diagram());
            System.out.println("DOT source file generated: " + result.description());

            if (writeJson) {
                final Path json = new GraphWriter(outDir).write(name, analysis, graph, Instant.now().toString());
                System.out.println("JSON graph written to: " + json);
            }
            System.out.println("Files: " + graph.nodes().size()
                    + ", symbols: " + analysis.symbols().size()
                    + ", import edges: " + graph.edges(EdgeKind.IMPORTS).size()
                    + ", call edges: " + graph.edges(EdgeKind.CALLS).size());
            if (!graph.parseWarnings().isEmpty()) {
                System.err.println("WARN: files excluded after parse failures: " + graph.parseWarnings().size());
            }
            return 0;
        } catch (IllegalArgumentException ex) {
            System.err.println("ERROR: " + safeMsg(ex.getMessage()));
            printUsage();
            return 2;
        } catch (java.io.IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (RendererException ex) {
            System.err.println("ERROR: rendering failed: " + safeMsg(ex.getMessage()));
            return 1;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to build graph: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static List<String> splitList(String list) {
        return Arrays.stream(list.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static void printUsage() {
        System.out.println("Usage: pyflow-graph [root] [options]");
        System.out.println("Options:");
        System.out.println("  --outDir=<path>          Output directory (default: <root>)");
        System.out.println("  --name=<base>            Artifact base name (default: " + DEFAULT_NAME + ")");
        System.out.println("  --format=<fmt>           Graphviz output format (default: pdf)");
        System.out.println("  --dot=<cmd>              Graphviz executable (default: dot)");
        System.out.println("  --sequenced=<bool>       Number call edges in discovery order (default: false)");
        System.out.println("  --collisions=<policy>    last-wins | ambiguous | fail (default: last-wins)");
        System.out.println("  --outputs=<a,b>          Output call names (default: print, logging.info/debug/error)");
        System.out.println("  --outputsFile=<path>     File with output call names (one per line or comma-separated)");
        System.out.println("  --searchPath=<p1,p2>     Extra module search roots (root is always searched first)");
        System.out.println("  --json=<bool>            Also write <name>.json (default: true)");
        System.out.println("  --help, -h               Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}
