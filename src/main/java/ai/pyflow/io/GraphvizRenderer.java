package ai.pyflow.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import ai.pyflow.graph.Graph;

/**
 * Writes {@code <name>.gv} and runs the Graphviz {@code dot} executable to produce
 * {@code <name>.<format>} next to it.
 */
public final class GraphvizRenderer implements Renderer {

    public static final String DEFAULT_COMMAND = "dot";
    public static final String DEFAULT_FORMAT = "pdf";
    public static final String DESCRIPTION_EXTENSION = ".gv";

    private final Path outDir;
    private final String baseName;
    private final String format;
    private final String dotCommand;

    public GraphvizRenderer(Path outDir, String baseName, String format, String dotCommand) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.baseName = Objects.requireNonNull(baseName, "baseName");
        this.format = Objects.requireNonNull(format, "format");
        this.dotCommand = Objects.requireNonNull(dotCommand, "dotCommand");
    }

    public Path descriptionPath() {
        return outDir.resolve(baseName + DESCRIPTION_EXTENSION);
    }

    public Path diagramPath() {
        return outDir.resolve(baseName + "." + format);
    }

    @Override
    public RenderResult render(Graph graph) throws RendererException {
        Objects.requireNonNull(graph, "graph");
        final Path description = descriptionPath();
        final Path diagram = diagramPath();

        try {
            Files.createDirectories(outDir);
            Files.writeString(description, new DotWriter(baseName).toDot(graph), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new RendererException("cannot write " + description + ": " + ex.getMessage(), ex);
        }

        final List<String> command = List.of(
                dotCommand, "-T" + format, description.toString(), "-o", diagram.toString());
        final Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException ex) {
            throw new RendererException("cannot start Graphviz '" + dotCommand + "': " + ex.getMessage(), ex);
        }

        try (InputStream in = process.getInputStream()) {
            final String output = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            final int exit = process.waitFor();
            if (exit != 0) {
                throw new RendererException("Graphviz exited with " + exit
                        + (output.isEmpty() ? "" : ": " + output));
            }
        } catch (IOException ex) {
            process.destroy();
            throw new RendererException("Graphviz I/O failure: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new RendererException("interrupted while waiting for Graphviz", ex);
        }

        return new RenderResult(diagram, description);
    }
}
