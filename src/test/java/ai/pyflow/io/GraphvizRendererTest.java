package ai.pyflow.io;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ai.pyflow.graph.Graph;

public class GraphvizRendererTest {

    @TempDir
    Path tmp;

    @Test
    void missingExecutableFailsAfterWritingDescription() throws Exception {
        final Graph graph = new Graph(List.of(new Graph.Node("/p/a.py", "a.py")), List.of(), false, 0, List.of());
        final GraphvizRenderer renderer =
                new GraphvizRenderer(tmp.resolve("out"), "flow", "svg", "pyflow-no-such-dot-binary");

        final RendererException ex = assertThrows(RendererException.class, () -> renderer.render(graph));

        assertTrue(ex.getMessage().contains("pyflow-no-such-dot-binary"), ex.getMessage());
        final Path gv = tmp.resolve("out/flow.gv");
        assertEquals(gv, renderer.descriptionPath());
        assertEquals(tmp.resolve("out/flow.svg"), renderer.diagramPath());
        assertTrue(Files.readString(gv, StandardCharsets.UTF_8).contains("\"/p/a.py\" [label=\"a.py\"];"));
        assertFalse(Files.exists(renderer.diagramPath()));
    }
}
