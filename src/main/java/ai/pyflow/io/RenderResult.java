package ai.pyflow.io;

import java.nio.file.Path;

/**
 * The two artifacts of one render, sharing a base name.
 */
public record RenderResult(
        Path diagram,      // e.g. execution_flow.pdf
        Path description   // e.g. execution_flow.gv
) {
}
