package ai.pyflow.scan;

import java.nio.file.Path;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * A successfully parsed file. The tree is kept for both analysis passes.
 */
public record ParsedSource(Path file, SourceText source, TSTree tree) {

    public TSNode root() {
        return tree.getRootNode();
    }
}
