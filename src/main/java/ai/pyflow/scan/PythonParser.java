package ai.pyflow.scan;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/**
 * Parses Python source with tree-sitter. tree-sitter always yields a tree; a tree that
 * contains ERROR or MISSING nodes is rejected as a {@link SourceParseException}.
 * <p>
 * Not thread-safe: one parser per thread.
 */
public final class PythonParser {

    private final TSParser parser;

    public PythonParser() {
        this.parser = new TSParser();
        this.parser.setLanguage(new TreeSitterPython());
    }

    public ParsedSource parse(Path file) throws SourceParseException {
        Objects.requireNonNull(file, "file");
        final String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException ex) {
            throw new SourceParseException(file, "not valid UTF-8 text", ex);
        } catch (IOException ex) {
            throw new SourceParseException(file, "cannot read file: " + ex.getMessage(), ex);
        }
        return parse(file, text);
    }

    public ParsedSource parse(Path file, String text) throws SourceParseException {
        final SourceText source = SourceText.of(text);
        final TSTree tree = parser.parseString(null, source.text());
        final TSNode root = tree.getRootNode();
        if (root == null || root.isNull()) {
            throw new SourceParseException(file, "parser returned no tree");
        }
        if (root.hasError()) {
            throw new SourceParseException(file, describeFirstError(root, source));
        }
        return new ParsedSource(file, source, tree);
    }

    private static String describeFirstError(TSNode root, SourceText source) {
        final Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final TSNode node = stack.pop();
            if (PythonNodeTypes.ERROR.equals(node.getType())) {
                return "syntax error at " + position(node) + near(node, source);
            }
            if (node.isMissing()) {
                return "missing '" + node.getType() + "' at " + position(node);
            }
            // push in reverse so the leftmost child is examined first
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                final TSNode child = node.getChild(i);
                if (child != null && !child.isNull() && (child.hasError() || child.isMissing()
                        || PythonNodeTypes.ERROR.equals(child.getType()))) {
                    stack.push(child);
                }
            }
        }
        return "syntax error";
    }

    private static String position(TSNode node) {
        final var point = node.getStartPoint();
        return "line " + (point.getRow() + 1) + ", column " + (point.getColumn() + 1);
    }

    private static String near(TSNode node, SourceText source) {
        String snippet = source.slice(node).strip();
        final int nl = snippet.indexOf('\n');
        if (nl >= 0) {
            snippet = snippet.substring(0, nl).strip();
        }
        if (snippet.isEmpty()) {
            return "";
        }
        if (snippet.length() > 40) {
            snippet = snippet.substring(0, 40) + "...";
        }
        return " near '" + snippet + "'";
    }
}
