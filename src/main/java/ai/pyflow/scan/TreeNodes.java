package ai.pyflow.scan;

import static ai.pyflow.scan.PythonNodeTypes.*;

import org.treesitter.TSNode;

/**
 * Small helpers over tree-sitter nodes.
 */
final class TreeNodes {

    private TreeNodes() {
    }

    static boolean present(TSNode node) {
        return node != null && !node.isNull();
    }

    static boolean is(TSNode node, String type) {
        return present(node) && type.equals(node.getType());
    }

    static TSNode field(TSNode node, String fieldName) {
        final TSNode child = node.getChildByFieldName(fieldName);
        return present(child) ? child : null;
    }

    /** Unwraps {@code @decorator def f(): ...} to the function or class definition. */
    static TSNode undecorated(TSNode node) {
        if (is(node, DECORATED_DEFINITION)) {
            final TSNode definition = field(node, FIELD_DEFINITION);
            return definition != null ? definition : node;
        }
        return node;
    }

    /** Name of a class or function definition, or null. */
    static String definitionName(TSNode definition, SourceText source) {
        final TSNode name = field(definition, FIELD_NAME);
        if (name == null) {
            return null;
        }
        final String text = source.slice(name);
        return text.isEmpty() ? null : text;
    }
}
