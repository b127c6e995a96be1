package ai.pyflow.scan;

import static ai.pyflow.scan.PythonNodeTypes.*;

import java.util.Objects;

import org.treesitter.TSNode;

import ai.pyflow.graph.SymbolTable;
import ai.pyflow.model.Ids;

/**
 * First pass: registers the definitions of one file in the shared symbol table.
 * <ul>
 *   <li>functions outside any class body: {@code name}</li>
 *   <li>classes, at any depth: {@code ClassName}</li>
 *   <li>methods declared directly in a class body: {@code ClassName.method}</li>
 * </ul>
 * Methods of a nested class are registered under the nested class's own name.
 */
public final class SymbolScanner {

    private final SymbolTable symbols;

    public SymbolScanner(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
    }

    public void scan(ParsedSource parsed) {
        Objects.requireNonNull(parsed, "parsed");
        walk(parsed.root(), parsed, 0);
    }

    private void walk(TSNode node, ParsedSource parsed, int classDepth) {
        final String type = node.getType();
        if (CLASS_DEFINITION.equals(type)) {
            registerClass(node, parsed);
            walkChildren(node, parsed, classDepth + 1);
            return;
        }
        if (FUNCTION_DEFINITION.equals(type) && classDepth == 0) {
            final String name = TreeNodes.definitionName(node, parsed.source());
            if (name != null) {
                symbols.register(name, parsed.file());
            }
        }
        walkChildren(node, parsed, classDepth);
    }

    private void walkChildren(TSNode node, ParsedSource parsed, int classDepth) {
        final int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            final TSNode child = node.getNamedChild(i);
            if (TreeNodes.present(child)) {
                walk(child, parsed, classDepth);
            }
        }
    }

    private void registerClass(TSNode classNode, ParsedSource parsed) {
        final String className = TreeNodes.definitionName(classNode, parsed.source());
        if (className == null) {
            return;
        }
        symbols.register(className, parsed.file());

        final TSNode body = TreeNodes.field(classNode, FIELD_BODY);
        if (body == null) {
            return;
        }
        final int count = body.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            final TSNode member = TreeNodes.undecorated(body.getNamedChild(i));
            if (!TreeNodes.is(member, FUNCTION_DEFINITION)) {
                continue;
            }
            final String method = TreeNodes.definitionName(member, parsed.source());
            if (method != null) {
                symbols.register(Ids.qualified(className, method), parsed.file());
            }
        }
    }
}
