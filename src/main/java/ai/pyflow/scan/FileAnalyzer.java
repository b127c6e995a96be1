package ai.pyflow.scan;

import static ai.pyflow.scan.PythonNodeTypes.*;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.TreeSet;

import org.treesitter.TSNode;

import ai.pyflow.graph.SequenceCounter;
import ai.pyflow.graph.SymbolTable;
import ai.pyflow.model.CallEdge;
import ai.pyflow.model.FileRecord;
import ai.pyflow.model.ImportRef;

/**
 * Second pass: walks one file's tree once and resolves its call sites against the frozen
 * symbol table.
 * <p>
 * Resolution is by name only. {@code f()} resolves to {@code f}, {@code a.b.c()} to
 * {@code a.b.c}; calls through call results, subscripts or other expressions are left
 * unresolved. Receiver types are never inferred, so {@code obj.run()} only matches a
 * symbol literally named {@code obj.run}. This is a best-effort approximation, not a
 * sound call graph.
 */
public final class FileAnalyzer {

    private final OutputMarkers outputMarkers;

    public FileAnalyzer(OutputMarkers outputMarkers) {
        this.outputMarkers = Objects.requireNonNull(outputMarkers, "outputMarkers");
    }

    public FileRecord analyze(ParsedSource parsed, SymbolTable symbols, SequenceCounter sequence) {
        Objects.requireNonNull(parsed, "parsed");
        Objects.requireNonNull(symbols, "symbols");
        Objects.requireNonNull(sequence, "sequence");
        if (!symbols.isFrozen()) {
            throw new IllegalStateException("symbol table must be frozen before call resolution");
        }
        final var walk = new Walk(parsed, symbols, sequence);
        walk.visit(parsed.root());
        return walk.toRecord();
    }

    /**
     * Resolves the callee name of a call's function expression, or null when the shape is
     * not an identifier or an identifier-based attribute chain.
     */
    static String calleeName(TSNode function, SourceText source) {
        if (!TreeNodes.present(function)) {
            return null;
        }
        if (IDENTIFIER.equals(function.getType())) {
            return source.slice(function);
        }
        if (!ATTRIBUTE.equals(function.getType())) {
            return null;
        }
        final Deque<String> parts = new ArrayDeque<>();
        TSNode node = function;
        while (TreeNodes.is(node, ATTRIBUTE)) {
            final TSNode attr = TreeNodes.field(node, FIELD_ATTRIBUTE);
            if (attr == null) {
                return null;
            }
            parts.addFirst(source.slice(attr));
            node = TreeNodes.field(node, FIELD_OBJECT);
        }
        if (!TreeNodes.is(node, IDENTIFIER)) {
            return null;
        }
        parts.addFirst(source.slice(node));
        return String.join(".", parts);
    }

    private final class Walk {

        private final ParsedSource parsed;
        private final Path file;
        private final SourceText source;
        private final SymbolTable symbols;
        private final SequenceCounter sequence;

        private final Deque<String> classStack = new ArrayDeque<>();
        private final List<ImportRef> imports = new ArrayList<>();
        private final TreeSet<String> classes = new TreeSet<>();
        private final TreeSet<String> functions = new TreeSet<>();
        private final List<CallEdge> callEdges = new ArrayList<>();
        private final TreeSet<String> outputs = new TreeSet<>();
        private int unresolvedCalls;

        private Walk(ParsedSource parsed, SymbolTable symbols, SequenceCounter sequence) {
            this.parsed = parsed;
            this.file = parsed.file();
            this.source = parsed.source();
            this.symbols = symbols;
            this.sequence = sequence;
        }

        void visit(TSNode node) {
            switch (node.getType()) {
                case IMPORT_STATEMENT -> onImport(node);
                case IMPORT_FROM_STATEMENT -> onImportFrom(node);
                case FUTURE_IMPORT_STATEMENT -> onFutureImport(node);
                case CLASS_DEFINITION -> {
                    onClass(node);
                    return;
                }
                case FUNCTION_DEFINITION -> onFunction(node);
                case CALL -> onCall(node);
                case PRINT_STATEMENT -> onOutput("print");
                default -> {
                }
            }
            visitChildren(node);
        }

        private void visitChildren(TSNode node) {
            final int count = node.getNamedChildCount();
            for (int i = 0; i < count; i++) {
                final TSNode child = node.getNamedChild(i);
                if (TreeNodes.present(child)) {
                    visit(child);
                }
            }
        }

        private void onClass(TSNode node) {
            final String name = TreeNodes.definitionName(node, source);
            if (name == null) {
                visitChildren(node);
                return;
            }
            classes.add(name);
            classStack.push(name);
            try {
                visitChildren(node);
            } finally {
                classStack.pop();
            }
        }

        private void onFunction(TSNode node) {
            if (!classStack.isEmpty()) {
                return;
            }
            final String name = TreeNodes.definitionName(node, source);
            if (name != null) {
                functions.add(name);
            }
        }

        private void onCall(TSNode node) {
            final String name = calleeName(TreeNodes.field(node, FIELD_FUNCTION), source);
            if (name == null || name.isEmpty()) {
                unresolvedCalls++;
                return;
            }
            final Optional<Path> callee = symbols.lookup(name);
            if (callee.isEmpty()) {
                unresolvedCalls++;
            } else if (!callee.get().equals(file)) {
                callEdges.add(new CallEdge(file, callee.get(), name, sequence.next()));
            }
            onOutput(name);
        }

        private void onOutput(String name) {
            if (outputMarkers.contains(name)) {
                outputs.add(name);
            }
        }

        // import a.b, c as d
        private void onImport(TSNode node) {
            final int count = node.getNamedChildCount();
            for (int i = 0; i < count; i++) {
                final String module = importedName(node.getNamedChild(i));
                if (module != null) {
                    imports.add(new ImportRef(file, module));
                }
            }
        }

        // from m import x, y as z / from . import x / from m import *
        private void onImportFrom(TSNode node) {
            final TSNode moduleNode = TreeNodes.field(node, FIELD_MODULE_NAME);
            final String module = moduleNode == null ? "" : moduleName(moduleNode);
            addFromImports(node, moduleNode, module);
        }

        // from __future__ import annotations
        private void onFutureImport(TSNode node) {
            addFromImports(node, null, "__future__");
        }

        private void addFromImports(TSNode statement, TSNode moduleNode, String module) {
            final int count = statement.getNamedChildCount();
            for (int i = 0; i < count; i++) {
                final TSNode child = statement.getNamedChild(i);
                if (!TreeNodes.present(child) || sameNode(child, moduleNode)) {
                    continue;
                }
                final String name = WILDCARD_IMPORT.equals(child.getType()) ? "*" : importedName(child);
                if (name == null) {
                    continue;
                }
                imports.add(new ImportRef(file, module.isEmpty() ? name : module + "." + name));
            }
        }

        private String moduleName(TSNode moduleNode) {
            if (RELATIVE_IMPORT.equals(moduleNode.getType())) {
                // leading dots are dropped: "from ..pkg import x" -> "pkg.x"
                final int count = moduleNode.getNamedChildCount();
                for (int i = 0; i < count; i++) {
                    final TSNode child = moduleNode.getNamedChild(i);
                    if (TreeNodes.is(child, DOTTED_NAME)) {
                        return dotted(child);
                    }
                }
                return "";
            }
            return dotted(moduleNode);
        }

        private String importedName(TSNode node) {
            if (!TreeNodes.present(node)) {
                return null;
            }
            return switch (node.getType()) {
                case DOTTED_NAME -> dotted(node);
                case ALIASED_IMPORT -> {
                    final TSNode name = TreeNodes.field(node, FIELD_NAME);
                    yield name == null ? null : dotted(name);
                }
                default -> null;
            };
        }

        private String dotted(TSNode node) {
            if (!DOTTED_NAME.equals(node.getType())) {
                return source.slice(node).strip();
            }
            final var joiner = new StringJoiner(".");
            final int count = node.getNamedChildCount();
            for (int i = 0; i < count; i++) {
                final TSNode part = node.getNamedChild(i);
                if (TreeNodes.is(part, IDENTIFIER)) {
                    joiner.add(source.slice(part));
                }
            }
            return joiner.toString();
        }

        private boolean sameNode(TSNode a, TSNode b) {
            return b != null
                    && a.getStartByte() == b.getStartByte()
                    && a.getEndByte() == b.getEndByte()
                    && a.getType().equals(b.getType());
        }

        FileRecord toRecord() {
            return new FileRecord(parsed.file(), imports, classes, functions, callEdges, outputs, unresolvedCalls);
        }
    }
}
