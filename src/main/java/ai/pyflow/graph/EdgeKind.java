package ai.pyflow.graph;

public enum EdgeKind {
    IMPORTS,
    CALLS
}
