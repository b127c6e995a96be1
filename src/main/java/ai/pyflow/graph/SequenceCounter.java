package ai.pyflow.graph;

/**
 * Run-wide call sequence. One instance per run, passed explicitly through file analysis.
 * Not thread-safe: files are analyzed one after another.
 */
public final class SequenceCounter {

    private int last;

    public int next() {
        return ++last;
    }
}
