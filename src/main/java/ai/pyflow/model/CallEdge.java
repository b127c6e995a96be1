package ai.pyflow.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Cross-file call found at one call site.
 * <p>
 * sequence: run-wide discovery stamp, strictly increasing in visit order.
 * It approximates discovery order only; branches, loops and recursion are not modeled.
 */
public record CallEdge(
        Path caller,
        Path callee,
        String name,     // resolved callee name, e.g. "helper" or "Worker.run"
        int sequence
) {
    public CallEdge {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(callee, "callee");
        Objects.requireNonNull(name, "name");
        if (caller.equals(callee)) {
            throw new IllegalArgumentException("self call edge: " + caller);
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive: " + sequence);
        }
    }
}
