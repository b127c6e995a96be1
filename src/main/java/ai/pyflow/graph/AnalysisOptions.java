package ai.pyflow.graph;

import java.util.Objects;

import ai.pyflow.scan.OutputMarkers;

/**
 * Knobs for one run.
 */
public record AnalysisOptions(
        boolean sequenced,
        CollisionPolicy collisionPolicy,
        OutputMarkers outputMarkers
) {
    public AnalysisOptions {
        Objects.requireNonNull(collisionPolicy, "collisionPolicy");
        Objects.requireNonNull(outputMarkers, "outputMarkers");
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(false, CollisionPolicy.LAST_WINS, OutputMarkers.defaults());
    }

    public AnalysisOptions withSequenced(boolean value) {
        return new AnalysisOptions(value, collisionPolicy, outputMarkers);
    }

    public AnalysisOptions withCollisionPolicy(CollisionPolicy value) {
        return new AnalysisOptions(sequenced, value, outputMarkers);
    }

    public AnalysisOptions withOutputMarkers(OutputMarkers value) {
        return new AnalysisOptions(sequenced, collisionPolicy, value);
    }
}
