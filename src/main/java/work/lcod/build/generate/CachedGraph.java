package work.lcod.build.generate;

import java.util.Objects;
import java.util.Optional;
import work.lcod.build.graph.AssetGraph;

/**
 * Result of looking for a graph persisted by a previous build.
 */
public record CachedGraph(Outcome outcome, Optional<AssetGraph> graph) {
    public enum Outcome {
        /** The graph was read and matches the configured build actions. */
        LOADED,
        /** No graph was persisted. */
        MISSING,
        /** The graph was written by another format version; generated outputs were discarded. */
        VERSION_MISMATCH,
        /** The build actions changed since the graph was written. */
        ACTIONS_CHANGED,
        /** The graph could not be read or parsed. */
        UNREADABLE
    }

    public CachedGraph {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(graph, "graph");
        if (graph.isPresent() != (outcome == Outcome.LOADED)) {
            throw new IllegalArgumentException("A graph is present exactly when the outcome is LOADED");
        }
    }

    static CachedGraph loaded(AssetGraph graph) {
        return new CachedGraph(Outcome.LOADED, Optional.of(graph));
    }

    static CachedGraph none(Outcome outcome) {
        return new CachedGraph(outcome, Optional.empty());
    }
}
