package work.lcod.build.generate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.AssetReader;
import work.lcod.build.asset.Digest;
import work.lcod.build.config.BuildAction;
import work.lcod.build.graph.AssetGraph;
import work.lcod.build.graph.AssetNode;
import work.lcod.build.graph.BuilderOptionsAssetNode;
import work.lcod.build.graph.ChangeType;
import work.lcod.build.shared.Futures;

/**
 * Diffs the assets on disk and the configured builder options against what a cached graph last saw.
 */
public final class ChangeDetector {
    private final AssetReader reader;
    private final Executor executor;

    public ChangeDetector(AssetReader reader, Executor executor) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Source changes merged with builder options changes; the latter win on the same id.
     */
    public Map<AssetId, ChangeType> detectChanges(AssetGraph graph, List<BuildAction> buildActions, SourceSnapshot sources) {
        Map<AssetId, ChangeType> updates = findSourceUpdates(graph, sources);
        updates.putAll(computeBuilderOptionsUpdates(graph, buildActions));
        return updates;
    }

    /**
     * Changes that happened on disk, unobserved, since the graph was written.
     */
    public Map<AssetId, ChangeType> findSourceUpdates(AssetGraph graph, SourceSnapshot sources) {
        Set<AssetId> allSources = sources.allSources();
        Map<AssetId, ChangeType> updates = new LinkedHashMap<>();

        Set<AssetId> knownInputs = new LinkedHashSet<>();
        for (AssetNode node : graph.allNodes()) {
            if (node.isValidInput()) {
                knownInputs.add(node.id());
            }
        }
        for (AssetId id : sources.inputSources()) {
            if (!knownInputs.contains(id)) {
                updates.put(id, ChangeType.ADDED);
            }
        }

        for (AssetNode node : graph.allNodes()) {
            if (isRemovalCandidate(node) && !allSources.contains(node.id())) {
                updates.put(node.id(), ChangeType.REMOVED);
            }
        }

        Set<AssetId> preExistingSources = new LinkedHashSet<>(graph.sources());
        preExistingSources.retainAll(sources.inputSources());
        for (AssetId id : sources.internalSources()) {
            if (graph.contains(id)) {
                preExistingSources.add(id);
            }
        }
        for (AssetId modified : findModified(graph, preExistingSources)) {
            updates.put(modified, ChangeType.MODIFIED);
        }
        return updates;
    }

    /**
     * Compares each phase's options digest with the one stored in the graph and refreshes the stored digest.
     */
    public Map<AssetId, ChangeType> computeBuilderOptionsUpdates(AssetGraph graph, List<BuildAction> buildActions) {
        Map<AssetId, ChangeType> result = new LinkedHashMap<>();
        for (int phase = 0; phase < buildActions.size(); phase++) {
            BuildAction action = buildActions.get(phase);
            AssetId optionsId = AssetGraph.builderOptionsIdForPhase(action.packageName(), phase);
            AssetNode node = graph.get(optionsId)
                .orElseThrow(() -> new IllegalStateException(
                    "Asset graph has no builder options node " + optionsId + " for phase " + action));
            if (!(node instanceof BuilderOptionsAssetNode optionsNode)) {
                throw new IllegalStateException("Expected builder options node for " + optionsId + " but found " + node);
            }
            Optional<Digest> oldDigest = optionsNode.lastKnownDigest();
            Optional<Digest> newDigest = Optional.of(action.builderOptions().digest());
            optionsNode.setLastKnownDigest(newDigest);
            if (!newDigest.equals(oldDigest)) {
                result.put(optionsId, ChangeType.MODIFIED);
            }
        }
        return result;
    }

    /** Only readable nodes can go missing; generated outputs are readable once written. */
    private static boolean isRemovalCandidate(AssetNode node) {
        return node.isReadable();
    }

    private List<AssetId> findModified(AssetGraph graph, Set<AssetId> candidates) {
        List<CompletableFuture<Optional<AssetId>>> checks = new ArrayList<>();
        for (AssetId id : candidates) {
            AssetNode node = graph.get(id)
                .orElseThrow(() -> new IllegalStateException("Asset graph lost track of " + id));
            Optional<Digest> originalDigest = node.lastKnownDigest();
            if (originalDigest.isEmpty()) {
                continue;
            }
            checks.add(CompletableFuture.supplyAsync(() -> {
                Digest currentDigest = currentDigest(id);
                return currentDigest.equals(originalDigest.get()) ? Optional.<AssetId>empty() : Optional.of(id);
            }, executor));
        }
        List<AssetId> modified = new ArrayList<>();
        for (Optional<AssetId> result : Futures.joinAll(checks)) {
            result.ifPresent(modified::add);
        }
        return modified;
    }

    private Digest currentDigest(AssetId id) {
        try {
            return reader.digest(id);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to compute digest of " + id, ex);
        }
    }
}
