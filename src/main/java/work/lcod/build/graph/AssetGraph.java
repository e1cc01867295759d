package work.lcod.build.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import work.lcod.build.asset.AssetId;
import work.lcod.build.asset.AssetReader;
import work.lcod.build.asset.Digest;
import work.lcod.build.config.BuildAction;
import work.lcod.build.config.BuildActionsDigest;
import work.lcod.build.packages.PackageGraph;
import work.lcod.build.shared.BuildPaths;

/**
 * Every asset known to a build, the outputs each phase declares, and the digests seen by the last build.
 *
 * <p>Not thread-safe: one preparation pass owns the graph.
 */
public final class AssetGraph {
    /** Bumped whenever the serialized layout changes; older graphs are discarded, never migrated. */
    public static final int VERSION = 1;

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Map<AssetId, AssetNode> nodes = new LinkedHashMap<>();
    private final Digest buildActionsDigest;

    AssetGraph(Digest buildActionsDigest) {
        this.buildActionsDigest = Objects.requireNonNull(buildActionsDigest, "buildActionsDigest");
    }

    /**
     * Deletes one asset on behalf of the graph.
     */
    @FunctionalInterface
    public interface DeleteCallback {
        void delete(AssetId id) throws IOException;
    }

    public static AssetId builderOptionsIdForPhase(String packageName, int phase) {
        return new AssetId(packageName, "Phase" + phase + ".builderOptions");
    }

    /**
     * Builds a graph from scratch for the given actions and the sources currently on disk.
     */
    public static AssetGraph build(
        List<BuildAction> actions,
        Set<AssetId> inputSources,
        Set<AssetId> internalSources,
        PackageGraph packageGraph,
        AssetReader reader
    ) throws IOException {
        var graph = new AssetGraph(BuildActionsDigest.compute(actions));
        String rootPackage = packageGraph.root().name();
        for (AssetId id : new TreeSet<>(internalSources)) {
            graph.add(new InternalAssetNode(id, Optional.of(reader.digest(id))));
        }
        for (AssetId id : new TreeSet<>(inputSources)) {
            Optional<Digest> digest = BuildPaths.isBuildScriptInput(id, rootPackage)
                ? Optional.of(reader.digest(id))
                : Optional.empty();
            graph.add(new SourceAssetNode(id, digest));
        }
        for (int phase = 0; phase < actions.size(); phase++) {
            BuildAction action = actions.get(phase);
            graph.add(new BuilderOptionsAssetNode(
                builderOptionsIdForPhase(action.packageName(), phase),
                Optional.of(action.builderOptions().digest()),
                phase
            ));
        }
        graph.addOutputs(actions, new TreeSet<>(inputSources));
        graph.hashPrimaryInputs(inputSources, reader);
        return graph;
    }

    public static AssetGraph deserialize(byte[] bytes) throws IOException {
        JsonNode root = JSON.readTree(bytes);
        if (root == null || !root.isObject()) {
            throw new IOException("Asset graph must be a JSON object");
        }
        int version = root.path("version").asInt(-1);
        if (version != VERSION) {
            throw new AssetGraphVersionException(version, VERSION);
        }
        String actionsDigest = root.path("buildActionsDigest").asText("");
        if (actionsDigest.isBlank()) {
            throw new IOException("Asset graph is missing its build actions digest");
        }
        try {
            var graph = new AssetGraph(new Digest(actionsDigest));
            for (JsonNode record : root.path("nodes")) {
                graph.add(readNode(record));
            }
            return graph;
        } catch (IllegalArgumentException ex) {
            throw new IOException("Malformed asset graph: " + ex.getMessage(), ex);
        }
    }

    public byte[] serialize() throws IOException {
        ObjectNode root = JSON.createObjectNode();
        root.put("version", VERSION);
        root.put("buildActionsDigest", buildActionsDigest.hex());
        ArrayNode array = root.putArray("nodes");
        for (AssetId id : new TreeSet<>(nodes.keySet())) {
            writeNode(array.addObject(), nodes.get(id));
        }
        return JSON.writerWithDefaultPrettyPrinter().writeValueAsBytes(root);
    }

    public Digest buildActionsDigest() {
        return buildActionsDigest;
    }

    public Optional<AssetNode> get(AssetId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(AssetId id) {
        return nodes.containsKey(id);
    }

    public Collection<AssetNode> allNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /** Ids of all user supplied source nodes. */
    public Set<AssetId> sources() {
        return nodes.values().stream()
            .filter(SourceAssetNode.class::isInstance)
            .map(AssetNode::id)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Ids of all declared outputs. */
    public Set<AssetId> outputs() {
        return nodes.values().stream()
            .filter(GeneratedAssetNode.class::isInstance)
            .map(AssetNode::id)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    void add(AssetNode node) {
        if (nodes.putIfAbsent(node.id(), node) != null) {
            throw new IllegalStateException("Duplicate asset node: " + node.id());
        }
    }

    /**
     * Applies a change map: adds and removes nodes, refreshes source digests and marks affected outputs as needing
     * an update. Outputs of removed sources that were actually written are deleted through {@code deleteCallback}.
     */
    public void updateAndInvalidate(
        List<BuildAction> actions,
        Map<AssetId, ChangeType> updates,
        String rootPackage,
        DeleteCallback deleteCallback,
        AssetReader reader
    ) throws IOException {
        Set<AssetId> added = new TreeSet<>();
        Set<AssetId> invalidated = new LinkedHashSet<>();
        for (var entry : updates.entrySet()) {
            AssetId id = entry.getKey();
            AssetNode node = nodes.get(id);
            switch (entry.getValue()) {
                case ADDED -> {
                    if (node == null) {
                        Optional<Digest> digest = BuildPaths.isBuildScriptInput(id, rootPackage)
                            ? Optional.of(reader.digest(id))
                            : Optional.empty();
                        nodes.put(id, new SourceAssetNode(id, digest));
                        added.add(id);
                    }
                }
                case REMOVED -> {
                    if (node instanceof GeneratedAssetNode generated) {
                        generated.setWasOutput(false);
                        generated.setLastKnownDigest(Optional.empty());
                        invalidated.add(id);
                    } else if (node != null) {
                        removeWithOutputs(id, deleteCallback);
                    }
                }
                case MODIFIED -> {
                    if (node instanceof BuilderOptionsAssetNode options) {
                        nodes.values().stream()
                            .filter(GeneratedAssetNode.class::isInstance)
                            .map(GeneratedAssetNode.class::cast)
                            .filter(generated -> generated.phaseNumber() == options.phaseNumber())
                            .forEach(generated -> invalidated.add(generated.id()));
                    } else if (node instanceof SourceAssetNode || node instanceof InternalAssetNode) {
                        node.setLastKnownDigest(Optional.of(reader.digest(id)));
                        invalidated.add(id);
                    } else if (node != null) {
                        invalidated.add(id);
                    }
                }
                default -> throw new IllegalStateException("Unhandled change type " + entry.getValue());
            }
        }
        invalidated.addAll(addOutputs(actions, added));
        hashPrimaryInputs(added, reader);
        markNeedsUpdate(invalidated);
    }

    /**
     * Records the current digest of every source among {@code candidates} that is the primary input of an output,
     * so a later edit to it shows up as {@code MODIFIED}.
     */
    private void hashPrimaryInputs(Collection<AssetId> candidates, AssetReader reader) throws IOException {
        Set<AssetId> primaryInputs = nodes.values().stream()
            .filter(GeneratedAssetNode.class::isInstance)
            .map(node -> ((GeneratedAssetNode) node).primaryInput())
            .collect(Collectors.toSet());
        for (AssetId id : new TreeSet<>(candidates)) {
            AssetNode node = nodes.get(id);
            if (node instanceof SourceAssetNode && node.lastKnownDigest().isEmpty() && primaryInputs.contains(id)) {
                node.setLastKnownDigest(Optional.of(reader.digest(id)));
            }
        }
    }

    /**
     * Declares the outputs of every phase for {@code newInputs}, chaining outputs into later phases.
     */
    private Set<AssetId> addOutputs(List<BuildAction> actions, Collection<AssetId> newInputs) {
        Set<AssetId> pending = new LinkedHashSet<>(newInputs);
        Set<AssetId> added = new LinkedHashSet<>();
        for (int phase = 0; phase < actions.size(); phase++) {
            BuildAction action = actions.get(phase);
            List<AssetId> candidates = new ArrayList<>();
            for (AssetId id : pending) {
                if (isInputForPhase(id, phase) && action.matchesInput(id)) {
                    candidates.add(id);
                }
            }
            Set<AssetId> declared = new LinkedHashSet<>();
            candidates.forEach(candidate -> declared.addAll(action.expectedOutputs(candidate)));
            candidates.removeIf(declared::contains);

            for (AssetId input : candidates) {
                for (AssetId output : action.expectedOutputs(input)) {
                    AssetNode existing = nodes.get(output);
                    if (existing != null && !(existing instanceof SourceAssetNode)) {
                        continue;
                    }
                    nodes.put(output, new GeneratedAssetNode(
                        output, Optional.empty(), phase, input, action.hideOutput(), false, true));
                    added.add(output);
                }
            }
            pending.addAll(added);
        }
        return added;
    }

    private boolean isInputForPhase(AssetId id, int phase) {
        AssetNode node = nodes.get(id);
        if (node instanceof GeneratedAssetNode generated) {
            return generated.phaseNumber() < phase;
        }
        return node != null && node.isValidInput();
    }

    private void removeWithOutputs(AssetId id, DeleteCallback deleteCallback) throws IOException {
        Deque<AssetId> queue = new ArrayDeque<>();
        queue.add(id);
        while (!queue.isEmpty()) {
            AssetId current = queue.poll();
            for (GeneratedAssetNode output : outputsOf(current)) {
                if (output.wasOutput()) {
                    deleteCallback.delete(output.id());
                }
                queue.add(output.id());
            }
            nodes.remove(current);
        }
    }

    private void markNeedsUpdate(Set<AssetId> roots) {
        Deque<AssetId> queue = new ArrayDeque<>(roots);
        Set<AssetId> seen = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            AssetId current = queue.poll();
            if (!seen.add(current)) {
                continue;
            }
            if (nodes.get(current) instanceof GeneratedAssetNode generated) {
                generated.setNeedsUpdate(true);
            }
            outputsOf(current).forEach(output -> queue.add(output.id()));
        }
    }

    private List<GeneratedAssetNode> outputsOf(AssetId primaryInput) {
        List<GeneratedAssetNode> outputs = new ArrayList<>();
        for (AssetNode node : nodes.values()) {
            if (node instanceof GeneratedAssetNode generated && generated.primaryInput().equals(primaryInput)) {
                outputs.add(generated);
            }
        }
        return outputs;
    }

    private static void writeNode(ObjectNode record, AssetNode node) {
        record.put("id", node.id().toString());
        node.lastKnownDigest().ifPresent(digest -> record.put("digest", digest.hex()));
        if (node instanceof SourceAssetNode) {
            record.put("type", "source");
        } else if (node instanceof InternalAssetNode) {
            record.put("type", "internal");
        } else if (node instanceof BuilderOptionsAssetNode options) {
            record.put("type", "builderOptions");
            record.put("phase", options.phaseNumber());
        } else if (node instanceof GeneratedAssetNode generated) {
            record.put("type", "generated");
            record.put("phase", generated.phaseNumber());
            record.put("primaryInput", generated.primaryInput().toString());
            record.put("hidden", generated.isHidden());
            record.put("wasOutput", generated.wasOutput());
            record.put("needsUpdate", generated.needsUpdate());
        }
    }

    private static AssetNode readNode(JsonNode record) throws IOException {
        AssetId id = AssetId.parse(record.path("id").asText(null));
        Optional<Digest> digest = record.hasNonNull("digest")
            ? Optional.of(new Digest(record.get("digest").asText()))
            : Optional.empty();
        String type = record.path("type").asText("");
        switch (type) {
            case "source":
                return new SourceAssetNode(id, digest);
            case "internal":
                return new InternalAssetNode(id, digest);
            case "builderOptions":
                return new BuilderOptionsAssetNode(id, digest, record.path("phase").asInt());
            case "generated":
                return new GeneratedAssetNode(
                    id,
                    digest,
                    record.path("phase").asInt(),
                    AssetId.parse(record.path("primaryInput").asText(null)),
                    record.path("hidden").asBoolean(false),
                    record.path("wasOutput").asBoolean(false),
                    record.path("needsUpdate").asBoolean(false)
                );
            default:
                throw new IOException("Unknown asset node type '" + type + "' for " + id);
        }
    }
}
