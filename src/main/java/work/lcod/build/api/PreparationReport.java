package work.lcod.build.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.build.asset.AssetId;
import work.lcod.build.graph.ChangeType;

/**
 * Outcome of a {@link PreparationRunner} pass: a {@link Summary} when the workspace is ready, a {@link Failure}
 * otherwise.
 */
public record PreparationReport(
    Path rootDirectory,
    Optional<Summary> summary,
    Optional<Failure> failure,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectMapper JSON = new ObjectMapper();

    public PreparationReport {
        Objects.requireNonNull(rootDirectory, "rootDirectory");
        if (summary.isPresent() == failure.isPresent()) {
            throw new IllegalArgumentException("A report carries either a summary or a failure");
        }
    }

    public static PreparationReport success(Path rootDirectory, Summary summary, Instant startedAt) {
        return new PreparationReport(rootDirectory, Optional.of(summary), Optional.empty(), startedAt, Instant.now());
    }

    public static PreparationReport failure(Path rootDirectory, Failure failure, Instant startedAt) {
        return new PreparationReport(rootDirectory, Optional.empty(), Optional.of(failure), startedAt, Instant.now());
    }

    public Status status() {
        return failure.isPresent() ? Status.FAILURE : Status.SUCCESS;
    }

    public String toPrettyJson() {
        ObjectNode root = JSON.createObjectNode();
        root.put("status", status().name().toLowerCase());
        root.put("rootDirectory", rootDirectory.toString());
        summary.ifPresent(value -> writeSummary(root.putObject("summary"), value));
        failure.ifPresent(value -> writeFailure(root.putObject("failure"), value));
        root.put("startedAt", startedAt.toString());
        root.put("finishedAt", finishedAt.toString());
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to render preparation report", ex);
        }
    }

    private static void writeSummary(ObjectNode node, Summary summary) {
        node.put("rootPackage", summary.rootPackage());
        node.put("buildActions", summary.buildActions());
        node.put("fromCache", summary.fromCache());
        ObjectNode changes = node.putObject("changes");
        changes.put("added", summary.changes().added());
        changes.put("removed", summary.changes().removed());
        changes.put("modified", summary.changes().modified());
        node.put("nodes", summary.nodes());
        node.put("outputs", summary.outputs());
        ArrayNode deleted = node.putArray("deleted");
        summary.deleted().forEach(id -> deleted.add(id.toString()));
    }

    private static void writeFailure(ObjectNode node, Failure failure) {
        node.put("reason", failure.reason().name().toLowerCase());
        node.put("message", failure.message());
        if (!failure.conflictingOutputs().isEmpty()) {
            ArrayNode conflicts = node.putArray("conflictingOutputs");
            failure.conflictingOutputs().forEach(id -> conflicts.add(id.toString()));
            node.put("deletable", failure.deletable());
        }
        failure.buildAction().ifPresent(action -> node.put("buildAction", action));
    }

    /**
     * What a successful pass found and did.
     */
    public record Summary(
        String rootPackage,
        int buildActions,
        boolean fromCache,
        ChangeCounts changes,
        int nodes,
        int outputs,
        List<AssetId> deleted
    ) {
        public Summary {
            deleted = List.copyOf(deleted);
        }
    }

    public record ChangeCounts(int added, int removed, int modified) {
        public static ChangeCounts of(Map<AssetId, ChangeType> updates) {
            int added = 0;
            int removed = 0;
            int modified = 0;
            for (ChangeType type : updates.values()) {
                switch (type) {
                    case ADDED -> added++;
                    case REMOVED -> removed++;
                    case MODIFIED -> modified++;
                    default -> throw new IllegalStateException("Unhandled change type " + type);
                }
            }
            return new ChangeCounts(added, removed, modified);
        }

        public int total() {
            return added + removed + modified;
        }
    }

    /**
     * Why a pass stopped before the workspace was ready.
     *
     * @param conflictingOutputs outputs already on disk, empty unless {@code reason} is {@link Reason#CONFLICTING_OUTPUTS}
     * @param deletable whether {@code --delete-conflicting-outputs} would clear the conflicts
     * @param buildAction the rejected action, for {@link Reason#INVALID_BUILD_ACTION}
     */
    public record Failure(
        Reason reason,
        String message,
        List<AssetId> conflictingOutputs,
        boolean deletable,
        Optional<String> buildAction
    ) {
        public Failure {
            conflictingOutputs = List.copyOf(conflictingOutputs);
        }

        public static Failure of(Reason reason, String message) {
            return new Failure(reason, message, List.of(), false, Optional.empty());
        }
    }

    public enum Reason {
        CONFLICTING_OUTPUTS,
        INVALID_BUILD_ACTION,
        WORKSPACE
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
