package work.lcod.build.graph;

/**
 * Why an asset needs attention since the last build.
 */
public enum ChangeType {
    ADDED,
    REMOVED,
    MODIFIED
}
