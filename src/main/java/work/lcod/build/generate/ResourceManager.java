package work.lcod.build.generate;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Owns resources that live as long as one build, released in reverse registration order.
 */
public final class ResourceManager {
    private final Deque<AutoCloseable> resources = new ArrayDeque<>();

    public synchronized <T extends AutoCloseable> T register(T resource) {
        resources.push(resource);
        return resource;
    }

    public synchronized int size() {
        return resources.size();
    }

    /**
     * Closes everything registered so far. All resources are closed even if some fail; the failures are reported
     * together afterwards.
     */
    public synchronized void disposeAll() {
        IllegalStateException failure = null;
        while (!resources.isEmpty()) {
            AutoCloseable resource = resources.pop();
            try {
                resource.close();
            } catch (Exception ex) {
                if (failure == null) {
                    failure = new IllegalStateException("Failed to release build resources");
                }
                failure.addSuppressed(ex);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
