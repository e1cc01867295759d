package work.lcod.build.shared;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.Callable;
import org.slf4j.Logger;

/**
 * Timing helpers shared by the preparation steps.
 */
public final class Logging {
    private Logging() {}

    public static <T> T logTimed(Logger logger, String description, Callable<T> action) {
        logger.info(description);
        long started = System.nanoTime();
        try {
            T result = action.call();
            logger.info("{} completed, took {}ms", description, elapsedMs(started));
            return result;
        } catch (RuntimeException ex) {
            logger.warn("{} failed after {}ms", description, elapsedMs(started));
            throw ex;
        } catch (IOException ex) {
            logger.warn("{} failed after {}ms", description, elapsedMs(started));
            throw new UncheckedIOException(description + " failed: " + ex.getMessage(), ex);
        } catch (Exception ex) {
            logger.warn("{} failed after {}ms", description, elapsedMs(started));
            throw new IllegalStateException(description + " failed: " + ex.getMessage(), ex);
        }
    }

    private static long elapsedMs(long started) {
        return (System.nanoTime() - started) / 1_000_000L;
    }

    public static void runTimed(Logger logger, String description, ThrowingRunnable action) {
        logTimed(logger, description, () -> {
            action.run();
            return null;
        });
    }

    @FunctionalInterface
    public interface ThrowingRunnable {
        void run() throws Exception;
    }
}
