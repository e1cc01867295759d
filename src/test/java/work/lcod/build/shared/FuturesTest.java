package work.lcod.build.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class FuturesTest {
    @Test
    void returnsResultsInSubmissionOrder() {
        var pool = Executors.newFixedThreadPool(2);
        try {
            var gate = new CountDownLatch(1);
            var slow = CompletableFuture.supplyAsync(() -> {
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                return "slow";
            }, pool);
            var fast = CompletableFuture.supplyAsync(() -> {
                gate.countDown();
                return "fast";
            }, pool);

            assertEquals(List.of("slow", "fast"), Futures.joinAll(List.of(slow, fast)));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rethrowsTheUnderlyingFailure() {
        var failure = new IllegalArgumentException("boom");
        CompletableFuture<String> failed = CompletableFuture.failedFuture(failure);
        var thrown = assertThrows(IllegalArgumentException.class,
            () -> Futures.joinAll(List.of(CompletableFuture.completedFuture("ok"), failed)));
        assertSame(failure, thrown);
    }

    @Test
    void emptyFanOutIsEmpty() {
        assertEquals(List.of(), Futures.<String>joinAll(List.of()));
    }
}
