package com.ryuqq.jobpool.testkit.contract;

import com.ryuqq.jobpool.adapter.runner.WorkerPoolConfig;
import com.ryuqq.jobpool.core.job.AsyncJob;
import com.ryuqq.jobpool.core.job.AsyncStreamingJob;
import com.ryuqq.jobpool.core.job.SyncJob;
import com.ryuqq.jobpool.core.job.SyncStreamingJob;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test for the concurrency bound.
 *
 * <p>At most workerCount envelopes run at once, whatever their execution modes.</p>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
class ConcurrencyContractTest extends AbstractEngineContractTest {

    private static final int WORKER_COUNT = 3;

    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();

    @Override
    protected WorkerPoolConfig poolConfig() {
        return new WorkerPoolConfig().withWorkerCount(WORKER_COUNT);
    }

    @Test
    void testConcurrencyBound_MixedModes_NeverExceedsWorkerCount() {
        // Given
        int rounds = 10;
        CallbackRecorder<Integer> recorder = new CallbackRecorder<>();

        // When
        for (int i = 0; i < rounds; i++) {
            SyncJob<Integer> sync = token -> tracked(() -> 1);
            AsyncJob<Integer> async = token -> CompletableFuture.supplyAsync(() -> tracked(() -> 2));
            SyncStreamingJob<Integer> streaming = (sink, token) -> sink.emit(tracked(() -> 3));
            AsyncStreamingJob<Integer> asyncStreaming = (sink, token) ->
                CompletableFuture.runAsync(() -> sink.emit(tracked(() -> 4)));

            pool.submit(sync, recorder.oneShot());
            pool.submit(async, recorder.oneShot());
            pool.submitStreaming(streaming, recorder.streaming());
            pool.submitStreaming(asyncStreaming, recorder.streaming());
        }
        drainUntil(() -> recorder.terminalCount() == rounds * 4);

        // Then
        assertThat(maxRunning.get()).isBetween(1, WORKER_COUNT);
        assertThat(recorder.errors()).isEmpty();
        assertThat(pool.stats().activeWorkers()).isLessThanOrEqualTo(WORKER_COUNT);
    }

    @Test
    void testStats_ActiveWorkersNeverExceedPoolSize() {
        // Given
        CallbackRecorder<Integer> recorder = new CallbackRecorder<>();
        for (int i = 0; i < 30; i++) {
            SyncJob<Integer> job = token -> tracked(() -> 0);
            pool.submit(job, recorder.oneShot());
        }

        // When & Then
        drainUntil(() -> {
            assertThat(pool.stats().activeWorkers()).isLessThanOrEqualTo(pool.stats().poolSize());
            return recorder.terminalCount() == 30;
        });
        assertThat(pool.stats().poolSize()).isEqualTo(WORKER_COUNT);
    }

    private int tracked(IntSupplier body) {
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        try {
            sleep(5);
            return body.getAsInt();
        } finally {
            running.decrementAndGet();
        }
    }
}
