package com.ryuqq.jobpool.testkit.contract;

import com.ryuqq.jobpool.adapter.runner.WorkerPoolConfig;
import com.ryuqq.jobpool.application.engine.SubmissionHandle;
import com.ryuqq.jobpool.core.exception.JobCancelledException;
import com.ryuqq.jobpool.core.job.SyncJob;
import com.ryuqq.jobpool.core.job.SyncStreamingJob;
import com.ryuqq.jobpool.core.model.JobId;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test for cancellation.
 *
 * <ul>
 *   <li>Cancelled while queued: never executed, no callback by default</li>
 *   <li>Cancelled while queued with cancellation notice: onError(JobCancelledException)</li>
 *   <li>Cancelled while running: only cooperative jobs stop, reported through onError</li>
 *   <li>Unknown or finished ids: cancel returns false</li>
 * </ul>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractEngineContractTest {

    private CountDownLatch release;

    @Override
    protected WorkerPoolConfig poolConfig() {
        return new WorkerPoolConfig().withWorkerCount(1);
    }

    @Test
    void testCancelQueued_NeverExecutedAndSilent() throws Exception {
        // Given
        occupyWorker();
        AtomicBoolean executed = new AtomicBoolean(false);
        CallbackRecorder<Integer> recorder = new CallbackRecorder<>();
        SyncJob<Integer> job = token -> {
            executed.set(true);
            return 1;
        };
        SubmissionHandle handle = pool.submit(job, recorder.all());

        // When
        boolean cancelled = pool.cancel(handle.getJobIdOrNull());
        release.countDown();
        drainUntil(() -> pool.stats().activeWorkers() == 0 && pool.stats().queuedJobs() == 0);
        pool.drain();

        // Then
        assertThat(cancelled).isTrue();
        assertThat(executed).isFalse();
        assertThat(recorder.events()).isEmpty();
        assertThat(pool.isJobActive(handle.getJobIdOrNull())).isFalse();
    }

    @Test
    void testCancelQueued_WithCancellationNotice_OnErrorReceivesCancellation() throws Exception {
        // Given
        occupyWorker();
        CallbackRecorder<Integer> recorder = new CallbackRecorder<>();
        SyncJob<Integer> job = token -> 1;
        SubmissionHandle handle = pool.submit(job, recorder.oneShot().withCancellationNotice());

        // When
        pool.cancel(handle.getJobIdOrNull());
        release.countDown();
        drainUntil(() -> recorder.terminalCount() == 1);

        // Then
        assertThat(recorder.errors()).hasSize(1);
        assertThat(recorder.errors().get(0)).isInstanceOf(JobCancelledException.class);
        assertThat(recorder.results()).isEmpty();
        assertThat(recorder.completions()).isZero();
    }

    @Test
    void testCancelRunning_CooperativeStreamingJob_StopsWithError() {
        // Given
        CountDownLatch started = new CountDownLatch(1);
        CallbackRecorder<Integer> recorder = new CallbackRecorder<>();
        SyncStreamingJob<Integer> job = (sink, token) -> {
            int i = 0;
            while (true) {
                token.throwIfCancellationRequested();
                sink.emit(i++);
                started.countDown();
                Thread.sleep(2);
            }
        };
        SubmissionHandle handle = pool.submitStreaming(job, recorder.streaming());
        awaitCondition(() -> started.getCount() == 0);

        // When
        boolean cancelled = pool.cancel(handle.getJobIdOrNull());
        drainUntil(() -> recorder.terminalCount() == 1);

        // Then
        assertThat(cancelled).isTrue();
        assertThat(recorder.errors()).hasSize(1);
        assertThat(recorder.errors().get(0)).isInstanceOf(JobCancelledException.class);
        assertThat(recorder.completions()).isZero();
        assertThat(recorder.progress()).isNotEmpty();
    }

    @Test
    void testCancelRunning_NonCooperativeJob_CompletesNormally() throws Exception {
        // Given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        CallbackRecorder<Integer> recorder = new CallbackRecorder<>();
        SyncJob<Integer> job = token -> {
            started.countDown();
            await(proceed);
            return 9;
        };
        SubmissionHandle handle = pool.submit(job, recorder.oneShot());
        awaitCondition(() -> started.getCount() == 0);

        // When
        boolean cancelled = pool.cancel(handle.getJobIdOrNull());
        proceed.countDown();
        drainUntil(() -> recorder.terminalCount() == 1);

        // Then
        assertThat(cancelled).isTrue();
        assertThat(recorder.results()).containsExactly(9);
        assertThat(recorder.errors()).isEmpty();
    }

    @Test
    void testCancel_UnknownOrFinishedJob_ReturnsFalse() {
        // Given
        CallbackRecorder<Integer> recorder = new CallbackRecorder<>();
        SyncJob<Integer> job = token -> 1;
        SubmissionHandle handle = pool.submit(job, recorder.oneShot());
        drainUntil(() -> recorder.terminalCount() == 1);

        // When & Then
        assertThat(pool.cancel(handle.getJobIdOrNull())).isFalse();
        assertThat(pool.cancel(JobId.of("unknown-job"))).isFalse();
        assertThat(pool.cancel(null)).isFalse();
    }

    private void occupyWorker() {
        release = new CountDownLatch(1);
        SyncJob<Integer> blocker = token -> {
            await(release);
            return 0;
        };
        pool.submit(blocker, null, null);
        awaitCondition(() -> pool.stats().activeWorkers() == 1);
    }
}
