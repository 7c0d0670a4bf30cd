package com.ryuqq.jobpool.core.contract;

import com.ryuqq.jobpool.core.cancel.CancellationToken;
import com.ryuqq.jobpool.core.exception.JobCancelledException;
import com.ryuqq.jobpool.core.job.AsyncJob;
import com.ryuqq.jobpool.core.job.AsyncStreamingJob;
import com.ryuqq.jobpool.core.job.ExecutionMode;
import com.ryuqq.jobpool.core.job.Job;
import com.ryuqq.jobpool.core.job.OneShotJob;
import com.ryuqq.jobpool.core.job.ProgressSink;
import com.ryuqq.jobpool.core.job.StreamingJob;
import com.ryuqq.jobpool.core.job.SyncJob;
import com.ryuqq.jobpool.core.job.SyncStreamingJob;
import com.ryuqq.jobpool.core.model.JobId;
import com.ryuqq.jobpool.core.outcome.Done;
import com.ryuqq.jobpool.core.outcome.Fail;
import com.ryuqq.jobpool.core.outcome.FailureKind;
import com.ryuqq.jobpool.core.outcome.Ok;
import com.ryuqq.jobpool.core.outcome.Outcome;
import com.ryuqq.jobpool.core.outcome.Progress;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Job 실행을 위한 봉투 (Envelope).
 *
 * <p>Envelope은 Job에 JobId, 생성 시각, 제출자 콜백을 묶은 실행 단위입니다.
 * Worker는 타입이 서로 다른 Envelope을 하나의 큐에 담고 {@link #execute}만 호출합니다.
 * 실행 형태별 분기와 콜백 타입 결정은 Envelope 안에서 끝납니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>id:</strong> 제출 시 생성된 JobId (취소 조회 키)</li>
 *   <li><strong>createdAt:</strong> 생성 시각 (epoch milliseconds, 진단용)</li>
 *   <li><strong>job:</strong> 실행할 Job (실행 형태 포함)</li>
 *   <li><strong>callbacks:</strong> 제출자 콜백</li>
 * </ul>
 *
 * <p><strong>종료 보장:</strong> 실행된 Envelope마다 종료 Outcome(Ok, Done, Fail)은 정확히 하나만
 * 적재됩니다. 먼저 적재된 종료 Outcome이 이기며, 이후의 종료/진행 Outcome은 버려집니다.</p>
 *
 * @param <T> 결과(또는 진행 값) 타입
 * @author JobPool Team
 * @since 1.0.0
 */
public final class JobEnvelope<T> {

    private final JobId id;
    private final long createdAt;
    private final Job<T> job;
    private final JobCallbacks<T> callbacks;
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    /**
     * 생성자.
     *
     * @param id JobId
     * @param job 실행할 Job
     * @param callbacks 제출자 콜백
     * @param createdAt 생성 시각 (epoch millis)
     * @throws IllegalArgumentException 필수 필드가 null이거나 createdAt이 음수인 경우
     */
    public JobEnvelope(JobId id, Job<T> job, JobCallbacks<T> callbacks, long createdAt) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (callbacks == null) {
            throw new IllegalArgumentException("callbacks cannot be null");
        }
        if (createdAt < 0) {
            throw new IllegalArgumentException("createdAt must be non-negative (current: " + createdAt + ")");
        }
        this.id = id;
        this.job = job;
        this.callbacks = callbacks;
        this.createdAt = createdAt;
    }

    /**
     * one-shot Envelope 생성 (새 JobId, 현재 시각).
     *
     * @param job one-shot Job
     * @param callbacks 제출자 콜백
     * @param <T> 결과 타입
     * @return 생성된 Envelope
     */
    public static <T> JobEnvelope<T> oneShot(OneShotJob<T> job, JobCallbacks<T> callbacks) {
        return new JobEnvelope<>(JobId.generate(), job, callbacks, System.currentTimeMillis());
    }

    /**
     * 스트리밍 Envelope 생성 (새 JobId, 현재 시각).
     *
     * @param job 스트리밍 Job
     * @param callbacks 제출자 콜백
     * @param <T> 진행 값 타입
     * @return 생성된 Envelope
     */
    public static <T> JobEnvelope<T> streaming(StreamingJob<T> job, JobCallbacks<T> callbacks) {
        return new JobEnvelope<>(JobId.generate(), job, callbacks, System.currentTimeMillis());
    }

    public JobId id() {
        return id;
    }

    public long createdAt() {
        return createdAt;
    }

    public ExecutionMode mode() {
        return job.mode();
    }

    public JobCallbacks<T> callbacks() {
        return callbacks;
    }

    /**
     * 종료 Outcome이 이미 적재되었는지 확인.
     *
     * @return 종료된 경우 true
     */
    public boolean isTerminated() {
        return terminated.get();
    }

    /**
     * Job 실행 (Worker 스레드에서 호출).
     *
     * <p>실행 형태에 따라 분기합니다. 비동기 형태도 완료될 때까지 이 메서드에서 대기하므로,
     * 반환 시점에는 Job이 끝나 있습니다.</p>
     *
     * <pre>
     * SYNC            → execute()               → Ok
     * ASYNC           → executeAsync() 대기      → Ok
     * SYNC_STREAMING  → executeStreaming()      → Progress* → Done
     * ASYNC_STREAMING → executeStreamingAsync() 대기 → Progress* → Done
     * </pre>
     *
     * @param queue 출력 큐
     * @param token 이 Envelope의 취소 토큰
     * @throws Exception Job이 던진 예외 (ExecutionException/CompletionException은 원인으로 풀어서 던짐)
     */
    public void execute(CallbackQueue queue, CancellationToken token) throws Exception {
        if (job instanceof SyncJob<T> syncJob) {
            T value = syncJob.execute(token);
            publish(queue, new Ok<>(id, value));
        } else if (job instanceof AsyncJob<T> asyncJob) {
            T value = await(asyncJob.executeAsync(token));
            publish(queue, new Ok<>(id, value));
        } else if (job instanceof SyncStreamingJob<T> streamingJob) {
            StreamSink sink = new StreamSink(queue);
            streamingJob.executeStreaming(sink, token);
            sink.complete();
        } else if (job instanceof AsyncStreamingJob<T> streamingJob) {
            StreamSink sink = new StreamSink(queue);
            await(streamingJob.executeStreamingAsync(sink, token));
            sink.complete();
        } else {
            throw new IllegalStateException("Unsupported job type: " + job.getClass().getName());
        }
    }

    /**
     * 실패 Outcome 적재.
     *
     * <p>CancellationException 계열은 {@link FailureKind#CANCELLED}, 그 외는
     * {@link FailureKind#EXECUTION_FAILURE}로 분류됩니다.</p>
     *
     * @param queue 출력 큐
     * @param cause 원인
     * @return 적재되었으면 true, 이미 종료 Outcome이 있으면 false
     */
    public boolean fail(CallbackQueue queue, Throwable cause) {
        FailureKind kind = cause instanceof CancellationException
            ? FailureKind.CANCELLED
            : FailureKind.EXECUTION_FAILURE;
        return publish(queue, new Fail<>(id, kind, cause));
    }

    /**
     * 실행 전 취소 처리.
     *
     * <p>notifyOnCancel이 설정된 경우에만 onError에 {@link JobCancelledException}이 전달됩니다.
     * 설정되지 않았으면 아무 콜백도 적재하지 않고 종료 상태로만 표시합니다.</p>
     *
     * @param queue 출력 큐
     * @return 취소 알림이 적재되었으면 true
     */
    public boolean cancelBeforeStart(CallbackQueue queue) {
        if (callbacks.notifyOnCancel()) {
            return publish(queue, new Fail<>(id, FailureKind.CANCELLED,
                new JobCancelledException("Job " + id.getValue() + " cancelled before execution")));
        }
        terminated.set(true);
        return false;
    }

    private boolean publish(CallbackQueue queue, Outcome<T> outcome) {
        if (outcome.isTerminal()) {
            if (!terminated.compareAndSet(false, true)) {
                return false;
            }
        } else if (terminated.get()) {
            return false;
        }
        queue.post(outcome, () -> deliver(outcome));
        return true;
    }

    /**
     * Outcome을 형태에 맞는 콜백으로 전달 (drain 스레드).
     *
     * <p>onResult가 예외를 던져도 onComplete는 호출되며, 예외는 drain 쪽으로 전파됩니다.</p>
     */
    private void deliver(Outcome<T> outcome) {
        if (outcome instanceof Ok<T> ok) {
            try {
                callbacks.onResult().accept(ok.value());
            } finally {
                callbacks.onComplete().run();
            }
        } else if (outcome instanceof Progress<T> progress) {
            callbacks.onProgress().accept(progress.value());
        } else if (outcome instanceof Done<T>) {
            callbacks.onComplete().run();
        } else if (outcome instanceof Fail<T> fail) {
            callbacks.onError().accept(fail.cause());
        }
    }

    private static <V> V await(CompletionStage<V> stage) throws Exception {
        if (stage == null) {
            throw new IllegalStateException("async job returned a null CompletionStage");
        }
        try {
            return stage.toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobCancelledException("Interrupted while awaiting async job");
        } catch (ExecutionException | CompletionException e) {
            throw unwrap(e);
        }
    }

    private static Exception unwrap(Exception e) {
        Throwable cause = e;
        while ((cause instanceof ExecutionException || cause instanceof CompletionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof Exception exception) {
            return exception;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return e;
    }

    @Override
    public String toString() {
        return "JobEnvelope{id=" + id.getValue() + ", mode=" + mode() + ", createdAt=" + createdAt + "}";
    }

    /**
     * 스트리밍 Job에 넘기는 ProgressSink.
     *
     * <p>여러 스레드에서 방출해도 잠금 순서대로 적재됩니다.</p>
     */
    private final class StreamSink implements ProgressSink<T> {

        private final CallbackQueue queue;
        private long sequence;

        private StreamSink(CallbackQueue queue) {
            this.queue = queue;
        }

        @Override
        public synchronized void emit(T value) {
            if (publish(queue, new Progress<>(id, sequence, value))) {
                sequence++;
            }
        }

        @Override
        public synchronized void complete() {
            publish(queue, new Done<>(id, sequence));
        }
    }
}
