package com.ryuqq.jobpool.application.quick;

import com.ryuqq.jobpool.application.engine.JobEngine;
import com.ryuqq.jobpool.application.engine.SubmissionHandle;
import com.ryuqq.jobpool.core.contract.JobCallbacks;
import com.ryuqq.jobpool.core.job.AsyncJob;
import com.ryuqq.jobpool.core.job.StreamingJob;
import com.ryuqq.jobpool.core.job.SyncJob;
import com.ryuqq.jobpool.core.job.SyncStreamingJob;

import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * 자주 쓰는 Job 형태를 한 줄로 제출하는 헬퍼.
 *
 * <p>모든 메서드는 생성자로 받은 엔진에 제출하며, 제출 결과 핸들을 그대로 반환합니다.</p>
 *
 * <pre>{@code
 * QuickJobs quick = new QuickJobs(engine);
 * quick.runFunction(() -> loadMesh(path), mesh -> scene.add(mesh), error -> log.warn("load failed", error));
 * quick.runIterations(100, i -> bake(i), progress -> bar.set(progress), () -> bar.hide(), null);
 * }</pre>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public final class QuickJobs {

    private final JobEngine engine;

    /**
     * 생성자.
     *
     * @param engine 제출 대상 엔진
     * @throws IllegalArgumentException engine이 null인 경우
     */
    public QuickJobs(JobEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.engine = engine;
    }

    /**
     * 값을 반환하는 함수 실행.
     */
    public <T> SubmissionHandle runFunction(Supplier<? extends T> function, Consumer<? super T> onResult,
                                            Consumer<? super Throwable> onError) {
        requireNonNull(function, "function");
        SyncJob<T> job = token -> function.get();
        return engine.submit(job, onResult, onError);
    }

    /**
     * CompletionStage를 반환하는 함수 실행.
     */
    public <T> SubmissionHandle runFunctionAsync(Supplier<? extends CompletionStage<T>> function,
                                                 Consumer<? super T> onResult,
                                                 Consumer<? super Throwable> onError) {
        requireNonNull(function, "function");
        AsyncJob<T> job = token -> function.get();
        return engine.submit(job, onResult, onError);
    }

    /**
     * 반환값 없는 작업 실행. 성공 시 onComplete가 호출됩니다.
     */
    public SubmissionHandle runAction(Runnable action, Runnable onComplete, Consumer<? super Throwable> onError) {
        requireNonNull(action, "action");
        SyncJob<Boolean> job = token -> {
            action.run();
            return Boolean.TRUE;
        };
        return engine.submit(job, new JobCallbacks<Boolean>(null, null, onComplete, onError, false));
    }

    /**
     * 반환값 없는 비동기 작업 실행. 성공 시 onComplete가 호출됩니다.
     */
    public SubmissionHandle runActionAsync(Supplier<? extends CompletionStage<?>> action, Runnable onComplete,
                                           Consumer<? super Throwable> onError) {
        requireNonNull(action, "action");
        AsyncJob<Boolean> job = token -> action.get().thenApply(ignored -> Boolean.TRUE);
        return engine.submit(job, new JobCallbacks<Boolean>(null, null, onComplete, onError, false));
    }

    /**
     * 스트리밍 Job 실행 (동기/비동기 스트리밍 모두 가능).
     */
    public <T> SubmissionHandle runStreaming(StreamingJob<T> job, Consumer<? super T> onProgress,
                                             Runnable onComplete, Consumer<? super Throwable> onError) {
        requireNonNull(job, "job");
        return engine.submitStreaming(job, onProgress, onComplete, onError);
    }

    /**
     * 반복 계산 실행.
     *
     * <p>step을 0부터 iterations-1까지 순서대로 호출하고, 매 반복 후 진행률 (i+1)/iterations를 방출합니다.
     * 반복마다 취소 토큰을 확인하므로 실행 중 취소가 가능합니다.</p>
     *
     * @param iterations 반복 횟수 (양수)
     * @param step 반복 본문
     * @param onProgress 진행률 콜백 (0.0 초과 1.0 이하)
     * @param onComplete 종료 콜백
     * @param onError 실패 콜백
     * @return 제출 핸들
     * @throws IllegalArgumentException iterations가 양수가 아니거나 step이 null인 경우
     */
    public SubmissionHandle runIterations(int iterations, IntConsumer step, Consumer<? super Double> onProgress,
                                          Runnable onComplete, Consumer<? super Throwable> onError) {
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive (current: " + iterations + ")");
        }
        requireNonNull(step, "step");
        SyncStreamingJob<Double> job = (sink, token) -> {
            for (int i = 0; i < iterations; i++) {
                token.throwIfCancellationRequested();
                step.accept(i);
                sink.emit((double) (i + 1) / iterations);
            }
        };
        return engine.submitStreaming(job, onProgress, onComplete, onError);
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
