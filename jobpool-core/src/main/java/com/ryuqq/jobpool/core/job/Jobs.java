package com.ryuqq.jobpool.core.job;

import java.util.concurrent.Callable;

/**
 * Job 생성 헬퍼.
 *
 * <p>람다의 대상 타입을 명시하기 위한 정적 팩토리입니다.
 * {@code OneShotJob}은 함수형 인터페이스가 아니므로 람다를 바로 제출할 수 없습니다.</p>
 *
 * <pre>{@code
 * engine.submit(Jobs.sync(token -> 21 * 2), callbacks);
 * engine.submitStreaming(Jobs.streaming((sink, token) -> {
 *     sink.emit(1);
 *     sink.emit(2);
 *     sink.complete();
 * }), streamingCallbacks);
 * }</pre>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public final class Jobs {

    private Jobs() {
    }

    public static <T> SyncJob<T> sync(SyncJob<T> job) {
        return requireJob(job);
    }

    public static <T> AsyncJob<T> async(AsyncJob<T> job) {
        return requireJob(job);
    }

    public static <T> SyncStreamingJob<T> streaming(SyncStreamingJob<T> job) {
        return requireJob(job);
    }

    public static <T> AsyncStreamingJob<T> asyncStreaming(AsyncStreamingJob<T> job) {
        return requireJob(job);
    }

    /**
     * 취소 토큰을 쓰지 않는 Callable을 동기 Job으로 변환.
     *
     * @param callable 실행할 코드
     * @param <T> 결과 타입
     * @return SyncJob
     * @throws IllegalArgumentException callable이 null인 경우
     */
    public static <T> SyncJob<T> fromCallable(Callable<T> callable) {
        if (callable == null) {
            throw new IllegalArgumentException("callable cannot be null");
        }
        return token -> callable.call();
    }

    private static <J extends Job<?>> J requireJob(J job) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        return job;
    }
}
