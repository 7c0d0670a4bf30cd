package com.ryuqq.jobpool.core.job;

import com.ryuqq.jobpool.core.cancel.CancellationToken;

import java.util.concurrent.CompletionStage;

/**
 * 비동기 스트리밍 Job.
 *
 * <p>반환된 CompletionStage가 완료될 때까지 Worker가 대기합니다.
 * 진행 값은 어느 스레드에서 방출해도 방출 순서대로 전달됩니다.</p>
 *
 * @param <T> 진행 값 타입
 * @author JobPool Team
 * @since 1.0.0
 */
@FunctionalInterface
public non-sealed interface AsyncStreamingJob<T> extends StreamingJob<T> {

    /**
     * Job 비동기 실행.
     *
     * @param sink 진행 값 수신자
     * @param token 협조적 취소 토큰
     * @return 스트림 종료 시 완료되는 CompletionStage
     * @throws Exception 실행 시작 실패 시 (onError로 전달됨)
     */
    CompletionStage<Void> executeStreamingAsync(ProgressSink<T> sink, CancellationToken token) throws Exception;

    @Override
    default ExecutionMode mode() {
        return ExecutionMode.ASYNC_STREAMING;
    }
}
