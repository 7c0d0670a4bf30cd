package com.ryuqq.jobpool.core.job;

import com.ryuqq.jobpool.core.cancel.CancellationToken;

import java.util.concurrent.CompletionStage;

/**
 * 비동기 one-shot Job.
 *
 * <p>반환된 CompletionStage가 완료될 때까지 Worker는 다음 Envelope로 넘어가지 않습니다.
 * 동시성은 Worker 수로 얻으며, 한 Worker 안에서 비동기 Job이 겹쳐 실행되지 않습니다.</p>
 *
 * @param <T> 결과 타입
 * @author JobPool Team
 * @since 1.0.0
 */
@FunctionalInterface
public non-sealed interface AsyncJob<T> extends OneShotJob<T> {

    /**
     * Job 비동기 실행.
     *
     * @param token 협조적 취소 토큰
     * @return 결과 값으로 완료되는 CompletionStage
     * @throws Exception 실행 시작 실패 시 (onError로 전달됨)
     */
    CompletionStage<T> executeAsync(CancellationToken token) throws Exception;

    @Override
    default ExecutionMode mode() {
        return ExecutionMode.ASYNC;
    }
}
