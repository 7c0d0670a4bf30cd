package com.ryuqq.jobpool.core.job;

import com.ryuqq.jobpool.core.cancel.CancellationToken;

/**
 * 동기 one-shot Job.
 *
 * <p>Worker 스레드에서 호출되어 완료될 때까지 실행됩니다.</p>
 *
 * @param <T> 결과 타입
 * @author JobPool Team
 * @since 1.0.0
 */
@FunctionalInterface
public non-sealed interface SyncJob<T> extends OneShotJob<T> {

    /**
     * Job 실행.
     *
     * @param token 협조적 취소 토큰
     * @return 결과 값
     * @throws Exception 실행 실패 시 (onError로 전달됨)
     */
    T execute(CancellationToken token) throws Exception;

    @Override
    default ExecutionMode mode() {
        return ExecutionMode.SYNC;
    }
}
