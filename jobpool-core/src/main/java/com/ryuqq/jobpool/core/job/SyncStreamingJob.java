package com.ryuqq.jobpool.core.job;

import com.ryuqq.jobpool.core.cancel.CancellationToken;

/**
 * 동기 스트리밍 Job.
 *
 * <p>Job 본문이 {@link ProgressSink#emit(Object)}를 0회 이상, {@link ProgressSink#complete()}를
 * 한 번 호출합니다. 엔진은 방출 주기나 횟수를 강제하지 않습니다.
 * 본문이 complete() 없이 정상 반환하면 엔진이 스트림을 종료합니다.</p>
 *
 * @param <T> 진행 값 타입
 * @author JobPool Team
 * @since 1.0.0
 */
@FunctionalInterface
public non-sealed interface SyncStreamingJob<T> extends StreamingJob<T> {

    /**
     * Job 실행.
     *
     * @param sink 진행 값 수신자
     * @param token 협조적 취소 토큰
     * @throws Exception 실행 실패 시 (onError로 전달됨)
     */
    void executeStreaming(ProgressSink<T> sink, CancellationToken token) throws Exception;

    @Override
    default ExecutionMode mode() {
        return ExecutionMode.SYNC_STREAMING;
    }
}
