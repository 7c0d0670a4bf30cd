package com.ryuqq.jobpool.core.job;

/**
 * 엔진이 실행하는 작업 단위.
 *
 * <p>Job은 실행 형태({@link ExecutionMode})와 그것을 수행하는 코드로 구성됩니다.
 * 엔진은 Job이 무엇을 계산하는지 알지 못하며, 실행 형태에 맞게 실행하고 결과를 전달할 뿐입니다.</p>
 *
 * <p>Sealed interface로 정의되어 네 가지 형태만 존재합니다:</p>
 * <ul>
 *   <li>{@link SyncJob}: 동기 one-shot</li>
 *   <li>{@link AsyncJob}: 비동기 one-shot</li>
 *   <li>{@link SyncStreamingJob}: 동기 스트리밍</li>
 *   <li>{@link AsyncStreamingJob}: 비동기 스트리밍</li>
 * </ul>
 *
 * <p>one-shot Job은 {@link OneShotJob}, 스트리밍 Job은 {@link StreamingJob}으로 묶여 있어
 * 제출 API가 컴파일 타임에 잘못된 콜백 조합을 거부합니다.</p>
 *
 * @param <T> 결과(또는 진행 값) 타입
 * @author JobPool Team
 * @since 1.0.0
 */
public sealed interface Job<T> permits OneShotJob, StreamingJob {

    /**
     * 실행 형태 조회.
     *
     * @return 실행 형태 (생성 후 불변)
     */
    ExecutionMode mode();
}
