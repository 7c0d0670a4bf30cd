package com.ryuqq.jobpool.core.job;

/**
 * 단일 값을 만들어 내는 Job.
 *
 * <p>성공 시 onResult가 정확히 한 번 호출됩니다.</p>
 *
 * @param <T> 결과 타입
 * @author JobPool Team
 * @since 1.0.0
 */
public sealed interface OneShotJob<T> extends Job<T> permits SyncJob, AsyncJob {
}
