package com.ryuqq.jobpool.core.job;

/**
 * 진행 값을 순서대로 방출하는 Job.
 *
 * <p>성공 시 onProgress가 방출 순서대로 0회 이상, 이어서 onComplete가 정확히 한 번 호출됩니다.</p>
 *
 * @param <T> 진행 값 타입
 * @author JobPool Team
 * @since 1.0.0
 */
public sealed interface StreamingJob<T> extends Job<T> permits SyncStreamingJob, AsyncStreamingJob {
}
