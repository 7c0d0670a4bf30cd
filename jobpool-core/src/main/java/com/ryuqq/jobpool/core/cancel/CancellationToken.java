package com.ryuqq.jobpool.core.cancel;

import com.ryuqq.jobpool.core.exception.JobCancelledException;

/**
 * 협조적(cooperative) 취소 신호.
 *
 * <p>엔진은 실행 중인 Job을 강제로 중단하지 않습니다. 취소가 효과를 가지려면
 * Job 본문이 주기적으로 이 토큰을 확인해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * SyncJob<Integer> job = token -> {
 *     int sum = 0;
 *     for (int i = 0; i < 1_000_000; i++) {
 *         token.throwIfCancellationRequested();
 *         sum += i;
 *     }
 *     return sum;
 * };
 * }</pre>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public interface CancellationToken {

    /**
     * 취소되지 않는 토큰.
     */
    CancellationToken NONE = () -> false;

    /**
     * 취소 요청 여부 확인.
     *
     * @return 취소가 요청된 경우 true
     */
    boolean isCancellationRequested();

    /**
     * 취소가 요청되었으면 {@link JobCancelledException}을 던집니다.
     *
     * @throws JobCancelledException 취소가 요청된 경우
     */
    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new JobCancelledException("Job cancelled");
        }
    }
}
