package com.ryuqq.jobpool.core.outcome;

import com.ryuqq.jobpool.core.model.JobId;

/**
 * 스트림 종료.
 *
 * @param jobId Job ID
 * @param progressCount 종료 전까지 방출된 진행 값 수
 * @param <T> 진행 값 타입
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public record Done<T>(
    JobId jobId,
    long progressCount
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException jobId가 null이거나 progressCount가 음수인 경우
     */
    public Done {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (progressCount < 0) {
            throw new IllegalArgumentException("progressCount must be non-negative (current: " + progressCount + ")");
        }
    }
}
