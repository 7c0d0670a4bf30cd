package com.ryuqq.jobpool.core.outcome;

import com.ryuqq.jobpool.core.model.JobId;

/**
 * one-shot Job 성공 결과.
 *
 * @param jobId Job ID
 * @param value 결과 값 (null 허용)
 * @param <T> 결과 타입
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public record Ok<T>(
    JobId jobId,
    T value
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException jobId가 null인 경우
     */
    public Ok {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
    }
}
