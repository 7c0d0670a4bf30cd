package com.ryuqq.jobpool.core.outcome;

import com.ryuqq.jobpool.core.model.JobId;

/**
 * 스트리밍 Job의 진행 값.
 *
 * @param jobId Job ID
 * @param sequence 방출 순번 (0부터 시작)
 * @param value 진행 값 (null 허용)
 * @param <T> 진행 값 타입
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public record Progress<T>(
    JobId jobId,
    long sequence,
    T value
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException jobId가 null이거나 sequence가 음수인 경우
     */
    public Progress {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
    }
}
