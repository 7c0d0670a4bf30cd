package com.ryuqq.jobpool.core.outcome;

import com.ryuqq.jobpool.core.model.JobId;

/**
 * 실패 결과.
 *
 * <p>Job 본문이 던진 예외, 또는 취소를 나타냅니다. cause는 제출자의 onError에 그대로 전달됩니다.</p>
 *
 * @param jobId Job ID
 * @param kind 실패 종류
 * @param cause 원인 예외
 * @param <T> 결과 타입
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public record Fail<T>(
    JobId jobId,
    FailureKind kind,
    Throwable cause
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public Fail {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }
}
