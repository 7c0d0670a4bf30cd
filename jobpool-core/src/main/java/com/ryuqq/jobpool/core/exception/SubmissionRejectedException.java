package com.ryuqq.jobpool.core.exception;

import com.ryuqq.jobpool.core.model.RejectionReason;

/**
 * 제출 거부 예외.
 *
 * <p>큐 포화, 가용 Worker 없음, 종료 중인 Pool로의 제출 시 제출자의 onError에
 * 제출 스레드에서 즉시 전달됩니다. 거부된 Job은 시스템에 들어가지 않습니다.</p>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public class SubmissionRejectedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final RejectionReason reason;

    /**
     * 생성자.
     *
     * @param reason 거부 사유
     * @throws IllegalArgumentException reason이 null인 경우
     */
    public SubmissionRejectedException(RejectionReason reason) {
        super(messageFor(reason));
        this.reason = reason;
    }

    /**
     * 거부 사유 조회.
     *
     * @return 거부 사유
     */
    public RejectionReason getReason() {
        return reason;
    }

    private static String messageFor(RejectionReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        switch (reason) {
            case QUEUE_FULL:
                return "Submission rejected: worker queue is full";
            case NO_WORKERS_AVAILABLE:
                return "Submission rejected: no running workers";
            case POOL_SHUTTING_DOWN:
                return "Submission rejected: pool is shutting down";
            default:
                return "Submission rejected: " + reason;
        }
    }
}
