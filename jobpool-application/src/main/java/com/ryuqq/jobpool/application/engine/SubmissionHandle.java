package com.ryuqq.jobpool.application.engine;

import com.ryuqq.jobpool.core.model.JobId;
import com.ryuqq.jobpool.core.model.RejectionReason;

/**
 * 제출 결과 핸들.
 *
 * <p>제출은 즉시(동기적으로) 수락 또는 거부됩니다.</p>
 *
 * <p><strong>두 가지 가능한 상태:</strong></p>
 * <ul>
 *   <li><strong>수락 (accepted = true):</strong>
 *       <ul>
 *         <li>jobIdOrNull: 발급된 JobId (취소 시 사용)</li>
 *         <li>rejectionReasonOrNull: null</li>
 *       </ul>
 *   </li>
 *   <li><strong>거부 (accepted = false):</strong>
 *       <ul>
 *         <li>jobIdOrNull: null (Job은 시스템에 들어가지 않음)</li>
 *         <li>rejectionReasonOrNull: QUEUE_FULL, NO_WORKERS_AVAILABLE, POOL_SHUTTING_DOWN</li>
 *       </ul>
 *   </li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * SubmissionHandle handle = engine.submit(job, callbacks);
 * if (handle.isAccepted()) {
 *     engine.cancel(handle.getJobIdOrNull());
 * } else {
 *     RejectionReason reason = handle.getRejectionReasonOrNull();
 * }
 * </pre>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public final class SubmissionHandle {

    private final JobId jobIdOrNull;
    private final RejectionReason rejectionReasonOrNull;

    private SubmissionHandle(JobId jobIdOrNull, RejectionReason rejectionReasonOrNull) {
        this.jobIdOrNull = jobIdOrNull;
        this.rejectionReasonOrNull = rejectionReasonOrNull;
    }

    /**
     * 수락 핸들 생성.
     *
     * @param jobId 발급된 JobId
     * @return SubmissionHandle (accepted=true)
     * @throws IllegalArgumentException jobId가 null인 경우
     */
    public static SubmissionHandle accepted(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null for accepted handle");
        }
        return new SubmissionHandle(jobId, null);
    }

    /**
     * 거부 핸들 생성.
     *
     * @param reason 거부 사유
     * @return SubmissionHandle (accepted=false)
     * @throws IllegalArgumentException reason이 null인 경우
     */
    public static SubmissionHandle rejected(RejectionReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null for rejected handle");
        }
        return new SubmissionHandle(null, reason);
    }

    /**
     * 수락 여부 확인.
     *
     * @return 수락된 경우 true
     */
    public boolean isAccepted() {
        return jobIdOrNull != null;
    }

    /**
     * JobId 조회.
     *
     * <p><strong>주의:</strong> accepted=true인 경우에만 non-null 반환</p>
     *
     * @return JobId 또는 null (거부 시)
     */
    public JobId getJobIdOrNull() {
        return jobIdOrNull;
    }

    /**
     * 거부 사유 조회.
     *
     * <p><strong>주의:</strong> accepted=false인 경우에만 non-null 반환</p>
     *
     * @return 거부 사유 또는 null (수락 시)
     */
    public RejectionReason getRejectionReasonOrNull() {
        return rejectionReasonOrNull;
    }

    @Override
    public String toString() {
        if (isAccepted()) {
            return "SubmissionHandle{accepted=true, jobId=" + jobIdOrNull + "}";
        } else {
            return "SubmissionHandle{accepted=false, reason=" + rejectionReasonOrNull + "}";
        }
    }
}
