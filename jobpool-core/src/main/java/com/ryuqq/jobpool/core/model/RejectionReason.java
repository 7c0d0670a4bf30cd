package com.ryuqq.jobpool.core.model;

/**
 * 제출 거부 사유.
 *
 * <p>제출이 거부되면 Job은 시스템에 들어가지 않으며, 제출자에게 동기적으로 통보됩니다.</p>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public enum RejectionReason {

    /**
     * 선택된 Worker의 큐가 가득 참 (backpressure).
     */
    QUEUE_FULL,

    /**
     * 실행 중인 Worker가 없음.
     */
    NO_WORKERS_AVAILABLE,

    /**
     * Pool이 종료 중이거나 이미 종료됨.
     */
    POOL_SHUTTING_DOWN
}
