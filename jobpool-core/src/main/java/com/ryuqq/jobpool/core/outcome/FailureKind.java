package com.ryuqq.jobpool.core.outcome;

/**
 * 실패 종류.
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * Job 코드가 예외를 던짐. Worker는 다음 Envelope로 계속 진행합니다.
     */
    EXECUTION_FAILURE,

    /**
     * 실행 전(큐 대기 중) 또는 실행 중(협조적) 취소됨.
     */
    CANCELLED,

    /**
     * 제출 시점에 거부됨. Job은 실행되지 않았습니다.
     */
    REJECTED
}
