/**
 * Envelope과 콜백 계약.
 *
 * <p>{@link com.ryuqq.jobpool.core.contract.JobEnvelope}이 Job 하나의 실행, 종료 Outcome 단일성,
 * 콜백 전달을 책임지고, {@link com.ryuqq.jobpool.core.contract.CallbackQueue}가 Worker 스레드와
 * drain 스레드 사이의 경계가 됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.jobpool.core.contract;
