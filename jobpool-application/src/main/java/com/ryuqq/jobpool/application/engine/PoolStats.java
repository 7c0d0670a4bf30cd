package com.ryuqq.jobpool.application.engine;

/**
 * Pool 통계 스냅샷.
 *
 * <p>어느 스레드에서든 읽을 수 있습니다. 각 필드는 독립적으로 읽은 값이므로
 * 필드 간 트랜잭션 일관성은 보장되지 않습니다.</p>
 *
 * @param activeWorkers Job을 실행 중인 Worker 수
 * @param queuedJobs 모든 Worker 큐에 대기 중인 Envelope 수
 * @param pendingCallbacks drain을 기다리는 콜백 수
 * @param poolSize 설정된 Worker 수
 * @param shuttingDown 종료 시작 여부
 * @author JobPool Team
 * @since 1.0.0
 */
public record PoolStats(
    int activeWorkers,
    int queuedJobs,
    int pendingCallbacks,
    int poolSize,
    boolean shuttingDown
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 카운트가 음수인 경우
     */
    public PoolStats {
        if (activeWorkers < 0 || queuedJobs < 0 || pendingCallbacks < 0 || poolSize < 0) {
            throw new IllegalArgumentException("stats counts cannot be negative");
        }
    }

    @Override
    public String toString() {
        return "Workers: " + activeWorkers + "/" + poolSize
            + ", Queued: " + queuedJobs
            + ", Pending: " + pendingCallbacks
            + ", ShuttingDown: " + shuttingDown;
    }
}
