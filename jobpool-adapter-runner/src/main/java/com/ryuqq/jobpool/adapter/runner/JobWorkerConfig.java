package com.ryuqq.jobpool.adapter.runner;

/**
 * JobWorker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>queueCapacity: 대기 큐 최대 크기 (기본 1000). 가득 차면 제출이 QUEUE_FULL로 거부됩니다.</li>
 *   <li>shutdownTimeoutMs: dispose 시 루프 스레드 종료 대기 시간 (기본 2000ms)</li>
 * </ul>
 *
 * @author JobPool Team
 * @since 1.0.0
 * @param queueCapacity 대기 큐 최대 크기 (1 이상이어야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 */
public record JobWorkerConfig(
    int queueCapacity,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: queueCapacity=1000, shutdownTimeoutMs=2000ms</p>
     */
    public JobWorkerConfig() {
        this(1000, 2000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public JobWorkerConfig {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException(
                "queueCapacity must be positive (current: " + queueCapacity + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * queueCapacity만 변경한 새 인스턴스 생성.
     */
    public JobWorkerConfig withQueueCapacity(int queueCapacity) {
        return new JobWorkerConfig(queueCapacity, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public JobWorkerConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new JobWorkerConfig(queueCapacity, shutdownTimeoutMs);
    }
}
