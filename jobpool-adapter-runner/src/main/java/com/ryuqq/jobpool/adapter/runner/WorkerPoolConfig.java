package com.ryuqq.jobpool.adapter.runner;

/**
 * WorkerPool 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workerCount: Worker 수 = 동시에 실행 가능한 최대 Job 수 (기본 4)</li>
 *   <li>queueCapacity: Worker 당 대기 큐 크기 (기본 1000)</li>
 *   <li>shutdownTimeoutMs: close() 시 사용하는 전체 종료 대기 시간 (기본 2000ms)</li>
 *   <li>threadNamePrefix: Worker 스레드 이름 접두사 (기본 "jobpool-worker")</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>CPU 위주 Job: workerCount = 코어 수 - 1 (drain 스레드 몫)</li>
 *   <li>I/O 대기가 긴 Job: workerCount 증가. 비동기 Job도 Worker 하나를 점유합니다.</li>
 *   <li>버스트 제출: queueCapacity 증가, 또는 submitAll로 재시도 배치</li>
 * </ul>
 *
 * @author JobPool Team
 * @since 1.0.0
 * @param workerCount Worker 수 (1 이상이어야 함)
 * @param queueCapacity Worker 당 대기 큐 크기 (1 이상이어야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 * @param threadNamePrefix 스레드 이름 접두사 (비어 있으면 안 됨)
 */
public record WorkerPoolConfig(
    int workerCount,
    int queueCapacity,
    long shutdownTimeoutMs,
    String threadNamePrefix
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: workerCount=4, queueCapacity=1000, shutdownTimeoutMs=2000ms,
     * threadNamePrefix="jobpool-worker"</p>
     */
    public WorkerPoolConfig() {
        this(4, 1000, 2000, "jobpool-worker");
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkerPoolConfig {
        if (workerCount <= 0) {
            throw new IllegalArgumentException(
                "workerCount must be positive (current: " + workerCount + ")"
            );
        }
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
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
    }

    /**
     * Worker 하나에 적용할 설정.
     *
     * @return JobWorkerConfig
     */
    public JobWorkerConfig workerConfig() {
        return new JobWorkerConfig(queueCapacity, shutdownTimeoutMs);
    }

    /**
     * workerCount만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withWorkerCount(int workerCount) {
        return new WorkerPoolConfig(workerCount, queueCapacity, shutdownTimeoutMs, threadNamePrefix);
    }

    /**
     * queueCapacity만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withQueueCapacity(int queueCapacity) {
        return new WorkerPoolConfig(workerCount, queueCapacity, shutdownTimeoutMs, threadNamePrefix);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new WorkerPoolConfig(workerCount, queueCapacity, shutdownTimeoutMs, threadNamePrefix);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public WorkerPoolConfig withThreadNamePrefix(String threadNamePrefix) {
        return new WorkerPoolConfig(workerCount, queueCapacity, shutdownTimeoutMs, threadNamePrefix);
    }
}
