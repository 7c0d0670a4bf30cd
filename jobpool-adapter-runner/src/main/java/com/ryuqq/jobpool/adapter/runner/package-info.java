/**
 * Runner Adapter Layer - 전용 스레드 Worker 기반 JobEngine 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobpool.adapter.runner.WorkerPool} - 고정 개수 Worker Pool (JobEngine)</li>
 *   <li>{@link com.ryuqq.jobpool.adapter.runner.JobWorker} - 유한 FIFO 큐 + 전용 루프 스레드</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (WorkerPool, JobWorker)
 *   ↓ implements
 * application (JobEngine, DrainPoint)
 *   ↓ depends on
 * core (Job, JobEnvelope, Outcome, CancellationToken)
 * </pre>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
package com.ryuqq.jobpool.adapter.runner;
