package com.ryuqq.jobpool.adapter.runner;

import java.util.List;

/**
 * 제출된 Job을 받을 Worker 선택.
 *
 * <p><strong>선택 규칙:</strong></p>
 * <ol>
 *   <li>실행 중이면서 유휴(실행 중인 Job 없음, 대기 큐 비어 있음)인 첫 번째 Worker</li>
 *   <li>없으면 실행 중인 Worker 중 대기 큐가 가장 짧은 Worker (동률이면 먼저 찾은 Worker)</li>
 *   <li>실행 중인 Worker가 없으면 null</li>
 * </ol>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
final class WorkerSelector {

    private WorkerSelector() {
    }

    /**
     * Worker 선택.
     *
     * @param workers 후보 Worker 목록
     * @return 선택된 Worker, 실행 중인 Worker가 없으면 null
     */
    static JobWorker select(List<JobWorker> workers) {
        return select(workers, null);
    }

    /**
     * 특정 Worker를 제외하고 선택 (재시도용).
     *
     * @param workers 후보 Worker 목록
     * @param excluded 제외할 Worker (null이면 제외 없음)
     * @return 선택된 Worker, 없으면 null
     */
    static JobWorker select(List<JobWorker> workers, JobWorker excluded) {
        JobWorker shortest = null;
        int shortestLength = Integer.MAX_VALUE;
        for (JobWorker worker : workers) {
            if (worker == excluded || !worker.isRunning()) {
                continue;
            }
            if (worker.isIdle()) {
                return worker;
            }
            int length = worker.pendingJobCount();
            if (length < shortestLength) {
                shortest = worker;
                shortestLength = length;
            }
        }
        return shortest;
    }
}
