package com.ryuqq.jobpool.application.engine;

import com.ryuqq.jobpool.application.drain.DrainPoint;
import com.ryuqq.jobpool.core.contract.JobCallbacks;
import com.ryuqq.jobpool.core.job.OneShotJob;
import com.ryuqq.jobpool.core.job.StreamingJob;
import com.ryuqq.jobpool.core.model.JobId;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Job 실행 엔진 인터페이스.
 *
 * <p>고정 개수의 전용 Worker 위에 단일 제출 창구를 제공합니다.
 * 제출은 절대 블로킹되지 않으며, 모든 콜백은 {@link DrainPoint#drain(int)}을 호출하는 스레드에서만 실행됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * submit(job, callbacks)
 *   ↓ 동기 거부: QUEUE_FULL / NO_WORKERS_AVAILABLE / POOL_SHUTTING_DOWN (onError 즉시 호출)
 *   ↓ 수락: SubmissionHandle(jobId)
 * Worker 루프 (전용 스레드)
 *   ↓ 실행 → Outcome → 콜백 적재
 * drain() (소비 스레드)
 *   ↓ onResult / onProgress / onComplete / onError 호출
 * </pre>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>Worker 당 FIFO 실행</li>
 *   <li>동시에 실행되는 Job은 최대 Worker 수 (실행 형태와 무관)</li>
 *   <li>실행된 Envelope 당 정확히 하나의 종료 콜백 (onResult/onComplete XOR onError)</li>
 *   <li>예외는 스레드 경계를 넘지 않고 onError로 전달됨</li>
 * </ul>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public interface JobEngine extends DrainPoint, AutoCloseable {

    /**
     * one-shot Job 제출.
     *
     * @param job one-shot Job (SyncJob 또는 AsyncJob)
     * @param callbacks 콜백
     * @param <T> 결과 타입
     * @return 수락 또는 거부 핸들
     * @throws IllegalArgumentException job 또는 callbacks가 null인 경우
     */
    <T> SubmissionHandle submit(OneShotJob<T> job, JobCallbacks<T> callbacks);

    /**
     * one-shot Job 제출 (onResult, onError).
     */
    default <T> SubmissionHandle submit(OneShotJob<T> job, Consumer<? super T> onResult,
                                        Consumer<? super Throwable> onError) {
        return submit(job, JobCallbacks.oneShot(onResult, onError));
    }

    /**
     * 스트리밍 Job 제출.
     *
     * @param job 스트리밍 Job (SyncStreamingJob 또는 AsyncStreamingJob)
     * @param callbacks 콜백
     * @param <T> 진행 값 타입
     * @return 수락 또는 거부 핸들
     * @throws IllegalArgumentException job 또는 callbacks가 null인 경우
     */
    <T> SubmissionHandle submitStreaming(StreamingJob<T> job, JobCallbacks<T> callbacks);

    /**
     * 스트리밍 Job 제출 (onProgress, onComplete, onError).
     */
    default <T> SubmissionHandle submitStreaming(StreamingJob<T> job, Consumer<? super T> onProgress,
                                                 Runnable onComplete, Consumer<? super Throwable> onError) {
        return submitStreaming(job, JobCallbacks.streaming(onProgress, onComplete, onError));
    }

    /**
     * 여러 one-shot Job 일괄 제출.
     *
     * <p>각 Job은 개별적으로 배치되며, 처음 선택된 Worker가 거부하면 다른 Worker로 한 번 더 시도합니다.
     * 모든 Job은 같은 콜백을 공유합니다.</p>
     *
     * @param jobs 제출할 Job 목록
     * @param callbacks 공유 콜백
     * @param <T> 결과 타입
     * @return Job 순서대로의 핸들 목록
     * @throws IllegalArgumentException jobs 또는 callbacks가 null인 경우
     */
    <T> List<SubmissionHandle> submitAll(List<? extends OneShotJob<T>> jobs, JobCallbacks<T> callbacks);

    /**
     * Job 취소 (best-effort).
     *
     * <p>큐 대기 중인 Envelope은 실행되지 않고 제거됩니다. 이미 실행 중이면 취소 토큰만 신호되며,
     * Job 본문이 토큰을 확인해야 효과가 있습니다.</p>
     *
     * @param jobId 취소할 JobId
     * @return 취소 가능한 항목을 찾았으면 true
     */
    boolean cancel(JobId jobId);

    /**
     * Job 활성 여부 확인 (대기 또는 실행 중).
     *
     * @param jobId JobId
     * @return 아직 종료되지 않은 경우 true
     */
    boolean isJobActive(JobId jobId);

    /**
     * 활성 JobId 스냅샷.
     *
     * @return 대기 또는 실행 중인 JobId 집합 (불변)
     */
    Set<JobId> activeJobIds();

    /**
     * 통계 스냅샷 조회.
     *
     * @return PoolStats
     */
    PoolStats stats();

    /**
     * 엔진 종료 (멱등).
     *
     * <p>새 제출을 거부하고, 대기 중인 작업을 취소하고, Worker 종료를 최대 timeout 동안 기다립니다.
     * 시간 안에 끝나지 않은 Worker는 강제 종료하지 않고 추적만 중단합니다.</p>
     *
     * @param timeout 최대 대기 시간
     */
    void shutdown(Duration timeout);

    /**
     * 종료 시작 여부 확인.
     *
     * @return shutdown이 호출된 경우 true
     */
    boolean isShutdown();

    /**
     * 설정된 기본 timeout으로 종료.
     */
    @Override
    void close();
}
