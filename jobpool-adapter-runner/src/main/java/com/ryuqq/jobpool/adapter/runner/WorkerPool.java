package com.ryuqq.jobpool.adapter.runner;

import com.ryuqq.jobpool.application.engine.JobEngine;
import com.ryuqq.jobpool.application.engine.PoolStats;
import com.ryuqq.jobpool.application.engine.SubmissionHandle;
import com.ryuqq.jobpool.core.contract.JobCallbacks;
import com.ryuqq.jobpool.core.contract.JobEnvelope;
import com.ryuqq.jobpool.core.exception.SubmissionRejectedException;
import com.ryuqq.jobpool.core.job.OneShotJob;
import com.ryuqq.jobpool.core.job.StreamingJob;
import com.ryuqq.jobpool.core.model.JobId;
import com.ryuqq.jobpool.core.model.RejectionReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 고정 개수 JobWorker 위의 JobEngine 구현체.
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>Worker 생성/시작 ({@link #initialize()})</li>
 *   <li>Job 배치 ({@link WorkerSelector}) 및 동기 거부 처리</li>
 *   <li>취소 색인 (JobId → Worker) 관리</li>
 *   <li>drain 스레드 고정 및 Worker별 콜백 실행</li>
 *   <li>통계 스냅샷, 멱등 종료</li>
 * </ul>
 *
 * <p><strong>제출 흐름:</strong></p>
 * <pre>
 * submit(job, callbacks)
 *   1. 종료 중 → POOL_SHUTTING_DOWN
 *   2. WorkerSelector.select → null → NO_WORKERS_AVAILABLE
 *   3. 색인 등록 → worker.tryEnqueue
 *      - 성공 → accepted(jobId)
 *      - 실패 → 색인 제거 → QUEUE_FULL (종료 중이면 POOL_SHUTTING_DOWN)
 *   거부 시 onError(SubmissionRejectedException)를 호출 스레드에서 즉시 호출
 * </pre>
 *
 * <p><strong>drain 스레드:</strong> 처음 drain을 호출한 스레드가 콜백 소비 스레드로 고정됩니다.
 * 다른 스레드의 drain 호출은 경고 로그만 남기고 0을 반환합니다.</p>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public final class WorkerPool implements JobEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final WorkerPoolConfig config;
    private final List<JobWorker> workers;
    private final ConcurrentMap<JobId, JobWorker> cancellationIndex = new ConcurrentHashMap<>();
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final AtomicReference<Thread> drainThread = new AtomicReference<>();

    /**
     * 기본 설정 생성자.
     */
    public WorkerPool() {
        this(new WorkerPoolConfig());
    }

    /**
     * 생성자. Worker는 {@link #initialize()} 호출 시 시작됩니다.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public WorkerPool(WorkerPoolConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        JobWorkerConfig workerConfig = config.workerConfig();
        List<JobWorker> created = new ArrayList<>(config.workerCount());
        for (int i = 0; i < config.workerCount(); i++) {
            created.add(new JobWorker(config.threadNamePrefix() + "-" + i, workerConfig, cancellationIndex::remove));
        }
        this.workers = Collections.unmodifiableList(created);
    }

    /**
     * Pool 생성 후 즉시 시작.
     *
     * @param config 설정
     * @return 시작된 WorkerPool
     */
    public static WorkerPool start(WorkerPoolConfig config) {
        WorkerPool pool = new WorkerPool(config);
        pool.initialize();
        return pool;
    }

    /**
     * 모든 Worker 시작 (멱등).
     *
     * @throws IllegalStateException 이미 종료된 경우
     */
    public void initialize() {
        if (shuttingDown.get()) {
            throw new IllegalStateException("WorkerPool is shut down");
        }
        if (!initialized.compareAndSet(false, true)) {
            return;
        }
        for (JobWorker worker : workers) {
            worker.start();
        }
        log.info("WorkerPool initialized with {} workers (queueCapacity={})",
            workers.size(), config.queueCapacity());
    }

    @Override
    public <T> SubmissionHandle submit(OneShotJob<T> job, JobCallbacks<T> callbacks) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (callbacks == null) {
            throw new IllegalArgumentException("callbacks cannot be null");
        }
        return place(JobEnvelope.oneShot(job, callbacks), false);
    }

    @Override
    public <T> SubmissionHandle submitStreaming(StreamingJob<T> job, JobCallbacks<T> callbacks) {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (callbacks == null) {
            throw new IllegalArgumentException("callbacks cannot be null");
        }
        return place(JobEnvelope.streaming(job, callbacks), false);
    }

    @Override
    public <T> List<SubmissionHandle> submitAll(List<? extends OneShotJob<T>> jobs, JobCallbacks<T> callbacks) {
        if (jobs == null) {
            throw new IllegalArgumentException("jobs cannot be null");
        }
        if (callbacks == null) {
            throw new IllegalArgumentException("callbacks cannot be null");
        }
        for (OneShotJob<T> job : jobs) {
            if (job == null) {
                throw new IllegalArgumentException("jobs cannot contain null");
            }
        }
        List<SubmissionHandle> handles = new ArrayList<>(jobs.size());
        for (OneShotJob<T> job : jobs) {
            handles.add(place(JobEnvelope.oneShot(job, callbacks), true));
        }
        return Collections.unmodifiableList(handles);
    }

    @Override
    public boolean cancel(JobId jobId) {
        if (jobId == null) {
            return false;
        }
        JobWorker worker = cancellationIndex.get(jobId);
        if (worker == null) {
            return false;
        }
        return worker.cancel(jobId);
    }

    @Override
    public boolean isJobActive(JobId jobId) {
        return jobId != null && cancellationIndex.containsKey(jobId);
    }

    @Override
    public Set<JobId> activeJobIds() {
        return Set.copyOf(cancellationIndex.keySet());
    }

    @Override
    public int drain(int maxCallbacksPerWorker) {
        if (maxCallbacksPerWorker <= 0) {
            throw new IllegalArgumentException(
                "maxCallbacksPerWorker must be positive (current: " + maxCallbacksPerWorker + ")"
            );
        }
        Thread caller = Thread.currentThread();
        if (drainThread.compareAndSet(null, caller)) {
            log.info("WorkerPool drain thread bound to {}", caller.getName());
        }
        Thread owner = drainThread.get();
        if (owner != caller) {
            log.warn("drain() called from {} but the drain thread is {}; ignoring", caller.getName(), owner.getName());
            return 0;
        }
        int invoked = 0;
        for (JobWorker worker : workers) {
            invoked += worker.drain(maxCallbacksPerWorker);
        }
        return invoked;
    }

    @Override
    public PoolStats stats() {
        int activeWorkers = 0;
        int queuedJobs = 0;
        int pendingCallbacks = 0;
        for (JobWorker worker : workers) {
            if (worker.isBusy()) {
                activeWorkers++;
            }
            queuedJobs += worker.pendingJobCount();
            pendingCallbacks += worker.pendingCallbackCount();
        }
        return new PoolStats(activeWorkers, queuedJobs, pendingCallbacks, workers.size(), shuttingDown.get());
    }

    /**
     * Pool 종료 (멱등).
     *
     * <p><strong>처리 흐름:</strong></p>
     * <pre>
     * 1. 새 제출 거부
     * 2. 모든 Worker에 종료 신호 (대기 큐 폐기, 실행 중 Job 취소 토큰 신호)
     * 3. 전체 deadline 안에서 Worker별로 남은 시간을 나눠 종료 대기
     * 4. 시간 안에 끝나지 않은 Worker는 로그만 남기고 분리
     * 5. 취소 색인 비우기
     * </pre>
     *
     * <p>이미 적재된 콜백은 종료 후에도 drain으로 실행할 수 있습니다.</p>
     *
     * @param timeout 전체 대기 시간
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     */
    @Override
    public void shutdown(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("WorkerPool shutting down ({} workers, timeout={}ms)", workers.size(), timeout.toMillis());

        for (JobWorker worker : workers) {
            try {
                worker.signalShutdown();
            } catch (RuntimeException e) {
                log.error("Failed to signal shutdown to {}", worker.name(), e);
            }
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        int detached = 0;
        for (int i = 0; i < workers.size(); i++) {
            JobWorker worker = workers.get(i);
            long remaining = Math.max(0L, deadline - System.nanoTime());
            Duration share = Duration.ofNanos(remaining / (workers.size() - i));
            try {
                if (!worker.awaitTermination(share)) {
                    detached++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to await termination of {}", worker.name(), e);
                detached++;
            }
        }
        cancellationIndex.clear();

        if (detached > 0) {
            log.warn("WorkerPool shutdown finished; {} worker(s) did not stop in time and were detached", detached);
        } else {
            log.info("WorkerPool shutdown complete");
        }
    }

    @Override
    public boolean isShutdown() {
        return shuttingDown.get();
    }

    @Override
    public void close() {
        shutdown(Duration.ofMillis(config.shutdownTimeoutMs()));
    }

    public WorkerPoolConfig getConfig() {
        return config;
    }

    /**
     * Worker 목록 (읽기 전용).
     */
    List<JobWorker> workers() {
        return workers;
    }

    private <T> SubmissionHandle place(JobEnvelope<T> envelope, boolean retryOnAlternate) {
        if (shuttingDown.get()) {
            return reject(envelope, RejectionReason.POOL_SHUTTING_DOWN);
        }
        JobWorker worker = WorkerSelector.select(workers);
        if (worker == null) {
            return reject(envelope, RejectionReason.NO_WORKERS_AVAILABLE);
        }
        if (tryPlace(envelope, worker)) {
            return SubmissionHandle.accepted(envelope.id());
        }
        if (retryOnAlternate) {
            JobWorker alternate = WorkerSelector.select(workers, worker);
            if (alternate != null && tryPlace(envelope, alternate)) {
                return SubmissionHandle.accepted(envelope.id());
            }
        }
        return reject(envelope, shuttingDown.get() ? RejectionReason.POOL_SHUTTING_DOWN : RejectionReason.QUEUE_FULL);
    }

    private boolean tryPlace(JobEnvelope<?> envelope, JobWorker worker) {
        cancellationIndex.put(envelope.id(), worker);
        if (worker.tryEnqueue(envelope)) {
            return true;
        }
        cancellationIndex.remove(envelope.id(), worker);
        return false;
    }

    private <T> SubmissionHandle reject(JobEnvelope<T> envelope, RejectionReason reason) {
        log.warn("Job {} rejected: {}", envelope.id().getValue(), reason);
        try {
            envelope.callbacks().onError().accept(new SubmissionRejectedException(reason));
        } catch (RuntimeException e) {
            log.error("onError callback failed for rejected job {}", envelope.id().getValue(), e);
        }
        return SubmissionHandle.rejected(reason);
    }
}
