package com.ryuqq.jobpool.adapter.runner;

import com.ryuqq.jobpool.core.cancel.CancellationSource;
import com.ryuqq.jobpool.core.contract.CallbackQueue;
import com.ryuqq.jobpool.core.contract.JobEnvelope;
import com.ryuqq.jobpool.core.model.JobId;
import com.ryuqq.jobpool.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 전용 스레드 하나로 Envelope을 순서대로 실행하는 Worker.
 *
 * <p>각 Worker는 유한 FIFO 대기 큐, 루프 스레드, 콜백 큐(action queue), 로그 큐를 가집니다.
 * 루프 스레드가 실행 결과를 콜백 큐에 적재하고, {@link #drain(int)}을 호출하는 스레드가 이를 꺼내 실행합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * tryEnqueue(envelope)     → 대기 큐 (용량 초과 / 종료 시작 시 false)
 *   ↓
 * 루프 스레드: take → busy=true → envelope.execute(this, token) → busy=false
 *   ↓ post(outcome, callback) / trace(message)
 * 콜백 큐 + 로그 큐
 *   ↓
 * drain(max): 콜백 최대 max개 실행 → 로그 큐 출력
 * </pre>
 *
 * <p><strong>종료:</strong></p>
 * <ul>
 *   <li>{@link #stop()}: 새 Envelope을 받지 않고, 남은 대기 큐를 모두 실행한 뒤 루프 종료</li>
 *   <li>{@link #dispose(Duration)}: 루프 취소 신호, 대기 큐 폐기, timeout 동안 스레드 종료 대기.
 *       시간 안에 끝나지 않은 스레드는 강제 종료하지 않고 분리(detach)합니다.</li>
 * </ul>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public final class JobWorker implements CallbackQueue {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final String name;
    private final JobWorkerConfig config;
    private final Consumer<JobId> completionListener;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<JobEnvelope<?>> queue = new ArrayDeque<>();

    private final ConcurrentLinkedQueue<Runnable> actions = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingActions = new AtomicInteger();
    private final ConcurrentLinkedQueue<LogLine> logLines = new ConcurrentLinkedQueue<>();

    private final CancellationSource loopSource = new CancellationSource();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    private volatile boolean accepting;
    private volatile boolean stopRequested;
    private volatile boolean running;
    private volatile boolean busy;
    private volatile RunningJob current;
    private volatile Thread thread;

    /**
     * 생성자 (완료 리스너 없음).
     *
     * @param name Worker 이름 (스레드 이름으로 사용)
     * @param config 설정
     * @throws IllegalArgumentException name 또는 config가 null인 경우
     */
    public JobWorker(String name, JobWorkerConfig config) {
        this(name, config, jobId -> { });
    }

    /**
     * 생성자.
     *
     * <p>completionListener는 Envelope의 종료 Outcome이 적재되거나, Envelope이 실행되지 않고
     * 폐기될 때 한 번 호출됩니다. 호출 스레드는 정해져 있지 않습니다.</p>
     *
     * @param name Worker 이름 (스레드 이름으로 사용)
     * @param config 설정
     * @param completionListener Envelope 종료 리스너
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public JobWorker(String name, JobWorkerConfig config, Consumer<JobId> completionListener) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (completionListener == null) {
            throw new IllegalArgumentException("completionListener cannot be null");
        }
        this.name = name;
        this.config = config;
        this.completionListener = completionListener;
    }

    /**
     * 루프 스레드 시작 (멱등).
     *
     * @throws IllegalStateException 이미 dispose된 경우
     */
    public void start() {
        if (disposed.get()) {
            throw new IllegalStateException("JobWorker " + name + " is disposed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        Thread loop = new Thread(this::runLoop, name);
        loop.setDaemon(true);
        accepting = true;
        running = true;
        thread = loop;
        loop.start();
        log.info("JobWorker {} started (queueCapacity={})", name, config.queueCapacity());
    }

    /**
     * Envelope 적재 (논블로킹).
     *
     * @param envelope 실행할 Envelope
     * @return 적재되었으면 true, 큐가 가득 찼거나 종료가 시작되었으면 false
     * @throws IllegalArgumentException envelope이 null인 경우
     */
    public boolean tryEnqueue(JobEnvelope<?> envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        lock.lock();
        try {
            if (!accepting || queue.size() >= config.queueCapacity()) {
                return false;
            }
            queue.addLast(envelope);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Job 취소 (best-effort).
     *
     * <p>대기 중이면 큐에서 제거하고 실행하지 않습니다 (notifyOnCancel이 설정된 경우에만 onError 적재).
     * 실행 중이면 그 Envelope의 취소 토큰에 신호만 보냅니다.</p>
     *
     * @param jobId 취소할 JobId
     * @return 대기 중 또는 실행 중인 항목을 찾았으면 true
     */
    public boolean cancel(JobId jobId) {
        if (jobId == null) {
            return false;
        }
        JobEnvelope<?> removed = null;
        lock.lock();
        try {
            Iterator<JobEnvelope<?>> iterator = queue.iterator();
            while (iterator.hasNext()) {
                JobEnvelope<?> candidate = iterator.next();
                if (candidate.id().equals(jobId)) {
                    iterator.remove();
                    removed = candidate;
                    break;
                }
            }
        } finally {
            lock.unlock();
        }

        if (removed != null) {
            abandon(removed);
            trace("Job " + jobId.getValue() + " cancelled while queued");
            return true;
        }

        RunningJob running = current;
        if (running != null && running.jobId().equals(jobId)) {
            running.source().cancel();
            trace("Job " + jobId.getValue() + " cancellation requested while running");
            return true;
        }
        return false;
    }

    /**
     * 적재된 콜백 실행 (drain 스레드).
     *
     * <p>호출 시점에 적재되어 있던 콜백만 적재 순서대로 최대 maxCallbacks개 실행한 뒤, 로그 큐를 비웁니다.
     * drain 도중 루프 스레드가 새로 적재한 콜백은 다음 drain에서 실행됩니다.
     * 콜백이 던진 예외는 로그로 남기고 다음 콜백을 계속 실행합니다.</p>
     *
     * @param maxCallbacks 최대 실행 개수 (양수)
     * @return 실행한 콜백 수
     * @throws IllegalArgumentException maxCallbacks가 양수가 아닌 경우
     */
    public int drain(int maxCallbacks) {
        if (maxCallbacks <= 0) {
            throw new IllegalArgumentException("maxCallbacks must be positive (current: " + maxCallbacks + ")");
        }
        int limit = Math.min(maxCallbacks, pendingCallbackCount());
        int invoked = 0;
        while (invoked < limit) {
            Runnable action = actions.poll();
            if (action == null) {
                break;
            }
            pendingActions.decrementAndGet();
            invoked++;
            try {
                action.run();
            } catch (Exception e) {
                log.error("Callback failed on {}", name, e);
            }
        }
        flushLog();
        return invoked;
    }

    /**
     * 정상 종료 요청.
     *
     * <p>새 Envelope을 받지 않으며, 루프는 남은 대기 큐를 모두 실행한 뒤 종료합니다.</p>
     */
    public void stop() {
        lock.lock();
        try {
            accepting = false;
            stopRequested = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("JobWorker {} stop requested ({} queued jobs will still run)", name, pendingJobCount());
    }

    /**
     * 즉시 종료 신호 (대기하지 않음).
     *
     * <p>새 Envelope을 거부하고, 루프 취소 소스에 신호를 보내고, 대기 큐의 Envelope을 실행하지 않고 폐기합니다.
     * 실행 중인 Job은 취소 토큰을 통해서만 중단을 요청받습니다.</p>
     *
     * @return 폐기한 Envelope 수
     */
    public int signalShutdown() {
        List<JobEnvelope<?>> abandoned;
        lock.lock();
        try {
            accepting = false;
            stopRequested = true;
            loopSource.cancel();
            abandoned = new ArrayList<>(queue);
            queue.clear();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        for (JobEnvelope<?> envelope : abandoned) {
            abandon(envelope);
        }
        if (!abandoned.isEmpty()) {
            log.info("JobWorker {} abandoned {} queued jobs", name, abandoned.size());
        }
        return abandoned.size();
    }

    /**
     * 루프 스레드 종료 대기.
     *
     * <p>timeout 안에 종료되지 않으면 경고를 남기고 false를 반환합니다. 스레드를 중단시키지는 않습니다.</p>
     *
     * @param timeout 최대 대기 시간
     * @return 스레드가 종료되었거나 시작된 적이 없으면 true
     */
    public boolean awaitTermination(Duration timeout) {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        Thread loop = thread;
        if (loop == null) {
            return true;
        }
        if (loop == Thread.currentThread()) {
            log.warn("JobWorker {} cannot await its own termination", name);
            return false;
        }
        try {
            loop.join(Math.max(1L, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (loop.isAlive()) {
            log.warn("JobWorker {} did not stop within {}ms; detaching thread", name, timeout.toMillis());
            return false;
        }
        return true;
    }

    /**
     * 종료 (멱등).
     *
     * <p>{@link #signalShutdown()} 후 {@link #awaitTermination(Duration)}.</p>
     *
     * @param timeout 최대 대기 시간
     * @return 스레드가 시간 안에 종료되었으면 true
     */
    public boolean dispose(Duration timeout) {
        if (disposed.compareAndSet(false, true)) {
            signalShutdown();
        }
        return awaitTermination(timeout);
    }

    /**
     * 설정된 shutdownTimeoutMs로 종료.
     *
     * @return 스레드가 시간 안에 종료되었으면 true
     */
    public boolean dispose() {
        return dispose(Duration.ofMillis(config.shutdownTimeoutMs()));
    }

    @Override
    public void post(Outcome<?> outcome, Runnable callback) {
        if (outcome.isTerminal()) {
            completionListener.accept(outcome.jobId());
        }
        actions.add(callback);
        pendingActions.incrementAndGet();
    }

    @Override
    public void trace(String message) {
        logLines.add(new LogLine(false, message));
    }

    @Override
    public void warn(String message) {
        logLines.add(new LogLine(true, message));
    }

    public String name() {
        return name;
    }

    public boolean isBusy() {
        return busy;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 새 Envelope을 받을 수 있는 상태인지 확인.
     *
     * @return 시작되었고 종료가 시작되지 않았으면 true
     */
    public boolean isAccepting() {
        return accepting;
    }

    /**
     * 실행 중인 Job 없이 대기 큐도 비어 있는지 확인.
     *
     * @return 유휴 상태이면 true
     */
    public boolean isIdle() {
        return !busy && pendingJobCount() == 0;
    }

    public int pendingJobCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int pendingCallbackCount() {
        return Math.max(0, pendingActions.get());
    }

    private void runLoop() {
        try {
            while (true) {
                JobEnvelope<?> envelope = take();
                if (envelope == null) {
                    break;
                }
                process(envelope);
            }
        } finally {
            busy = false;
            running = false;
            log.info("JobWorker {} loop exited", name);
        }
    }

    /**
     * 다음 Envelope 꺼내기. 루프를 끝내야 하면 null.
     */
    private JobEnvelope<?> take() {
        lock.lock();
        try {
            while (queue.isEmpty()) {
                if (stopRequested || loopSource.isCancellationRequested()) {
                    return null;
                }
                notEmpty.await();
            }
            if (loopSource.isCancellationRequested()) {
                return null;
            }
            JobEnvelope<?> next = queue.pollFirst();
            busy = true;
            current = new RunningJob(next.id(), CancellationSource.linkedTo(loopSource));
            return next;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("JobWorker {} interrupted while waiting for work; exiting loop", name);
            return null;
        } finally {
            lock.unlock();
        }
    }

    private void process(JobEnvelope<?> envelope) {
        CancellationSource source = current.source();
        long startedAt = System.nanoTime();
        try {
            envelope.execute(this, source.token());
            trace("Job " + envelope.id().getValue() + " (" + envelope.mode() + ") completed in "
                + elapsedMillis(startedAt) + "ms");
        } catch (Throwable t) {
            if (envelope.fail(this, t)) {
                trace("Job " + envelope.id().getValue() + " (" + envelope.mode() + ") failed after "
                    + elapsedMillis(startedAt) + "ms: " + t);
            } else {
                warn("Job " + envelope.id().getValue() + " threw after its outcome was published: " + t);
            }
        } finally {
            current = null;
            busy = false;
        }
    }

    private void abandon(JobEnvelope<?> envelope) {
        if (!envelope.cancelBeforeStart(this)) {
            completionListener.accept(envelope.id());
        }
    }

    private void flushLog() {
        LogLine line;
        while ((line = logLines.poll()) != null) {
            if (line.warn()) {
                log.warn("[{}] {}", name, line.message());
            } else {
                log.debug("[{}] {}", name, line.message());
            }
        }
    }

    private static long elapsedMillis(long startedAtNanos) {
        return (System.nanoTime() - startedAtNanos) / 1_000_000L;
    }

    @Override
    public String toString() {
        return "JobWorker{name=" + name + ", running=" + running + ", busy=" + busy
            + ", queued=" + pendingJobCount() + ", pendingCallbacks=" + pendingCallbackCount() + "}";
    }

    private record RunningJob(JobId jobId, CancellationSource source) {
    }

    private record LogLine(boolean warn, String message) {
    }
}
