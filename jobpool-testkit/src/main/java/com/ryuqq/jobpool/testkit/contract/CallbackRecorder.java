package com.ryuqq.jobpool.testkit.contract;

import com.ryuqq.jobpool.core.contract.JobCallbacks;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Records every callback delivered for one or more jobs.
 *
 * <p>Each delivery is appended to a single ordered event log ({@code result(x)}, {@code progress(x)},
 * {@code complete()}, {@code error(Type)}) and the delivering thread is remembered, so tests can
 * assert both callback order and the drain-thread guarantee.</p>
 *
 * <p>All methods are thread-safe.</p>
 *
 * @param <T> result or progress value type
 * @author JobPool Team
 * @since 1.0.0
 */
public final class CallbackRecorder<T> {

    private final List<String> events = new ArrayList<>();
    private final List<T> results = new ArrayList<>();
    private final List<T> progress = new ArrayList<>();
    private final List<Throwable> errors = new ArrayList<>();
    private final Set<Thread> callbackThreads = new HashSet<>();
    private int completions;

    /**
     * Callbacks for a one-shot job (onResult, onComplete, onError).
     *
     * @return JobCallbacks wired to this recorder
     */
    public JobCallbacks<T> oneShot() {
        return new JobCallbacks<>(this::onResult, null, this::onComplete, this::onError, false);
    }

    /**
     * Callbacks for a streaming job (onProgress, onComplete, onError).
     *
     * @return JobCallbacks wired to this recorder
     */
    public JobCallbacks<T> streaming() {
        return new JobCallbacks<>(null, this::onProgress, this::onComplete, this::onError, false);
    }

    /**
     * Callbacks recording every hook, including an onResult sink for streaming jobs
     * (which must never fire).
     *
     * @return JobCallbacks wired to this recorder
     */
    public JobCallbacks<T> all() {
        return new JobCallbacks<>(this::onResult, this::onProgress, this::onComplete, this::onError, false);
    }

    public synchronized void onResult(T value) {
        record("result(" + value + ")");
        results.add(value);
    }

    public synchronized void onProgress(T value) {
        record("progress(" + value + ")");
        progress.add(value);
    }

    public synchronized void onComplete() {
        record("complete()");
        completions++;
    }

    public synchronized void onError(Throwable error) {
        record("error(" + error.getClass().getSimpleName() + ")");
        errors.add(error);
    }

    public synchronized List<String> events() {
        return List.copyOf(events);
    }

    public synchronized List<T> results() {
        return Collections.unmodifiableList(new ArrayList<>(results));
    }

    public synchronized List<T> progress() {
        return Collections.unmodifiableList(new ArrayList<>(progress));
    }

    public synchronized List<Throwable> errors() {
        return List.copyOf(errors);
    }

    public synchronized int completions() {
        return completions;
    }

    /**
     * Number of terminal deliveries (onComplete or onError).
     */
    public synchronized int terminalCount() {
        return completions + errors.size();
    }

    public synchronized Set<Thread> callbackThreads() {
        return Set.copyOf(callbackThreads);
    }

    private void record(String event) {
        events.add(event);
        callbackThreads.add(Thread.currentThread());
    }
}
