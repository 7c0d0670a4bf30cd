package com.ryuqq.jobpool.application.drain;

/**
 * Callback Drain Point.
 *
 * <p>This interface is the only path through which job callbacks run. The host calls
 * {@link #drain(int)} periodically (typically once per tick) from its single designated thread.</p>
 *
 * <p><strong>Drain Operation Flow:</strong></p>
 * <pre>
 * drain(maxCallbacksPerWorker)
 *   ↓
 * for each worker:
 *   1. Pop up to maxCallbacksPerWorker callback thunks (FIFO)
 *   2. Invoke each thunk (exceptions are logged, never rethrown)
 *   3. Flush the worker's diagnostic log lines to the logger
 * </pre>
 *
 * <p><strong>Threading Contract:</strong></p>
 * <ul>
 *   <li>The first thread that drains becomes the designated consumer thread</li>
 *   <li>A drain from any other thread does nothing and returns 0</li>
 *   <li>Thunks never run concurrently with each other</li>
 *   <li>Thunks of one worker run in the order they were enqueued; no cross-worker ordering</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * // host frame loop
 * while (running) {
 *     updateFrame();
 *     engine.drain(10); // bound per-tick callback latency
 * }
 * </pre>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public interface DrainPoint {

    /**
     * No per-call cap.
     */
    int UNBOUNDED = Integer.MAX_VALUE;

    /**
     * Drains every queued callback.
     *
     * @return number of callbacks invoked
     */
    default int drain() {
        return drain(UNBOUNDED);
    }

    /**
     * Drains at most {@code maxCallbacksPerWorker} callbacks from each worker.
     *
     * @param maxCallbacksPerWorker per-worker cap for this call (must be positive)
     * @return number of callbacks invoked
     * @throws IllegalArgumentException if maxCallbacksPerWorker is not positive
     */
    int drain(int maxCallbacksPerWorker);
}
