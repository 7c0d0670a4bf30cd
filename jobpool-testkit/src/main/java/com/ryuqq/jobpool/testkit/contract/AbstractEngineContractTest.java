package com.ryuqq.jobpool.testkit.contract;

import com.ryuqq.jobpool.adapter.runner.WorkerPool;
import com.ryuqq.jobpool.adapter.runner.WorkerPoolConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Abstract base class for engine contract tests.
 *
 * <p>Starts a fresh {@link WorkerPool} before each test and shuts it down afterwards.
 * The test thread is the drain thread: every helper that drains does so from the thread
 * running the test method.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractEngineContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         CallbackRecorder&lt;Integer&gt; recorder = new CallbackRecorder&lt;&gt;();
 *         pool.submit(Jobs.sync(token -&gt; 42), recorder.oneShot());
 *
 *         drainUntil(() -&gt; recorder.terminalCount() == 1);
 *     }
 * }
 * </pre>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public abstract class AbstractEngineContractTest {

    protected static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    protected WorkerPool pool;

    /**
     * Starts a pool built from {@link #poolConfig()}.
     */
    @BeforeEach
    void setUp() {
        pool = WorkerPool.start(poolConfig());
    }

    /**
     * Shuts the pool down so no worker thread outlives the test.
     */
    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown(Duration.ofSeconds(2));
        }
    }

    /**
     * Pool configuration for each test. Override to change worker count or capacity.
     *
     * @return pool configuration (default: 4 workers, capacity 1000)
     */
    protected WorkerPoolConfig poolConfig() {
        return new WorkerPoolConfig();
    }

    /**
     * Drains repeatedly until the condition holds, failing after {@link #DEFAULT_TIMEOUT}.
     *
     * @param condition condition to wait for
     */
    protected void drainUntil(BooleanSupplier condition) {
        drainUntil(condition, DEFAULT_TIMEOUT);
    }

    /**
     * Drains repeatedly until the condition holds, failing after timeout.
     *
     * @param condition condition to wait for
     * @param timeout maximum wait
     */
    protected void drainUntil(BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            pool.drain();
            if (condition.getAsBoolean()) {
                return;
            }
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + timeout.toMillis() + "ms; stats=" + pool.stats());
            }
            sleep(1);
        }
    }

    /**
     * Waits without draining until the condition holds, failing after {@link #DEFAULT_TIMEOUT}.
     *
     * @param condition condition to wait for
     */
    protected void awaitCondition(BooleanSupplier condition) {
        long deadline = System.nanoTime() + DEFAULT_TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + DEFAULT_TIMEOUT.toMillis() + "ms; stats=" + pool.stats());
            }
            sleep(1);
        }
    }

    /**
     * Waits on a latch from inside a job body.
     *
     * @param latch latch to await
     * @throws IllegalStateException if the latch is not released within {@link #DEFAULT_TIMEOUT}
     */
    protected static void await(CountDownLatch latch) throws InterruptedException {
        if (!latch.await(DEFAULT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new IllegalStateException("Latch was not released in time");
        }
    }

    /**
     * Sleeps for the specified duration.
     *
     * @param millis milliseconds to sleep
     */
    protected static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }
}
