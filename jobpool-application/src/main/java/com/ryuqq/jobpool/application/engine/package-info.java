/**
 * Submission surface of the job engine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobpool.application.engine.JobEngine} - submit, cancel, stats, shutdown</li>
 *   <li>{@link com.ryuqq.jobpool.application.engine.SubmissionHandle} - accepted or rejected</li>
 *   <li>{@link com.ryuqq.jobpool.application.engine.PoolStats} - point-in-time snapshot</li>
 *   <li>{@link com.ryuqq.jobpool.application.engine.JobEngines} - explicit process-wide default</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (WorkerPool, JobWorker)
 *   ↓ implements
 * application (JobEngine, DrainPoint)
 *   ↓ depends on
 * core (Job, JobEnvelope, JobCallbacks, Outcome, JobId)
 * </pre>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
package com.ryuqq.jobpool.application.engine;
