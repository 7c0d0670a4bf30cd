/**
 * Job model.
 *
 * <h2>Sealed hierarchy</h2>
 * <pre>
 * Job&lt;T&gt;
 *   ├─ OneShotJob&lt;T&gt;   ─ SyncJob, AsyncJob
 *   └─ StreamingJob&lt;T&gt; ─ SyncStreamingJob, AsyncStreamingJob
 * </pre>
 *
 * <p>The four leaves are functional interfaces, so any lambda with the right shape is a job.</p>
 *
 * @since 1.0.0
 * @author JobPool Team
 */
package com.ryuqq.jobpool.core.job;
