/**
 * Job outcome package.
 *
 * <p>This package defines the sealed interface hierarchy of events a worker produces while
 * running one envelope.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobpool.core.outcome.Ok} - one-shot value</li>
 *   <li>{@link com.ryuqq.jobpool.core.outcome.Progress} - intermediate streaming value</li>
 *   <li>{@link com.ryuqq.jobpool.core.outcome.Done} - end of stream</li>
 *   <li>{@link com.ryuqq.jobpool.core.outcome.Fail} - execution failure or cancellation</li>
 * </ul>
 *
 * <p>Per envelope: zero or more {@code Progress}, then exactly one terminal outcome.</p>
 *
 * @since 1.0.0
 * @author JobPool Team
 */
package com.ryuqq.jobpool.core.outcome;
