/**
 * Value objects shared by every JobPool module.
 *
 * <ul>
 *   <li>{@link com.ryuqq.jobpool.core.model.JobId} - process-unique job identity</li>
 *   <li>{@link com.ryuqq.jobpool.core.model.RejectionReason} - why a submission was refused</li>
 * </ul>
 *
 * @since 1.0.0
 * @author JobPool Team
 */
package com.ryuqq.jobpool.core.model;
