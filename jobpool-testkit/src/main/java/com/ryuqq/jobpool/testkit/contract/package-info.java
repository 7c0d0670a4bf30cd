/**
 * Contract test infrastructure for {@link com.ryuqq.jobpool.application.engine.JobEngine} implementations.
 *
 * @since 1.0.0
 */
package com.ryuqq.jobpool.testkit.contract;
