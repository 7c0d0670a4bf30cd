/**
 * Cooperative cancellation primitives.
 *
 * <p>A {@link com.ryuqq.jobpool.core.cancel.CancellationSource} is owned by the engine;
 * job bodies only ever see the {@link com.ryuqq.jobpool.core.cancel.CancellationToken}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.jobpool.core.cancel;
