/**
 * Drain point 인터페이스.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.jobpool.application.drain.DrainPoint} - 콜백/로그를 소비 스레드에서 비우는 인터페이스</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code WorkerPool}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.jobpool.application.drain;
