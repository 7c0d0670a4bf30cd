/**
 * 한 줄 제출 헬퍼.
 *
 * @since 1.0.0
 */
package com.ryuqq.jobpool.application.quick;
