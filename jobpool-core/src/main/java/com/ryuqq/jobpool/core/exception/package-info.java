/**
 * 엔진이 제출자에게 데이터로 전달하는 예외 타입.
 *
 * <p>이 예외들은 스레드 경계를 넘어 던져지지 않고, onError 콜백의 인자로만 전달됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.jobpool.core.exception;
