package com.ryuqq.jobpool.core.job;

/**
 * 스트리밍 Job이 진행 값을 내보내는 통로.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>emit(): 0회 이상, 호출 순서대로 onProgress에 전달</li>
 *   <li>complete(): 최대 1회 의미를 가지며, 두 번째 호출부터는 무시</li>
 *   <li>complete() 이후의 emit()은 무시</li>
 * </ul>
 *
 * @param <T> 진행 값 타입
 * @author JobPool Team
 * @since 1.0.0
 */
public interface ProgressSink<T> {

    /**
     * 진행 값 방출.
     *
     * @param value 진행 값
     */
    void emit(T value);

    /**
     * 스트림 종료 알림.
     */
    void complete();
}
