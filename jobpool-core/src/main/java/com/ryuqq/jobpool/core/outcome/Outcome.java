package com.ryuqq.jobpool.core.outcome;

import com.ryuqq.jobpool.core.model.JobId;

/**
 * Worker가 Envelope 실행 중에 만들어 내는 사건.
 *
 * <p>Outcome은 네 가지 경우를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: one-shot Job의 결과 값 (onResult)</li>
 *   <li>{@link Progress}: 스트리밍 Job의 진행 값 (onProgress)</li>
 *   <li>{@link Done}: 스트림 종료 (onComplete)</li>
 *   <li>{@link Fail}: 실행 실패 또는 취소 (onError)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어, Envelope은 각 Outcome을 그 형태에 맞는 콜백 하나로만 변환합니다.
 * 결과를 Object로 저장해 두었다가 호출 시점에 캐스팅하는 일이 없습니다.</p>
 *
 * @param <T> 결과(또는 진행 값) 타입
 * @author JobPool Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Progress, Done, Fail {

    /**
     * 이 Outcome을 만든 Job의 ID.
     *
     * @return JobId
     */
    JobId jobId();

    /**
     * 종료 Outcome인지 확인.
     *
     * <p>종료 Outcome(Ok, Done, Fail) 이후에는 같은 Job에 대해 더 이상 Outcome이 전달되지 않습니다.</p>
     *
     * @return Progress가 아니면 true
     */
    default boolean isTerminal() {
        return !(this instanceof Progress);
    }

    /**
     * 실패 Outcome인지 확인.
     *
     * @return Fail인 경우 true
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
