package com.ryuqq.jobpool.core.contract;

import com.ryuqq.jobpool.core.outcome.Outcome;

/**
 * Worker 스레드에서 drain 스레드로 넘기는 출력 큐.
 *
 * <p>주 생산자는 Worker 루프이며 (비동기 스트리밍 Job과 대기 중 취소는 다른 스레드에서 적재할 수 있음),
 * 소비자는 drain 지점 하나입니다. 여기에 넣은 콜백과 로그는 drain 시점에 넣은 순서대로 처리됩니다.</p>
 *
 * <p>종료 Outcome(Ok, Done, Fail)의 적재는 해당 Job의 종료 시점으로 간주됩니다.</p>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public interface CallbackQueue {

    /**
     * Outcome 콜백 적재.
     *
     * @param outcome 콜백이 전달할 Outcome
     * @param callback drain 스레드에서 호출될 콜백
     */
    void post(Outcome<?> outcome, Runnable callback);

    /**
     * 진단 로그 적재 (DEBUG).
     *
     * @param message 로그 메시지
     */
    void trace(String message);

    /**
     * 진단 로그 적재 (WARN).
     *
     * @param message 로그 메시지
     */
    void warn(String message);
}
