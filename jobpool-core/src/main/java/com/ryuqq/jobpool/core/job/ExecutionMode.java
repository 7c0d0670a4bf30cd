package com.ryuqq.jobpool.core.job;

/**
 * Job 실행 형태.
 *
 * <p>Job이 생성되면 실행 형태는 바뀌지 않습니다.</p>
 *
 * <pre>
 *                 one-shot        streaming
 *   synchronous   SYNC            SYNC_STREAMING
 *   asynchronous  ASYNC           ASYNC_STREAMING
 * </pre>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public enum ExecutionMode {

    /**
     * Worker 스레드에서 즉시 실행되어 하나의 값을 반환.
     */
    SYNC,

    /**
     * CompletionStage를 반환하며, Worker는 완료될 때까지 대기.
     */
    ASYNC,

    /**
     * Worker 스레드에서 실행되며 진행 값을 0회 이상 방출.
     */
    SYNC_STREAMING,

    /**
     * CompletionStage를 반환하며 진행 값을 0회 이상 방출.
     */
    ASYNC_STREAMING;

    /**
     * 스트리밍 형태인지 확인.
     *
     * @return SYNC_STREAMING 또는 ASYNC_STREAMING인 경우 true
     */
    public boolean isStreaming() {
        return this == SYNC_STREAMING || this == ASYNC_STREAMING;
    }

    /**
     * 비동기 형태인지 확인.
     *
     * @return ASYNC 또는 ASYNC_STREAMING인 경우 true
     */
    public boolean isAsync() {
        return this == ASYNC || this == ASYNC_STREAMING;
    }
}
