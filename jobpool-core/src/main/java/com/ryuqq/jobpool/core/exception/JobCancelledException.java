package com.ryuqq.jobpool.core.exception;

import java.util.concurrent.CancellationException;

/**
 * Job이 취소되었음을 나타내는 예외.
 *
 * <p>협조적 취소를 관찰한 Job 본문이 던지거나, 큐 대기 중 취소된 Envelope의
 * 취소 알림으로 onError에 전달됩니다.</p>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public class JobCancelledException extends CancellationException {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param message 메시지
     */
    public JobCancelledException(String message) {
        super(message);
    }
}
