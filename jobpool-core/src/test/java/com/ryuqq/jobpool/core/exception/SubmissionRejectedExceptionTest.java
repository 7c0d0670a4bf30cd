package com.ryuqq.jobpool.core.exception;

import com.ryuqq.jobpool.core.model.RejectionReason;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 예외 타입 테스트.
 *
 * @author JobPool Team
 * @since 1.0.0
 */
class SubmissionRejectedExceptionTest {

    @Test
    void constructor_QueueFull_CarriesReasonAndMessage() {
        // When
        SubmissionRejectedException exception = new SubmissionRejectedException(RejectionReason.QUEUE_FULL);

        // Then
        assertEquals(RejectionReason.QUEUE_FULL, exception.getReason());
        assertTrue(exception.getMessage().contains("queue is full"));
    }

    @Test
    void constructor_NullReason_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new SubmissionRejectedException(null));
    }

    @Test
    void jobCancelledException_IsCancellationException() {
        // When
        JobCancelledException exception = new JobCancelledException("cancelled");

        // Then
        assertInstanceOf(CancellationException.class, exception);
        assertEquals("cancelled", exception.getMessage());
    }
}
