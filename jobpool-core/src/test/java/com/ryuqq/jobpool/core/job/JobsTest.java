package com.ryuqq.jobpool.core.job;

import com.ryuqq.jobpool.core.cancel.CancellationToken;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Jobs 팩토리 및 ExecutionMode 테스트.
 *
 * @author JobPool Team
 * @since 1.0.0
 */
class JobsTest {

    @Test
    void factories_AssignExpectedModes() {
        // Then
        assertEquals(ExecutionMode.SYNC, Jobs.<String>sync(token -> "v").mode());
        assertEquals(ExecutionMode.ASYNC,
            Jobs.<String>async(token -> CompletableFuture.completedFuture("v")).mode());
        assertEquals(ExecutionMode.SYNC_STREAMING, Jobs.<String>streaming((sink, token) -> { }).mode());
        assertEquals(ExecutionMode.ASYNC_STREAMING,
            Jobs.<String>asyncStreaming((sink, token) -> CompletableFuture.completedFuture(null)).mode());
    }

    @Test
    void fromCallable_DelegatesToCallable() throws Exception {
        // Given
        SyncJob<Integer> job = Jobs.fromCallable(() -> 7);

        // When
        Integer result = job.execute(CancellationToken.NONE);

        // Then
        assertEquals(7, result);
    }

    @Test
    void sync_NullJob_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Jobs.sync(null));
    }

    @Test
    void executionMode_Flags() {
        // Then
        assertTrue(ExecutionMode.SYNC_STREAMING.isStreaming());
        assertTrue(ExecutionMode.ASYNC_STREAMING.isAsync());
        assertFalse(ExecutionMode.SYNC.isStreaming());
        assertFalse(ExecutionMode.SYNC_STREAMING.isAsync());
        assertTrue(ExecutionMode.ASYNC.isAsync());
    }
}
