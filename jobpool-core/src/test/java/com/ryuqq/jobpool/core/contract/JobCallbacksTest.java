package com.ryuqq.jobpool.core.contract;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobCallbacks 테스트.
 *
 * @author JobPool Team
 * @since 1.0.0
 */
class JobCallbacksTest {

    @Test
    void constructor_NullCallbacks_ReplacedWithNoOps() {
        // When
        JobCallbacks<String> callbacks = JobCallbacks.none();

        // Then
        assertNotNull(callbacks.onResult());
        assertNotNull(callbacks.onProgress());
        assertNotNull(callbacks.onComplete());
        assertNotNull(callbacks.onError());
        assertDoesNotThrow(() -> {
            callbacks.onResult().accept("x");
            callbacks.onProgress().accept("y");
            callbacks.onComplete().run();
            callbacks.onError().accept(new RuntimeException());
        });
        assertFalse(callbacks.notifyOnCancel());
    }

    @Test
    void oneShot_WiresResultAndError() {
        // Given
        List<String> events = new ArrayList<>();

        // When
        JobCallbacks<String> callbacks = JobCallbacks.oneShot(v -> events.add("result:" + v), e -> events.add("error"));
        callbacks.onResult().accept("a");
        callbacks.onError().accept(new RuntimeException());

        // Then
        assertEquals(List.of("result:a", "error"), events);
    }

    @Test
    void withCancellationNotice_KeepsCallbacksAndSetsFlag() {
        // Given
        List<String> events = new ArrayList<>();
        JobCallbacks<Integer> original = JobCallbacks.streaming(v -> events.add("p" + v), () -> events.add("done"), null);

        // When
        JobCallbacks<Integer> copy = original.withCancellationNotice();
        copy.onProgress().accept(1);
        copy.onComplete().run();

        // Then
        assertTrue(copy.notifyOnCancel());
        assertFalse(original.notifyOnCancel());
        assertEquals(List.of("p1", "done"), events);
    }

    @Test
    void withCompletionAndErrorHandler_ReplaceOnlyThatCallback() {
        // Given
        List<String> events = new ArrayList<>();
        JobCallbacks<Integer> original = JobCallbacks.oneShot(v -> events.add("r" + v), null);

        // When
        JobCallbacks<Integer> copy = original
            .withCompletion(() -> events.add("complete"))
            .withErrorHandler(e -> events.add("error"));
        copy.onResult().accept(3);
        copy.onComplete().run();
        copy.onError().accept(new RuntimeException());

        // Then
        assertEquals(List.of("r3", "complete", "error"), events);
    }
}
