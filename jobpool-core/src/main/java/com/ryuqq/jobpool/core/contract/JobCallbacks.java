package com.ryuqq.jobpool.core.contract;

import java.util.function.Consumer;

/**
 * 제출자가 등록한 콜백 묶음 (불변 record).
 *
 * <p>모든 콜백은 drain 스레드에서만 호출됩니다. null로 전달된 콜백은 아무 동작도 하지 않는 콜백으로 대체됩니다.</p>
 *
 * <p><strong>호출 규칙 (Envelope 당):</strong></p>
 * <ul>
 *   <li>one-shot: onResult 1회 → onComplete 1회, 또는 onError 1회</li>
 *   <li>streaming: onProgress 0회 이상 → onComplete 1회, 또는 onProgress 0회 이상 → onError 1회</li>
 *   <li>큐 대기 중 취소: 기본적으로 아무 콜백도 호출되지 않음.
 *       notifyOnCancel=true이면 onError에 {@code JobCancelledException} 전달</li>
 * </ul>
 *
 * @param onResult one-shot 결과 콜백
 * @param onProgress 스트리밍 진행 값 콜백
 * @param onComplete 종료 콜백
 * @param onError 실패 콜백
 * @param notifyOnCancel 큐 대기 중 취소 시 onError 호출 여부
 * @param <T> 결과(또는 진행 값) 타입
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public record JobCallbacks<T>(
    Consumer<? super T> onResult,
    Consumer<? super T> onProgress,
    Runnable onComplete,
    Consumer<? super Throwable> onError,
    boolean notifyOnCancel
) {

    /**
     * Compact Constructor (null 콜백을 no-op으로 대체).
     */
    public JobCallbacks {
        if (onResult == null) {
            onResult = value -> { };
        }
        if (onProgress == null) {
            onProgress = value -> { };
        }
        if (onComplete == null) {
            onComplete = () -> { };
        }
        if (onError == null) {
            onError = error -> { };
        }
    }

    /**
     * one-shot Job용 콜백 생성.
     *
     * @param onResult 결과 콜백
     * @param onError 실패 콜백
     * @param <T> 결과 타입
     * @return JobCallbacks
     */
    public static <T> JobCallbacks<T> oneShot(Consumer<? super T> onResult, Consumer<? super Throwable> onError) {
        return new JobCallbacks<>(onResult, null, null, onError, false);
    }

    /**
     * 스트리밍 Job용 콜백 생성.
     *
     * @param onProgress 진행 값 콜백
     * @param onComplete 스트림 종료 콜백
     * @param onError 실패 콜백
     * @param <T> 진행 값 타입
     * @return JobCallbacks
     */
    public static <T> JobCallbacks<T> streaming(Consumer<? super T> onProgress, Runnable onComplete,
                                                Consumer<? super Throwable> onError) {
        return new JobCallbacks<>(null, onProgress, onComplete, onError, false);
    }

    /**
     * 콜백 없음 (fire-and-forget).
     *
     * @param <T> 결과 타입
     * @return 모든 콜백이 no-op인 JobCallbacks
     */
    public static <T> JobCallbacks<T> none() {
        return new JobCallbacks<>(null, null, null, null, false);
    }

    /**
     * onComplete만 변경한 새 인스턴스 생성.
     */
    public JobCallbacks<T> withCompletion(Runnable onComplete) {
        return new JobCallbacks<>(onResult, onProgress, onComplete, onError, notifyOnCancel);
    }

    /**
     * onError만 변경한 새 인스턴스 생성.
     */
    public JobCallbacks<T> withErrorHandler(Consumer<? super Throwable> onError) {
        return new JobCallbacks<>(onResult, onProgress, onComplete, onError, notifyOnCancel);
    }

    /**
     * 큐 대기 중 취소도 onError로 통보받는 새 인스턴스 생성.
     */
    public JobCallbacks<T> withCancellationNotice() {
        return new JobCallbacks<>(onResult, onProgress, onComplete, onError, true);
    }
}
