package com.ryuqq.jobpool.core.cancel;

/**
 * 취소 신호의 발신 측.
 *
 * <p>{@link #cancel()}은 멱등이며, 한 번 취소되면 되돌릴 수 없습니다.
 * 부모 소스에 연결된 경우 부모의 취소도 이 소스의 취소로 관찰됩니다.
 * (Worker 루프 취소 → 실행 중인 Job 취소)</p>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public final class CancellationSource implements CancellationToken {

    private final CancellationToken parent;
    private volatile boolean cancelled;

    /**
     * 독립 소스 생성.
     */
    public CancellationSource() {
        this(CancellationToken.NONE);
    }

    private CancellationSource(CancellationToken parent) {
        this.parent = parent;
    }

    /**
     * 부모 토큰에 연결된 소스 생성.
     *
     * @param parent 부모 토큰
     * @return 연결된 CancellationSource
     * @throws IllegalArgumentException parent가 null인 경우
     */
    public static CancellationSource linkedTo(CancellationToken parent) {
        if (parent == null) {
            throw new IllegalArgumentException("parent cannot be null");
        }
        return new CancellationSource(parent);
    }

    /**
     * 취소 요청.
     */
    public void cancel() {
        cancelled = true;
    }

    /**
     * Job 본문에 전달할 토큰.
     *
     * @return 이 소스를 관찰하는 토큰
     */
    public CancellationToken token() {
        return this;
    }

    @Override
    public boolean isCancellationRequested() {
        return cancelled || parent.isCancellationRequested();
    }
}
