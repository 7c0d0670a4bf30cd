package com.ryuqq.jobpool.core.model;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 제출된 Job의 프로세스 내 고유 식별자.
 *
 * <p>JobId는 제출 시점에 생성되어 Envelope 수명 동안 변하지 않으며,
 * 취소(cancel) 조회의 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author JobPool Team
 * @since 1.0.0
 */
public final class JobId {

    private static final int MAX_LENGTH = 64;
    private static final Pattern ALLOWED = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    private final String value;

    private JobId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("JobId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("JobId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new IllegalArgumentException("JobId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * 기존 값으로 JobId 생성.
     *
     * @param value JobId 값
     * @return JobId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static JobId of(String value) {
        return new JobId(value);
    }

    /**
     * 새 JobId 생성 (UUID 기반).
     *
     * @return 새로 발급된 JobId
     */
    public static JobId generate() {
        return new JobId(UUID.randomUUID().toString());
    }

    /**
     * JobId 값 조회.
     *
     * @return JobId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobId jobId = (JobId) o;
        return value.equals(jobId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "JobId{" + value + '}';
    }
}
