package com.ryuqq.loadguard.core.model;

import java.util.UUID;

/**
 * Deferred Task의 불투명 핸들.
 *
 * <p>작업 제출 시 발급되며, 이후 상태 조회 및 취소에 사용됩니다.
 * 호출자는 값의 구조에 의존해서는 안 됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용 (URL 경로에 그대로 사용 가능)</li>
 * </ul>
 *
 * @author LoadGuard Team
 * @since 1.0.0
 */
public final class TaskHandle {

    private final String value;

    private TaskHandle(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TaskHandle cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("TaskHandle length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("TaskHandle contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * 기존 값으로 TaskHandle 복원 (예: 상태 조회 URL 경로 변수).
     *
     * @param value 핸들 값
     * @return TaskHandle 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TaskHandle of(String value) {
        return new TaskHandle(value);
    }

    /**
     * 새 TaskHandle 발급 (UUID 기반).
     *
     * @return 새 TaskHandle
     */
    public static TaskHandle generate() {
        return new TaskHandle(UUID.randomUUID().toString());
    }

    /**
     * 핸들 값 조회.
     *
     * @return 핸들 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskHandle that = (TaskHandle) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TaskHandle{" + value + '}';
    }
}
