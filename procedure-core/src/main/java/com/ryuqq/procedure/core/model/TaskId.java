package com.ryuqq.procedure.core.model;

import java.util.UUID;

/**
 * Task의 고유 식별자.
 *
 * <p>TaskId는 로그와 관찰자 기록에서 Task를 추적하는 데 사용됩니다.
 * Task 인스턴스 자체는 동일성(identity)으로 비교되며, TaskId는 사람이 읽을 수 있는 추적용 값입니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public final class TaskId {

    private final String value;

    private TaskId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TaskId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("TaskId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("TaskId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * TaskId 생성.
     *
     * @param value TaskId 값
     * @return TaskId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TaskId of(String value) {
        return new TaskId(value);
    }

    /**
     * UUID 기반 TaskId 생성.
     *
     * @return 새 TaskId
     */
    public static TaskId generate() {
        return new TaskId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    /**
     * 로그 출력용 짧은 값 (앞 8자).
     *
     * @return 축약된 값
     */
    public String shortValue() {
        return value.length() <= 8 ? value : value.substring(0, 8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskId taskId = (TaskId) o;
        return value.equals(taskId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TaskId{" + value + '}';
    }
}
