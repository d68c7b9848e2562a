package com.ryuqq.procedure.core.model;

/**
 * Task가 누적하는 도메인 오류 값.
 *
 * <p>오류는 취소, 전제조건 실패, 실행 실패 등 모든 경로에서 Task의 오류 목록에 추가되며,
 * 어떤 경로로 종료되든 did-finish 관찰자에게 빠짐없이 전달됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>TaskError.of("PAY-001", "잔액 부족")</li>
 *   <li>TaskError.cancelled("사용자 요청")</li>
 *   <li>TaskError.fromException(e) - execute() 에서 던져진 예외</li>
 * </ul>
 *
 * @param code 오류 코드 (예: TASK-CANCELLED, CONDITION-FAILED)
 * @param message 오류 메시지
 * @param cause 원인 예외 (선택, null 가능)
 *
 * @author Procedure Team
 * @since 1.0.0
 */
public record TaskError(
    String code,
    String message,
    Throwable cause
) {

    public static final String EXECUTION_FAILED = "TASK-EXECUTION";
    public static final String CANCELLED = "TASK-CANCELLED";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code 또는 message가 null이거나 빈 문자열인 경우
     */
    public TaskError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static TaskError of(String code, String message) {
        return new TaskError(code, message, null);
    }

    public static TaskError of(String code, String message, Throwable cause) {
        return new TaskError(code, message, cause);
    }

    /**
     * 예외로부터 TaskError 생성.
     *
     * <p>메시지가 없는 예외는 예외 클래스 이름을 메시지로 사용합니다.</p>
     *
     * @param throwable 원인 예외
     * @return EXECUTION_FAILED 코드의 TaskError
     * @throws IllegalArgumentException throwable이 null인 경우
     */
    public static TaskError fromException(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            message = throwable.getClass().getName();
        }
        return new TaskError(EXECUTION_FAILED, message, throwable);
    }

    public static TaskError cancelled(String reason) {
        return new TaskError(CANCELLED, reason, null);
    }
}
