package com.ryuqq.procedure.adapter.runner;

/**
 * WorkQueue 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: 작업 스레드 이름 접두사 (기본 "work-queue")</li>
 *   <li>concurrency: 작업 스레드 수 (기본 8)</li>
 *   <li>shutdownTimeoutMs: graceful shutdown 대기 시간 (기본 60000ms = 60초)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>CPU 위주 Task: concurrency를 코어 수 근처로</li>
 *   <li>블로킹 I/O Task: concurrency 증가 (8 → 32)</li>
 *   <li>테스트: shutdownTimeoutMs 감소 (60000 → 5000)</li>
 * </ul>
 *
 * @author Procedure Team
 * @since 1.0.0
 * @param name 스레드 이름 접두사 (null 또는 공백 불가)
 * @param concurrency 작업 스레드 수 (1 이상이어야 함)
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 양수여야 함)
 */
public record WorkQueueConfig(
    String name,
    int concurrency,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: name="work-queue", concurrency=8, shutdownTimeoutMs=60000ms</p>
     */
    public WorkQueueConfig() {
        this("work-queue", 8, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public WorkQueueConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public WorkQueueConfig withName(String name) {
        return new WorkQueueConfig(name, concurrency, shutdownTimeoutMs);
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public WorkQueueConfig withConcurrency(int concurrency) {
        return new WorkQueueConfig(name, concurrency, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public WorkQueueConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new WorkQueueConfig(name, concurrency, shutdownTimeoutMs);
    }
}
