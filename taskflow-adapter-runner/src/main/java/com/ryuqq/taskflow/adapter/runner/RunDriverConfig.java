package com.ryuqq.taskflow.adapter.runner;

/**
 * Run Driver 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>deadlineMs: Run 전체 deadline (기본 30000ms, 허용 범위 10 ~ 600000ms)</li>
 *   <li>shutdownGraceMs: shutdown 시 진행 중인 Run을 기다리는 시간 (기본 5000ms)</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 * @param deadlineMs Run deadline (밀리초)
 * @param shutdownGraceMs shutdown 대기 시간 (밀리초, 0 이상)
 */
public record RunDriverConfig(long deadlineMs, long shutdownGraceMs) {

    public static final long MIN_DEADLINE_MS = 10;
    public static final long MAX_DEADLINE_MS = 600_000;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: deadlineMs=30000ms, shutdownGraceMs=5000ms</p>
     */
    public RunDriverConfig() {
        this(30_000, 5_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RunDriverConfig {
        validateDeadline(deadlineMs);
        if (shutdownGraceMs < 0) {
            throw new IllegalArgumentException(
                "shutdownGraceMs must be non-negative (current: " + shutdownGraceMs + ")"
            );
        }
    }

    /**
     * deadline 허용 범위 검증.
     *
     * @param deadlineMs 검증할 deadline (밀리초)
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public static void validateDeadline(long deadlineMs) {
        if (deadlineMs < MIN_DEADLINE_MS || deadlineMs > MAX_DEADLINE_MS) {
            throw new IllegalArgumentException(
                String.format("deadlineMs must be between %d and %d ms (current: %d)",
                    MIN_DEADLINE_MS, MAX_DEADLINE_MS, deadlineMs));
        }
    }

    /**
     * deadlineMs만 변경한 새 인스턴스 생성.
     *
     * @param deadlineMs 새 deadline (밀리초)
     * @return 새 RunDriverConfig 인스턴스
     */
    public RunDriverConfig withDeadlineMs(long deadlineMs) {
        return new RunDriverConfig(deadlineMs, this.shutdownGraceMs);
    }

    /**
     * shutdownGraceMs만 변경한 새 인스턴스 생성.
     *
     * @param shutdownGraceMs 새 shutdown 대기 시간 (밀리초)
     * @return 새 RunDriverConfig 인스턴스
     */
    public RunDriverConfig withShutdownGraceMs(long shutdownGraceMs) {
        return new RunDriverConfig(this.deadlineMs, shutdownGraceMs);
    }
}
