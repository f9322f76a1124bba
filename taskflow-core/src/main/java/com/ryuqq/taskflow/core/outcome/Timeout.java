package com.ryuqq.taskflow.core.outcome;

/**
 * Run deadline 초과 결과.
 *
 * <p>Run Driver가 deadline까지 Consumer 결과를 받지 못했을 때 반환합니다.
 * {@link Failure}와 구분되어 호출자가 "Task가 명시적으로 실패함"과
 * "Run이 시간 내에 끝나지 않음"을 구별할 수 있습니다.</p>
 *
 * <p>Run State에는 절대 기록되지 않습니다.</p>
 *
 * @param deadlineMs 적용된 deadline (밀리초, 양수)
 * @param elapsedMs 포기 시점까지 경과 시간 (밀리초, 0 이상)
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public record Timeout(
    long deadlineMs,
    long elapsedMs
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Timeout {
        if (deadlineMs <= 0) {
            throw new IllegalArgumentException("deadlineMs must be positive (current: " + deadlineMs + ")");
        }
        if (elapsedMs < 0) {
            throw new IllegalArgumentException("elapsedMs must be non-negative (current: " + elapsedMs + ")");
        }
    }
}
