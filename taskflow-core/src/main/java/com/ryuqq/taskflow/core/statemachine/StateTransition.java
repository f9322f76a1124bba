package com.ryuqq.taskflow.core.statemachine;

import com.ryuqq.taskflow.core.outcome.Outcome;

/**
 * Task 상태 전이 검증.
 *
 * <p>Run State 구현체는 admission과 결과 기록 시 이 클래스로 전이를 검증하여
 * write-once 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → IN_PROGRESS</li>
 *   <li>IN_PROGRESS → SUCCEEDED</li>
 *   <li>IN_PROGRESS → FAILED</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이인 경우 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(TaskState from, TaskState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case PENDING -> to == TaskState.IN_PROGRESS;
            case IN_PROGRESS -> to == TaskState.SUCCEEDED || to == TaskState.FAILED;
            case SUCCEEDED, FAILED -> false;
        };
    }

    /**
     * Task 결과에 대응하는 종료 상태 조회.
     *
     * @param outcome Task 결과 (Success 또는 Failure)
     * @return SUCCEEDED 또는 FAILED
     * @throws IllegalArgumentException outcome이 null이거나 Timeout인 경우
     */
    public static TaskState terminalStateOf(Outcome outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (!outcome.isTaskOutcome()) {
            throw new IllegalArgumentException("Timeout is a run outcome and has no task state");
        }
        return outcome.isSuccess() ? TaskState.SUCCEEDED : TaskState.FAILED;
    }
}
