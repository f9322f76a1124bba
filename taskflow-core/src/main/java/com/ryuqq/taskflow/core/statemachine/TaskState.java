package com.ryuqq.taskflow.core.statemachine;

/**
 * Run 내 Task의 생명주기 상태.
 *
 * <p>Run State의 admitted 집합과 outcomes 맵에서 파생됩니다:</p>
 * <ul>
 *   <li>admitted에 없음 → PENDING</li>
 *   <li>admitted에 있고 결과 미기록 → IN_PROGRESS</li>
 *   <li>Success 기록됨 → SUCCEEDED</li>
 *   <li>Failure 기록됨 → FAILED</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ▼ (tryAdmit)
 * IN_PROGRESS
 *    │
 *    ├─► SUCCEEDED (recordOutcome: Success)
 *    │
 *    └─► FAILED (recordOutcome: Failure)
 *
 * 금지된 전이:
 * - SUCCEEDED/FAILED → 모든 상태 ❌ (결과는 write-once)
 * - IN_PROGRESS → PENDING ❌ (admission은 취소되지 않음)
 * - PENDING → SUCCEEDED/FAILED ❌ (admission 없이 결과 기록 불가)
 * </pre>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public enum TaskState {

    /**
     * 아직 admission 되지 않음.
     */
    PENDING,

    /**
     * admission 완료, 실행 중.
     */
    IN_PROGRESS,

    /**
     * 성공 결과 기록됨.
     */
    SUCCEEDED,

    /**
     * 실패 결과 기록됨.
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>Join barrier는 모든 Producer가 종료 상태일 때만 통과합니다.</p>
     *
     * @return SUCCEEDED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
