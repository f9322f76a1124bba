package com.ryuqq.taskflow.core.spi;

import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.outcome.Outcome;
import com.ryuqq.taskflow.core.statemachine.TaskState;

import java.util.Map;

/**
 * Run State SPI (Service Provider Interface).
 *
 * <p>하나의 워크플로우 Run에 대해 어떤 Task가 admission 되었고,
 * 어떤 결과를 기록했는지를 보관합니다. at-most-once 판단의 단일 진실 공급원입니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>admitted 집합과 outcomes 맵을 하나의 상호 배제 영역에서 관리</li>
 *   <li>check-and-insert admission의 원자성 (동일 TaskId 동시 시도 시 하나만 true)</li>
 *   <li>결과의 write-once 보장 (덮어쓰기 시 {@code InvariantViolationException})</li>
 * </ul>
 *
 * <p><strong>소유권:</strong></p>
 * <ul>
 *   <li>Run 하나가 독점 소유하며 Run 간에 절대 공유되지 않음</li>
 *   <li>Run Driver 호출마다 {@link RunStateFactory}로 새로 생성</li>
 *   <li>Run 종료 후 폐기됨 (재사용 금지, 프로세스 전역 싱글턴 금지)</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public interface RunState {

    /**
     * TaskId admission 시도.
     *
     * <p>admitted에 없으면 추가하고 true를 반환합니다 (호출자가 실행 권한 획득).
     * 이미 있으면 false를 반환합니다 (호출자는 실행하면 안 됨).</p>
     *
     * <p><strong>동시성 보장:</strong></p>
     * <p>동일한 TaskId로 동시에 여러 호출이 들어와도 정확히 하나만 true를 받아야 합니다.</p>
     *
     * @param taskId Task 식별자
     * @return 실행 권한 획득 여부
     * @throws IllegalArgumentException taskId가 null인 경우
     */
    boolean tryAdmit(TaskId taskId);

    /**
     * Task 결과 기록.
     *
     * @param taskId Task 식별자
     * @param outcome Task 결과 (Success 또는 Failure)
     * @throws IllegalArgumentException taskId/outcome이 null이거나 outcome이 Timeout인 경우
     * @throws com.ryuqq.taskflow.core.exception.InvariantViolationException
     *         이미 결과가 있거나 admission 되지 않은 TaskId인 경우 (기존 값은 변경되지 않음)
     */
    void recordOutcome(TaskId taskId, Outcome outcome);

    /**
     * 기록된 결과 조회 (조회만, 논블로킹).
     *
     * <p>완료를 기다려야 하는 호출자는 폴링하지 말고 Coordinator의 join barrier를 사용해야 합니다.</p>
     *
     * @param taskId Task 식별자
     * @return 기록된 결과, 없는 경우 null
     * @throws IllegalArgumentException taskId가 null인 경우
     */
    Outcome findOutcome(TaskId taskId);

    /**
     * Task 상태 조회.
     *
     * @param taskId Task 식별자
     * @return 현재 상태 (PENDING, IN_PROGRESS, SUCCEEDED, FAILED)
     * @throws IllegalArgumentException taskId가 null인 경우
     */
    TaskState stateOf(TaskId taskId);

    /**
     * 기록된 결과 전체의 불변 복사본 (기록 순서 유지).
     *
     * @return TaskId → Outcome 스냅샷
     */
    Map<TaskId, Outcome> snapshot();

    /**
     * admission 된 TaskId 수.
     *
     * @return admitted 집합 크기
     */
    int admittedCount();
}
