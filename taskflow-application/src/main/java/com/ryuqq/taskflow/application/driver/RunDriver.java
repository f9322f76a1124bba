package com.ryuqq.taskflow.application.driver;

import com.ryuqq.taskflow.core.contract.WorkflowInputs;

/**
 * 워크플로우 Run 진입점.
 *
 * <p>호출마다 새 Run State를 할당하고, deadline 아래에서 Coordinator를 실행하여
 * 최종 결과 또는 타임아웃을 호출자에게 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkflowInputs inputs = WorkflowInputs.builder()
 *     .input(TaskId.of("repo-fetch"), githubUrl)
 *     .input(TaskId.of("keyword-extract"), jobDescription)
 *     .field("user_feedback", feedback)
 *     .build();
 *
 * WorkflowResult result = runDriver.runWorkflow(inputs);
 *
 * if (result.isSuccess()) {
 *     String document = result.payloadOrNull();
 * } else if (result.isTimeout()) {
 *     // Run이 deadline 내에 끝나지 않음
 * } else {
 *     List&lt;TaskId&gt; failed = result.failedTasks();
 * }
 * </pre>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public interface RunDriver {

    /**
     * 기본 deadline으로 워크플로우 실행.
     *
     * @param inputs 호출자 입력
     * @return 종료 결과 (항상 정확히 하나: Success, Failure, Timeout)
     * @throws IllegalArgumentException inputs가 null인 경우
     * @throws com.ryuqq.taskflow.core.exception.InvariantViolationException at-most-once 불변식 위반으로 Run이 중단된 경우
     */
    WorkflowResult runWorkflow(WorkflowInputs inputs);

    /**
     * 지정한 deadline으로 워크플로우 실행.
     *
     * @param inputs 호출자 입력
     * @param deadlineMs Run 전체 deadline (밀리초)
     * @return 종료 결과
     * @throws IllegalArgumentException inputs가 null이거나 deadlineMs가 허용 범위를 벗어난 경우
     * @throws com.ryuqq.taskflow.core.exception.InvariantViolationException at-most-once 불변식 위반으로 Run이 중단된 경우
     */
    WorkflowResult runWorkflow(WorkflowInputs inputs, long deadlineMs);
}
