/**
 * Task 생명주기 상태 및 전이 규칙.
 *
 * <ul>
 *   <li>{@link com.ryuqq.taskflow.core.statemachine.TaskState} - PENDING → IN_PROGRESS → SUCCEEDED | FAILED</li>
 *   <li>{@link com.ryuqq.taskflow.core.statemachine.StateTransition} - 전이 검증 유틸리티</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
package com.ryuqq.taskflow.core.statemachine;
