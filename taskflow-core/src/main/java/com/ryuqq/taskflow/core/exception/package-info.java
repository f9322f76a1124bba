/**
 * Taskflow 예외 타입.
 *
 * <ul>
 *   <li>{@link com.ryuqq.taskflow.core.exception.InvariantViolationException} - at-most-once 불변식 위반 (Run 중단)</li>
 *   <li>{@link com.ryuqq.taskflow.core.exception.TaskFailureException} - operation이 오류 코드와 함께 보고하는 실패</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
package com.ryuqq.taskflow.core.exception;
