/**
 * Taskflow 도메인 값 객체.
 *
 * <ul>
 *   <li>{@link com.ryuqq.taskflow.core.model.TaskId} - Run 내 Task 식별자 (admission 키)</li>
 *   <li>{@link com.ryuqq.taskflow.core.model.RunId} - 워크플로우 Run 식별자</li>
 *   <li>{@link com.ryuqq.taskflow.core.model.Payload} - 불투명 결과 데이터</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
package com.ryuqq.taskflow.core.model;
