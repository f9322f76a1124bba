/**
 * 워크플로우 계약 (정의, 입력, Consumer 입력).
 *
 * <ul>
 *   <li>{@link com.ryuqq.taskflow.core.contract.WorkflowDefinition} - 고정된 Producer 집합과 Consumer</li>
 *   <li>{@link com.ryuqq.taskflow.core.contract.ProducerSpec} / {@link com.ryuqq.taskflow.core.contract.ConsumerSpec} - Task 선언</li>
 *   <li>{@link com.ryuqq.taskflow.core.contract.WorkflowInputs} - Run 단위 호출자 입력</li>
 *   <li>{@link com.ryuqq.taskflow.core.contract.ComposeInput} - join barrier 이후 Consumer가 받는 입력</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
package com.ryuqq.taskflow.core.contract;
