package com.ryuqq.taskflow.core.contract;

import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.operation.ProducerOperation;

/**
 * Producer 선언.
 *
 * @param taskId Producer 식별자 (입력 키로도 사용)
 * @param operation Producer 작업
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public record ProducerSpec(
    TaskId taskId,
    ProducerOperation operation
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskId 또는 operation이 null인 경우
     */
    public ProducerSpec {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
    }
}
