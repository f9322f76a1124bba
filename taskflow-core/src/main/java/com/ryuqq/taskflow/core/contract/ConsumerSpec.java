package com.ryuqq.taskflow.core.contract;

import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.operation.ConsumerOperation;

/**
 * Consumer 선언.
 *
 * @param taskId Consumer 식별자
 * @param operation Consumer 작업
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public record ConsumerSpec(
    TaskId taskId,
    ConsumerOperation operation
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskId 또는 operation이 null인 경우
     */
    public ConsumerSpec {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
    }
}
