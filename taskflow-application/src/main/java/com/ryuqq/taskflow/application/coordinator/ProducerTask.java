package com.ryuqq.taskflow.application.coordinator;

import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.operation.TaskOperation;

/**
 * 입력이 바인딩된 Producer.
 *
 * <p>Run Driver가 {@link com.ryuqq.taskflow.core.contract.ProducerSpec}과 호출자 입력을 묶어 만듭니다.
 * 입력이 없는 Producer는 NO_INPUT 실패를 반환하는 operation으로 바인딩됩니다.</p>
 *
 * @param taskId Producer 식별자
 * @param operation 실행할 작업
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public record ProducerTask(
    TaskId taskId,
    TaskOperation operation
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskId 또는 operation이 null인 경우
     */
    public ProducerTask {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
    }
}
