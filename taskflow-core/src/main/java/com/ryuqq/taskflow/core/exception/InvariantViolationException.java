package com.ryuqq.taskflow.core.exception;

import com.ryuqq.taskflow.core.model.TaskId;

/**
 * At-most-once 불변식 위반.
 *
 * <p>정상 동작에서는 발생하지 않으며, 조정(coordination) 버그를 의미합니다.
 * 발생 시 해당 Run은 중단되고 예외가 호출자까지 전파됩니다.</p>
 *
 * <p><strong>발생 조건:</strong></p>
 * <ul>
 *   <li>이미 결과가 기록된 TaskId에 다시 결과를 기록하려는 경우</li>
 *   <li>admission 받지 않은 TaskId의 결과를 기록하려는 경우</li>
 *   <li>실행 중(admitted, 결과 미기록)인 TaskId에 중복 admission이 시도된 경우</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public class InvariantViolationException extends IllegalStateException {

    private final TaskId taskId;

    /**
     * 생성자.
     *
     * @param taskId 위반이 발생한 TaskId
     * @param message 위반 내용
     */
    public InvariantViolationException(TaskId taskId, String message) {
        super(message + " (taskId: " + taskId + ")");
        this.taskId = taskId;
    }

    /**
     * 위반이 발생한 TaskId 조회.
     *
     * @return TaskId
     */
    public TaskId getTaskId() {
        return taskId;
    }
}
