package com.ryuqq.taskflow.application.coordinator;

import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.operation.ConsumerOperation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consumer와 Consumer에게 그대로 전달할 자유 형식 필드.
 *
 * @param taskId Consumer 식별자
 * @param operation Consumer 작업
 * @param freeFormFields 자유 형식 필드 (불변 복사본으로 보관)
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public record ConsumerTask(
    TaskId taskId,
    ConsumerOperation operation,
    Map<String, String> freeFormFields
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskId, operation 또는 freeFormFields가 null인 경우
     */
    public ConsumerTask {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (freeFormFields == null) {
            throw new IllegalArgumentException("freeFormFields cannot be null");
        }
        // 값으로 null을 허용하므로 Map.copyOf 대신 unmodifiable 복사본 사용
        freeFormFields = Collections.unmodifiableMap(new LinkedHashMap<>(freeFormFields));
    }
}
