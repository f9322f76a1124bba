package com.ryuqq.taskflow.core.contract;

import com.ryuqq.taskflow.core.model.TaskId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 한 번의 Run에 대한 호출자 입력.
 *
 * <p>두 종류의 입력을 담습니다:</p>
 * <ul>
 *   <li><strong>Producer 입력:</strong> TaskId → 원시 값 (URL, 텍스트 블록).
 *       값이 없거나 공백이면 해당 Producer는 건너뛰어지고 NO_INPUT 실패가 기록됩니다.</li>
 *   <li><strong>자유 형식 필드:</strong> Consumer에게 그대로 전달되는 값
 *       (예: user_feedback, user_additions, old_resume_text)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkflowInputs inputs = WorkflowInputs.builder()
 *     .input(TaskId.of("repo-fetch"), "https://github.com/octocat")
 *     .input(TaskId.of("keyword-extract"), jobDescription)
 *     .field("user_feedback", "Highlight open source contributions")
 *     .build();
 * </pre>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class WorkflowInputs {

    private final Map<TaskId, String> producerInputs;
    private final Map<String, String> freeFormFields;

    private WorkflowInputs(Map<TaskId, String> producerInputs, Map<String, String> freeFormFields) {
        this.producerInputs = Collections.unmodifiableMap(new LinkedHashMap<>(producerInputs));
        this.freeFormFields = Collections.unmodifiableMap(new LinkedHashMap<>(freeFormFields));
    }

    /**
     * 입력이 하나도 없는 WorkflowInputs.
     *
     * @return 빈 WorkflowInputs
     */
    public static WorkflowInputs empty() {
        return new WorkflowInputs(Map.of(), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Producer 입력 조회.
     *
     * @param taskId Producer 식별자
     * @return 입력 값, 없거나 공백이면 null
     */
    public String inputFor(TaskId taskId) {
        String value = producerInputs.get(taskId);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value;
    }

    /**
     * Producer 입력 존재 여부.
     *
     * @param taskId Producer 식별자
     * @return 공백이 아닌 입력이 있으면 true
     */
    public boolean hasInput(TaskId taskId) {
        return inputFor(taskId) != null;
    }

    /**
     * 자유 형식 필드 전체 (불변, 입력 순서 유지).
     *
     * @return 필드 이름 → 값
     */
    public Map<String, String> getFreeFormFields() {
        return freeFormFields;
    }

    /**
     * Producer 입력 전체 (불변, 입력 순서 유지).
     *
     * @return TaskId → 원시 입력
     */
    public Map<TaskId, String> getProducerInputs() {
        return producerInputs;
    }

    @Override
    public String toString() {
        return "WorkflowInputs{producerInputs=" + producerInputs.keySet()
            + ", freeFormFields=" + freeFormFields.keySet() + '}';
    }

    /**
     * WorkflowInputs 빌더.
     */
    public static final class Builder {

        private final Map<TaskId, String> producerInputs = new LinkedHashMap<>();
        private final Map<String, String> freeFormFields = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Producer 입력 추가.
         *
         * @param taskId Producer 식별자
         * @param value 원시 입력 (null 허용, 건너뛰기로 처리됨)
         * @return this
         * @throws IllegalArgumentException taskId가 null인 경우
         */
        public Builder input(TaskId taskId, String value) {
            if (taskId == null) {
                throw new IllegalArgumentException("taskId cannot be null");
            }
            producerInputs.put(taskId, value);
            return this;
        }

        /**
         * 자유 형식 필드 추가.
         *
         * @param name 필드 이름
         * @param value 필드 값 (null 허용)
         * @return this
         * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
         */
        public Builder field(String name, String value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("field name cannot be null or blank");
            }
            freeFormFields.put(name, value);
            return this;
        }

        public WorkflowInputs build() {
            return new WorkflowInputs(producerInputs, freeFormFields);
        }
    }
}
