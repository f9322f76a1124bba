package com.ryuqq.taskflow.core.contract;

import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.outcome.Failure;
import com.ryuqq.taskflow.core.outcome.Outcome;
import com.ryuqq.taskflow.core.outcome.Success;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consumer 입력.
 *
 * <p>Join barrier 통과 후 Run State에서 읽은 모든 Producer의 결과와
 * 호출자가 제공한 자유 형식 필드로 구성됩니다.</p>
 *
 * <p><strong>실패 마커:</strong></p>
 * <p>실패한(또는 건너뛴) Producer는 빈 문자열로 대체되지 않고
 * {@link Failure}로 그대로 전달됩니다. 저하 처리(degrade) 방식은 Consumer가 결정하며,
 * 조용히 비워두고 싶다면 {@link #payloadOrNull(TaskId)}를 사용할 수 있습니다.</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class ComposeInput {

    private final Map<TaskId, Outcome> producerOutcomes;
    private final Map<String, String> freeFormFields;

    /**
     * 생성자.
     *
     * @param producerOutcomes Producer TaskId → 기록된 결과 (Success 또는 Failure)
     * @param freeFormFields 자유 형식 필드
     * @throws IllegalArgumentException 인자가 null이거나 Task 결과가 아닌 값이 포함된 경우
     */
    public ComposeInput(Map<TaskId, Outcome> producerOutcomes, Map<String, String> freeFormFields) {
        if (producerOutcomes == null) {
            throw new IllegalArgumentException("producerOutcomes cannot be null");
        }
        if (freeFormFields == null) {
            throw new IllegalArgumentException("freeFormFields cannot be null");
        }
        for (Map.Entry<TaskId, Outcome> entry : producerOutcomes.entrySet()) {
            if (entry.getValue() == null || !entry.getValue().isTaskOutcome()) {
                throw new IllegalArgumentException(
                    "producer outcome must be Success or Failure (taskId: " + entry.getKey() + ")");
            }
        }
        this.producerOutcomes = Collections.unmodifiableMap(new LinkedHashMap<>(producerOutcomes));
        this.freeFormFields = Collections.unmodifiableMap(new LinkedHashMap<>(freeFormFields));
    }

    /**
     * Producer 결과 전체 (불변, Producer 선언 순서).
     *
     * @return TaskId → Outcome
     */
    public Map<TaskId, Outcome> getProducerOutcomes() {
        return producerOutcomes;
    }

    public Map<String, String> getFreeFormFields() {
        return freeFormFields;
    }

    /**
     * Producer 결과 조회.
     *
     * @param taskId Producer 식별자
     * @return 결과, 알 수 없는 TaskId인 경우 null
     */
    public Outcome outcomeOf(TaskId taskId) {
        return producerOutcomes.get(taskId);
    }

    /**
     * 성공한 Producer의 결과 값 조회.
     *
     * @param taskId Producer 식별자
     * @return 결과 값, 실패했거나 알 수 없는 경우 null
     */
    public String payloadOrNull(TaskId taskId) {
        Outcome outcome = producerOutcomes.get(taskId);
        if (outcome instanceof Success success) {
            return success.payload().getValue();
        }
        return null;
    }

    /**
     * Producer 실패 여부.
     *
     * @param taskId Producer 식별자
     * @return Failure가 기록된 경우 true
     */
    public boolean isFailed(TaskId taskId) {
        Outcome outcome = producerOutcomes.get(taskId);
        return outcome != null && outcome.isFailure();
    }

    /**
     * 실패한 Producer 목록 (선언 순서).
     *
     * @return 실패 TaskId 목록 (불변)
     */
    public List<TaskId> failedTasks() {
        List<TaskId> failed = new ArrayList<>();
        for (Map.Entry<TaskId, Outcome> entry : producerOutcomes.entrySet()) {
            if (entry.getValue().isFailure()) {
                failed.add(entry.getKey());
            }
        }
        return List.copyOf(failed);
    }

    /**
     * 자유 형식 필드 조회.
     *
     * @param name 필드 이름
     * @return 필드 값, 없으면 null
     */
    public String field(String name) {
        return freeFormFields.get(name);
    }

    @Override
    public String toString() {
        return "ComposeInput{producerOutcomes=" + producerOutcomes
            + ", freeFormFields=" + freeFormFields.keySet() + '}';
    }
}
