package com.ryuqq.taskflow.core.contract;

import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.operation.ConsumerOperation;
import com.ryuqq.taskflow.core.operation.ProducerOperation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 워크플로우 정의 (고정된 Producer 집합 + Consumer 하나).
 *
 * <p>Run Driver 생성 시점에 Task 식별자 집합을 고정합니다.
 * 범용 DAG가 아니며, 항상 "독립 Producer들 → join barrier → Consumer" 형태입니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>Producer 1개 이상</li>
 *   <li>Producer TaskId 중복 불가</li>
 *   <li>Consumer TaskId는 모든 Producer TaskId와 달라야 함</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkflowDefinition definition = WorkflowDefinition.builder()
 *     .producer(TaskId.of("repo-fetch"), repoFetcher)
 *     .producer(TaskId.of("page-scrape"), pageScraper)
 *     .producer(TaskId.of("keyword-extract"), keywordExtractor)
 *     .consumer(TaskId.of("compose"), composer)
 *     .build();
 * </pre>
 *
 * @param producers Producer 목록 (선언 순서 유지, 불변)
 * @param consumer Consumer
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public record WorkflowDefinition(
    List<ProducerSpec> producers,
    ConsumerSpec consumer
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효성 검증 실패 시
     */
    public WorkflowDefinition {
        if (producers == null || producers.isEmpty()) {
            throw new IllegalArgumentException("producers cannot be null or empty");
        }
        if (consumer == null) {
            throw new IllegalArgumentException("consumer cannot be null");
        }
        Set<TaskId> seen = new HashSet<>();
        for (ProducerSpec producer : producers) {
            if (producer == null) {
                throw new IllegalArgumentException("producers cannot contain null");
            }
            if (!seen.add(producer.taskId())) {
                throw new IllegalArgumentException("Duplicate producer taskId: " + producer.taskId());
            }
        }
        if (seen.contains(consumer.taskId())) {
            throw new IllegalArgumentException(
                "Consumer taskId must differ from producer taskIds: " + consumer.taskId());
        }
        producers = List.copyOf(producers);
    }

    /**
     * Producer TaskId 목록 (선언 순서).
     *
     * @return TaskId 목록
     */
    public List<TaskId> producerIds() {
        List<TaskId> ids = new ArrayList<>(producers.size());
        for (ProducerSpec producer : producers) {
            ids.add(producer.taskId());
        }
        return List.copyOf(ids);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * WorkflowDefinition 빌더.
     */
    public static final class Builder {

        private final List<ProducerSpec> producers = new ArrayList<>();
        private ConsumerSpec consumer;

        private Builder() {
        }

        public Builder producer(TaskId taskId, ProducerOperation operation) {
            producers.add(new ProducerSpec(taskId, operation));
            return this;
        }

        public Builder consumer(TaskId taskId, ConsumerOperation operation) {
            this.consumer = new ConsumerSpec(taskId, operation);
            return this;
        }

        /**
         * WorkflowDefinition 생성.
         *
         * @return WorkflowDefinition 인스턴스
         * @throws IllegalArgumentException 유효성 검증 실패 시
         */
        public WorkflowDefinition build() {
            return new WorkflowDefinition(producers, consumer);
        }
    }
}
