package com.ryuqq.taskflow.core.contract;

import com.ryuqq.taskflow.core.model.Payload;
import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.operation.ConsumerOperation;
import com.ryuqq.taskflow.core.operation.ProducerOperation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkflowDefinition 테스트.
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
class WorkflowDefinitionTest {

    private static final ProducerOperation ECHO = input -> Payload.of(input);
    private static final ConsumerOperation COMPOSE = input -> Payload.of("composed");

    @Test
    void builder_프로듀서_선언_순서를_유지한다() {
        // when
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .producer(TaskId.of("repo-fetch"), ECHO)
            .producer(TaskId.of("page-scrape"), ECHO)
            .producer(TaskId.of("keyword-extract"), ECHO)
            .consumer(TaskId.of("compose"), COMPOSE)
            .build();

        // then
        assertThat(definition.producerIds()).containsExactly(
            TaskId.of("repo-fetch"), TaskId.of("page-scrape"), TaskId.of("keyword-extract"));
        assertThat(definition.consumer().taskId()).isEqualTo(TaskId.of("compose"));
    }

    @Test
    void 프로듀서가_없으면_예외() {
        assertThatThrownBy(() -> WorkflowDefinition.builder()
            .consumer(TaskId.of("compose"), COMPOSE)
            .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("producers");
    }

    @Test
    void 프로듀서_TaskId_중복시_예외() {
        assertThatThrownBy(() -> WorkflowDefinition.builder()
            .producer(TaskId.of("repo-fetch"), ECHO)
            .producer(TaskId.of("repo-fetch"), ECHO)
            .consumer(TaskId.of("compose"), COMPOSE)
            .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate producer taskId");
    }

    @Test
    void 컨슈머_TaskId가_프로듀서와_같으면_예외() {
        assertThatThrownBy(() -> WorkflowDefinition.builder()
            .producer(TaskId.of("compose"), ECHO)
            .consumer(TaskId.of("compose"), COMPOSE)
            .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Consumer taskId must differ");
    }

    @Test
    void 컨슈머가_없으면_예외() {
        assertThatThrownBy(() -> WorkflowDefinition.builder()
            .producer(TaskId.of("repo-fetch"), ECHO)
            .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("consumer cannot be null");
    }

    @Test
    void producers_목록은_불변이다() {
        // given
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .producer(TaskId.of("repo-fetch"), ECHO)
            .consumer(TaskId.of("compose"), COMPOSE)
            .build();

        // when & then
        List<ProducerSpec> producers = definition.producers();
        assertThatThrownBy(() -> producers.add(new ProducerSpec(TaskId.of("page-scrape"), ECHO)))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
