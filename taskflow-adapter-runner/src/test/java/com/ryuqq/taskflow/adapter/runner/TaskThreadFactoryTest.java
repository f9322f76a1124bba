package com.ryuqq.taskflow.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskThreadFactoryTest {

    @Test
    void newThread_daemon_스레드를_순번_이름으로_생성() {
        TaskThreadFactory factory = new TaskThreadFactory("producer");

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertThat(first.isDaemon()).isTrue();
        assertThat(first.getName()).isEqualTo("taskflow-producer-1");
        assertThat(second.getName()).isEqualTo("taskflow-producer-2");
    }

    @Test
    void 빈_풀_이름은_IllegalArgumentException() {
        assertThatThrownBy(() -> new TaskThreadFactory(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
