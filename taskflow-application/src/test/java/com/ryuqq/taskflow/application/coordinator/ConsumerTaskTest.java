package com.ryuqq.taskflow.application.coordinator;

import com.ryuqq.taskflow.core.model.Payload;
import com.ryuqq.taskflow.core.model.TaskId;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProducerTask / ConsumerTask Record 테스트.
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
class ConsumerTaskTest {

    @Test
    void consumerTask_NullFieldValue_Allowed() {
        // Given
        Map<String, String> fields = new HashMap<>();
        fields.put("user_feedback", null);

        // When
        ConsumerTask task = new ConsumerTask(TaskId.of("compose"), input -> Payload.of("doc"), fields);

        // Then
        assertTrue(task.freeFormFields().containsKey("user_feedback"));
        assertNull(task.freeFormFields().get("user_feedback"));
    }

    @Test
    void consumerTask_FieldsAreCopied() {
        // Given
        Map<String, String> fields = new HashMap<>();
        ConsumerTask task = new ConsumerTask(TaskId.of("compose"), input -> Payload.of("doc"), fields);

        // When
        fields.put("late", "value");

        // Then
        assertFalse(task.freeFormFields().containsKey("late"));
        assertThrows(UnsupportedOperationException.class, () -> task.freeFormFields().put("x", "y"));
    }

    @Test
    void producerTask_NullOperation_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ProducerTask(TaskId.of("repo-fetch"), null)
        );
        assertTrue(exception.getMessage().contains("operation cannot be null"));
    }
}
