package com.ryuqq.taskflow.application.driver;

import com.ryuqq.taskflow.core.model.RunId;
import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.outcome.Failure;
import com.ryuqq.taskflow.core.outcome.Outcome;
import com.ryuqq.taskflow.core.outcome.Success;
import com.ryuqq.taskflow.core.outcome.Timeout;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkflowResult 테스트.
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
class WorkflowResultTest {

    private static final TaskId A = TaskId.of("producer-a");
    private static final TaskId B = TaskId.of("producer-b");
    private static final TaskId COMPOSE = TaskId.of("compose");

    @Test
    void success_PayloadAndFailureSummaryExposed() {
        // Given
        Map<TaskId, Outcome> tasks = new LinkedHashMap<>();
        tasks.put(A, Success.of("A1"));
        tasks.put(B, Failure.noInput());
        tasks.put(COMPOSE, Success.of("composed"));

        // When
        WorkflowResult result = new WorkflowResult(RunId.of("run-1"), Success.of("composed"), tasks, 42);

        // Then
        assertTrue(result.isSuccess());
        assertFalse(result.isTimeout());
        assertEquals("composed", result.payloadOrNull());
        assertEquals(List.of(B), result.failedTasks());
        assertEquals(42, result.getElapsedMs());
    }

    @Test
    void timeout_PayloadIsNull() {
        // When
        WorkflowResult result = new WorkflowResult(RunId.of("run-2"), new Timeout(100, 101), Map.of(), 101);

        // Then
        assertTrue(result.isTimeout());
        assertFalse(result.isSuccess());
        assertNull(result.payloadOrNull());
        assertTrue(result.failedTasks().isEmpty());
    }

    @Test
    void taskOutcomes_IsDefensiveCopy() {
        // Given
        Map<TaskId, Outcome> tasks = new LinkedHashMap<>();
        tasks.put(A, Success.of("A1"));
        WorkflowResult result = new WorkflowResult(RunId.of("run-3"), Success.of("ok"), tasks, 1);

        // When
        tasks.put(B, Success.of("B1"));

        // Then
        assertEquals(1, result.getTaskOutcomes().size());
        assertThrows(UnsupportedOperationException.class, () -> result.getTaskOutcomes().clear());
    }

    @Test
    void constructor_NullOutcome_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new WorkflowResult(RunId.of("run-4"), null, Map.of(), 0)
        );
        assertTrue(exception.getMessage().contains("outcome cannot be null"));
    }

    @Test
    void constructor_NegativeElapsed_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new WorkflowResult(RunId.of("run-5"), Success.of("ok"), Map.of(), -1));
    }
}
