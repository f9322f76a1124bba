package com.ryuqq.taskflow.testkit.contract;

import com.ryuqq.taskflow.adapter.runner.GuardedTask;
import com.ryuqq.taskflow.core.exception.InvariantViolationException;
import com.ryuqq.taskflow.core.model.Payload;
import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.outcome.Failure;
import com.ryuqq.taskflow.core.outcome.Outcome;
import com.ryuqq.taskflow.core.outcome.Success;
import com.ryuqq.taskflow.core.spi.RunState;
import com.ryuqq.taskflow.core.statemachine.TaskState;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Contract Test: Write-once outcomes.
 *
 * <p>Once an outcome is recorded it never changes. A second write is an invariant
 * violation and leaves the first value untouched.</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
class WriteOnceContractTest extends AbstractContractTest {

    private static final TaskId A = taskId("a");

    @Test
    void testWriteOnce_SecondRecordIsRejected() {
        // Given
        RunState runState = runStateFactory.create();
        runState.tryAdmit(A);
        runState.recordOutcome(A, Success.of("A1"));

        // When
        InvariantViolationException exception = assertThrows(InvariantViolationException.class,
            () -> runState.recordOutcome(A, Failure.of(Failure.TASK_FAILED, "late")));

        // Then
        assertEquals(A, exception.getTaskId());
        assertEquals(Success.of("A1"), runState.findOutcome(A));
        assertEquals(TaskState.SUCCEEDED, runState.stateOf(A));
    }

    @Test
    void testWriteOnce_GuardedRerunDoesNotOverwrite() {
        // Given
        RunState runState = runStateFactory.create();
        GuardedTask guardedTask = new GuardedTask(runState);
        guardedTask.run(A, () -> Payload.of("A1"));

        // When: a second operation for the same id would fail
        Outcome second = guardedTask.run(A, () -> {
            throw new IllegalStateException("must not run");
        });

        // Then
        assertEquals(Success.of("A1"), second);
        assertEquals(Success.of("A1"), runState.findOutcome(A));
    }

    @Test
    void testWriteOnce_SnapshotIsDetachedFromLaterWrites() {
        // Given
        RunState runState = runStateFactory.create();
        runState.tryAdmit(A);
        Map<TaskId, Outcome> before = runState.snapshot();

        // When
        runState.recordOutcome(A, Success.of("A1"));

        // Then
        assertEquals(0, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.put(A, Success.of("x")));
    }
}
