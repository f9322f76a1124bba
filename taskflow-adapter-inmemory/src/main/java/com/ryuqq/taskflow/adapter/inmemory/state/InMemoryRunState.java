package com.ryuqq.taskflow.adapter.inmemory.state;

import com.ryuqq.taskflow.core.exception.InvariantViolationException;
import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.outcome.Outcome;
import com.ryuqq.taskflow.core.spi.RunState;
import com.ryuqq.taskflow.core.statemachine.StateTransition;
import com.ryuqq.taskflow.core.statemachine.TaskState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * In-memory implementation of {@link RunState}.
 *
 * <p>Holds the admission set and the write-once outcome map of exactly one workflow run.
 * Instances are created per run by {@link InMemoryRunStateFactory} and dropped when the
 * run returns; nothing here is static or shared between runs.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Every public method is {@code synchronized} on this instance, so {@code admitted}
 *       and {@code outcomes} live in a single mutual-exclusion domain</li>
 *   <li>Admission is check-and-insert under the monitor: concurrent {@link #tryAdmit}
 *       calls for one {@link TaskId} yield exactly one {@code true}</li>
 *   <li>Reads return copies or immutable values, never live views</li>
 * </ul>
 *
 * <p><strong>Write-once Guarantee:</strong></p>
 * <ul>
 *   <li>Recording a second outcome for the same id raises {@link InvariantViolationException}
 *       and leaves the first value untouched</li>
 *   <li>Recording an outcome for an id that was never admitted is also a violation</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RunState runState = new InMemoryRunState();
 * TaskId repoFetch = TaskId.of("repo-fetch");
 *
 * if (runState.tryAdmit(repoFetch)) {
 *     runState.recordOutcome(repoFetch, Success.of("{...}"));
 * }
 *
 * runState.tryAdmit(repoFetch);      // false: already admitted
 * runState.findOutcome(repoFetch);   // Success
 * </pre>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public class InMemoryRunState implements RunState {

    /**
     * Tasks that have been granted their single execution slot (admission order).
     */
    private final Set<TaskId> admitted;

    /**
     * TaskId → recorded task outcome (record order).
     */
    private final Map<TaskId, Outcome> outcomes;

    /**
     * Creates an empty run state.
     */
    public InMemoryRunState() {
        this.admitted = new LinkedHashSet<>();
        this.outcomes = new LinkedHashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Admission is the PENDING → IN_PROGRESS transition checked with {@link StateTransition}.
     * An id that is already in progress or terminal is refused.</p>
     */
    @Override
    public synchronized boolean tryAdmit(TaskId taskId) {
        requireTaskId(taskId);
        if (!StateTransition.isAllowed(currentState(taskId), TaskState.IN_PROGRESS)) {
            return false;
        }
        admitted.add(taskId);
        return true;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The transition IN_PROGRESS → SUCCEEDED/FAILED is checked with {@link StateTransition}</li>
     *   <li>PENDING (not admitted) and terminal states are reported as invariant violations</li>
     * </ul>
     */
    @Override
    public synchronized void recordOutcome(TaskId taskId, Outcome outcome) {
        requireTaskId(taskId);
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        TaskState target = StateTransition.terminalStateOf(outcome);
        TaskState current = currentState(taskId);

        if (!StateTransition.isAllowed(current, target)) {
            if (current.isTerminal()) {
                throw new InvariantViolationException(taskId,
                    "Outcome already recorded: " + outcomes.get(taskId) + ", rejected: " + outcome);
            }
            throw new InvariantViolationException(taskId, "Outcome recorded for a task that was never admitted");
        }
        outcomes.put(taskId, outcome);
    }

    @Override
    public synchronized Outcome findOutcome(TaskId taskId) {
        requireTaskId(taskId);
        return outcomes.get(taskId);
    }

    @Override
    public synchronized TaskState stateOf(TaskId taskId) {
        requireTaskId(taskId);
        return currentState(taskId);
    }

    @Override
    public synchronized Map<TaskId, Outcome> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    @Override
    public synchronized int admittedCount() {
        return admitted.size();
    }

    @Override
    public synchronized String toString() {
        return "InMemoryRunState{admitted=" + admitted + ", recorded=" + outcomes.keySet() + '}';
    }

    // caller holds the monitor
    private TaskState currentState(TaskId taskId) {
        Outcome outcome = outcomes.get(taskId);
        if (outcome != null) {
            return StateTransition.terminalStateOf(outcome);
        }
        return admitted.contains(taskId) ? TaskState.IN_PROGRESS : TaskState.PENDING;
    }

    private static void requireTaskId(TaskId taskId) {
        if (taskId == null) {
            throw new IllegalArgumentException("TaskId cannot be null");
        }
    }
}
