/**
 * Task and run outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for task and run results.
 * Orchestration decisions (join barrier, skip-on-duplicate) inspect these types,
 * never free-form status text.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskflow.core.outcome.Outcome} - Sealed interface (permits Success, Failure, Timeout)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskflow.core.outcome.Success} - Task completed with a payload</li>
 *   <li>{@link com.ryuqq.taskflow.core.outcome.Failure} - Task failed (terminal, never retried)</li>
 *   <li>{@link com.ryuqq.taskflow.core.outcome.Timeout} - Run deadline exceeded (run result only)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Taskflow Team
 */
package com.ryuqq.taskflow.core.outcome;
