/**
 * Run Driver port and result handle.
 *
 * <p>The caller-facing surface of Taskflow: one entry point accepting raw
 * inputs and a deadline, returning exactly one terminal result per run. Exposing it
 * over a transport is the hosting service's job.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.taskflow.application.driver.RunDriver} - run entry point</li>
 *   <li>{@link com.ryuqq.taskflow.application.driver.WorkflowResult} - immutable result handle</li>
 * </ul>
 *
 * <p>The implementation is provided by {@code DeadlineRunDriver} in the adapter-runner module.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.taskflow.application.driver;
