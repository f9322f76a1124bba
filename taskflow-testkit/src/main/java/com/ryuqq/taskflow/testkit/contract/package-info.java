/**
 * Contract test support for Taskflow.
 *
 * <p>{@link com.ryuqq.taskflow.testkit.contract.AbstractContractTest} wires the in-memory Run State
 * with the runner adapter; {@link com.ryuqq.taskflow.testkit.contract.ScriptedProducer} and
 * {@link com.ryuqq.taskflow.testkit.contract.RecordingConsumer} are the operation doubles the
 * contract tests script against.</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
package com.ryuqq.taskflow.testkit.contract;
