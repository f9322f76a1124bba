/**
 * Operation contracts for the external collaborators.
 *
 * <p>Producers and the consumer are opaque operations. Their content (HTTP calls,
 * page scraping, keyword extraction, document composition) lives outside this SDK;
 * Taskflow only sees these interfaces.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.taskflow.core.operation.ProducerOperation} - raw input to payload</li>
 *   <li>{@link com.ryuqq.taskflow.core.operation.ConsumerOperation} - joined producer outcomes to payload</li>
 *   <li>{@link com.ryuqq.taskflow.core.operation.TaskOperation} - bound, zero-argument form invoked by the guarded task</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
package com.ryuqq.taskflow.core.operation;
