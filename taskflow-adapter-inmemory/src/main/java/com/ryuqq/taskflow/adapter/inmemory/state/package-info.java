/**
 * In-memory Run State adapter implementation package.
 *
 * <p>This package provides the reference implementation of the
 * {@link com.ryuqq.taskflow.core.spi.RunState} SPI.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.taskflow.adapter.inmemory.state.InMemoryRunState}:
 *       Monitor-guarded admission set and write-once outcome map</li>
 *   <li>{@link com.ryuqq.taskflow.adapter.inmemory.state.InMemoryRunStateFactory}:
 *       Allocates a fresh run state per run</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>State lives only as long as the run that owns it</li>
 *   <li>No persistence across process restarts, no cross-process coordination</li>
 * </ul>
 *
 * @see com.ryuqq.taskflow.core.spi.RunState
 * @author Taskflow Team
 * @since 1.0.0
 */
package com.ryuqq.taskflow.adapter.inmemory.state;
