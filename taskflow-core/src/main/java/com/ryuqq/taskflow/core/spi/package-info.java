/**
 * Service Provider Interfaces for run-scoped state.
 *
 * <ul>
 *   <li>{@link com.ryuqq.taskflow.core.spi.RunState} - admission set and write-once outcome map for one run</li>
 *   <li>{@link com.ryuqq.taskflow.core.spi.RunStateFactory} - allocates a fresh, empty RunState per run</li>
 * </ul>
 *
 * <p>The reference implementation lives in the {@code taskflow-adapter-inmemory} module.</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
package com.ryuqq.taskflow.core.spi;
