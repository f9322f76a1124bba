/**
 * Runner Adapter Layer - Coordinator / Run Driver 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskflow.adapter.runner.GuardedTask} - Run당 최대 한 번 실행, 예외를 Failure로 변환</li>
 *   <li>{@link com.ryuqq.taskflow.adapter.runner.FanOutFanInCoordinator} - Producer fan-out, join barrier, Consumer 실행</li>
 *   <li>{@link com.ryuqq.taskflow.adapter.runner.DeadlineRunDriver} - Run마다 새 Run State, deadline 적용</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (FanOutFanInCoordinator, DeadlineRunDriver)
 *   ↓ implements
 * application (Coordinator, RunDriver interface)
 *   ↓ depends on
 * core (TaskId, Outcome, RunState SPI, WorkflowDefinition)
 * </pre>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
package com.ryuqq.taskflow.adapter.runner;
