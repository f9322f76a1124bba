/**
 * Taskflow Application Layer - Coordinator 포트.
 *
 * <ul>
 *   <li>{@link com.ryuqq.taskflow.application.coordinator.Coordinator} - fan-out / join barrier / Consumer 실행</li>
 *   <li>{@link com.ryuqq.taskflow.application.coordinator.ProducerTask} - 입력이 바인딩된 Producer</li>
 *   <li>{@link com.ryuqq.taskflow.application.coordinator.ConsumerTask} - Consumer와 자유 형식 필드</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>결정론:</strong> 고정된 fan-out/fan-in 순서, 추론이나 프롬프트에 의존하지 않음</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
package com.ryuqq.taskflow.application.coordinator;
