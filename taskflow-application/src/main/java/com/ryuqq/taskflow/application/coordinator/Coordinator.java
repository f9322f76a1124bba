package com.ryuqq.taskflow.application.coordinator;

import com.ryuqq.taskflow.core.outcome.Outcome;
import com.ryuqq.taskflow.core.spi.RunState;

import java.util.List;

/**
 * Task admission 순서 조정자.
 *
 * <p>독립 Producer들을 모두 admission 하고, 모두 종료 상태(성공 또는 실패)에 도달한 뒤에만
 * Consumer를 admission 하여 그 결과를 워크플로우 결과로 반환합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>모든 Producer를 Guarded Task로 실행 (동시 또는 순차, 순서 보장 없음)</li>
 *   <li>Join barrier: 모든 Producer가 종료 상태가 될 때까지 대기</li>
 *   <li>Run State에서 각 Producer 결과를 읽어 Consumer 입력 구성 (실패는 실패 마커로 전달)</li>
 *   <li>Consumer를 Guarded Task로 실행</li>
 *   <li>Consumer 결과 반환</li>
 * </ol>
 *
 * <p><strong>순서 보장:</strong> Producer 간 dispatch 순서는 정의되지 않으며 호출자가 의존하면 안 됩니다.
 * 유일한 강한 순서 보장은 Consumer 이전의 join barrier입니다.</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public interface Coordinator {

    /**
     * Fan-out → join barrier → Consumer 실행.
     *
     * @param producers 입력이 바인딩된 Producer 목록 (1개 이상)
     * @param consumer Consumer
     * @param runState 이 Run이 독점 소유하는 Run State
     * @return Consumer 결과 (Success 또는 Failure)
     * @throws IllegalArgumentException 인자가 null이거나 producers가 비어있는 경우
     * @throws com.ryuqq.taskflow.core.exception.InvariantViolationException at-most-once 불변식 위반 시 (Run 중단)
     */
    Outcome execute(List<ProducerTask> producers, ConsumerTask consumer, RunState runState);
}
