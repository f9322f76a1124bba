package com.ryuqq.taskflow.core.spi;

/**
 * Run State 생성 SPI.
 *
 * <p>Run Driver는 호출마다 이 팩토리로 비어있는 새 {@link RunState}를 할당합니다.
 * 구현체는 호출마다 서로 다른 인스턴스를 반환해야 합니다.</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RunStateFactory {

    /**
     * 비어있는 새 Run State 생성.
     *
     * @return 새 RunState (admitted, outcomes 모두 비어있음)
     */
    RunState create();
}
