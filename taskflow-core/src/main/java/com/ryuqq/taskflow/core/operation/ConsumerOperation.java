package com.ryuqq.taskflow.core.operation;

import com.ryuqq.taskflow.core.contract.ComposeInput;
import com.ryuqq.taskflow.core.model.Payload;

/**
 * Consumer 작업 (외부 협력자).
 *
 * <p>모든 Producer의 결과(성공 데이터 또는 실패 마커)와 자유 형식 필드를 받아
 * 최종 구조화 문서를 구성합니다. 누락되거나 실패한 입력에 대한 처리 방식은
 * 구현체가 결정합니다.</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConsumerOperation {

    /**
     * 최종 결과 구성.
     *
     * @param input Producer 결과와 자유 형식 필드
     * @return 구성된 결과 데이터
     * @throws Exception 구성 실패 시
     */
    Payload compose(ComposeInput input) throws Exception;

    /**
     * 입력과 묶어 {@link TaskOperation}으로 변환.
     *
     * @param input 구성된 Consumer 입력
     * @return 입력이 바인딩된 TaskOperation
     */
    default TaskOperation bind(ComposeInput input) {
        return () -> compose(input);
    }
}
