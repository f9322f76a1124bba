package com.ryuqq.taskflow.core.operation;

import com.ryuqq.taskflow.core.model.Payload;

/**
 * Producer 작업 (외부 협력자).
 *
 * <p>호출자가 제공한 원시 입력(URL, 텍스트 블록 등)을 받아 불투명 결과를 만듭니다.
 * 저장소 메타데이터 수집, 웹 페이지 스크래핑, 키워드 추출, 문서 파싱 등이 해당되며
 * 내부 구현(HTTP 호출, 파싱, 프롬프트 구성)은 Taskflow의 관심사가 아닙니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>Run당 최대 한 번 호출되어도 안전해야 함</li>
 *   <li>내부 재시도로 단일 호출 accounting을 깨뜨리지 않아야 함</li>
 *   <li>필요한 자격 증명(토큰 등)은 구현체가 직접 보유</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProducerOperation {

    /**
     * 입력으로부터 결과 생성.
     *
     * @param input 호출자가 제공한 원시 입력 (non-blank)
     * @return 결과 데이터
     * @throws Exception 작업 실패 시
     */
    Payload produce(String input) throws Exception;

    /**
     * 입력과 묶어 {@link TaskOperation}으로 변환.
     *
     * @param input 원시 입력
     * @return 입력이 바인딩된 TaskOperation
     */
    default TaskOperation bind(String input) {
        return () -> produce(input);
    }
}
