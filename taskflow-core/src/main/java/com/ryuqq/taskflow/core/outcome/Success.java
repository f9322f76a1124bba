package com.ryuqq.taskflow.core.outcome;

import com.ryuqq.taskflow.core.model.Payload;

/**
 * 성공 결과.
 *
 * <p>Task의 operation이 예외 없이 결과 데이터를 반환했음을 나타냅니다.</p>
 *
 * @param payload 결과 데이터 (non-null, 값 자체는 비어있을 수 있음)
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public record Success(Payload payload) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException payload가 null인 경우
     */
    public Success {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }

    /**
     * 문자열 결과로 Success 생성.
     *
     * @param value 결과 문자열
     * @return Success 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Success of(String value) {
        return new Success(Payload.of(value));
    }
}
