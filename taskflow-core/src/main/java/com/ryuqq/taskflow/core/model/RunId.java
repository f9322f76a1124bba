package com.ryuqq.taskflow.core.model;

import java.util.UUID;

/**
 * 워크플로우 Run 식별자.
 *
 * <p>Run Driver 호출마다 새로 발급되며, 로그 상관관계와 결과 핸들에만 사용됩니다.
 * 멱등성 판단에는 사용되지 않습니다 (멱등성은 Run State가 단독으로 책임).</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class RunId {

    private final String value;

    private RunId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RunId cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * RunId 생성.
     *
     * @param value RunId 값
     * @return RunId 인스턴스
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public static RunId of(String value) {
        return new RunId(value);
    }

    /**
     * UUID 기반 신규 RunId 생성.
     *
     * @return RunId 인스턴스
     */
    public static RunId generate() {
        return new RunId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunId runId = (RunId) o;
        return value.equals(runId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "RunId{" + value + '}';
    }
}
