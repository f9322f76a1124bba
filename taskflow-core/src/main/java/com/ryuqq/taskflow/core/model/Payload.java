package com.ryuqq.taskflow.core.model;

/**
 * Task 실행 결과 데이터 (불투명 문자열).
 *
 * <p>Producer가 만든 결과(저장소 메타데이터, 스크래핑된 본문, 키워드 목록 등)나
 * Consumer가 구성한 최종 문서를 전달합니다. Taskflow는 내용을 해석하지 않습니다.</p>
 *
 * <p>값은 항상 존재합니다. "결과 없음"은 Payload가 아니라
 * {@link com.ryuqq.taskflow.core.outcome.Failure}로 표현합니다.</p>
 *
 * <ul>
 *   <li>JSON: Payload.of("{\"username\":\"octocat\",\"repos\":8}")</li>
 *   <li>키워드: Payload.of("python, aws, react")</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload("");

    private final String value;

    private Payload(String value) {
        this.value = value;
    }

    /**
     * Payload 생성.
     *
     * @param value 결과 값 (빈 문자열 허용)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Payload of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return value.isEmpty() ? EMPTY : new Payload(value);
    }

    public static Payload empty() {
        return EMPTY;
    }

    public String getValue() {
        return value;
    }

    public int length() {
        return value.length();
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Payload other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    // 로그에 본문(이력서, 스크래핑 결과)이 남지 않도록 길이만 출력
    @Override
    public String toString() {
        return "Payload{" + value.length() + " chars}";
    }
}
