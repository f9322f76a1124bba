package com.ryuqq.taskflow.core.model;

import java.util.regex.Pattern;

/**
 * 워크플로우 Run 내 Task 식별자.
 *
 * <p>하나의 Producer 또는 Consumer를 식별하며, Run State의 admission 키로 사용됩니다.
 * 식별자 집합은 {@link com.ryuqq.taskflow.core.contract.WorkflowDefinition} 생성 시점에 고정됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>TaskId.of("repo-fetch") - 저장소 메타데이터 수집</li>
 *   <li>TaskId.of("page-scrape") - 웹 페이지 스크래핑</li>
 *   <li>TaskId.of("keyword-extract") - 키워드 추출</li>
 *   <li>TaskId.of("compose") - 최종 문서 구성 (Consumer)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 소문자, 숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class TaskId {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-z0-9\\-_]+$");

    private final String value;

    private TaskId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TaskId cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("TaskId length cannot exceed 100 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "TaskId contains invalid characters. Only lowercase letters, digits, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * TaskId 생성.
     *
     * @param value TaskId 값
     * @return TaskId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TaskId of(String value) {
        return new TaskId(value);
    }

    /**
     * TaskId 값 조회.
     *
     * @return TaskId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskId taskId = (TaskId) o;
        return value.equals(taskId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
