package com.ryuqq.taskflow.core.exception;

/**
 * Operation이 오류 코드를 지정하여 실패를 보고할 때 던지는 예외.
 *
 * <p>Guarded Task는 이 예외의 {@link #getErrorCode()}를 그대로
 * {@link com.ryuqq.taskflow.core.outcome.Failure}에 기록합니다.
 * 다른 예외는 {@code TASK_FAILED} 코드로 기록됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ProducerOperation repoFetch = url -&gt; {
 *     if (token == null) {
 *         throw new TaskFailureException("MISSING_CREDENTIALS", "repository token is not configured");
 *     }
 *     return Payload.of(client.fetch(url));
 * };
 * </pre>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public class TaskFailureException extends Exception {

    private final String errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 오류 코드 (예: MISSING_CREDENTIALS, HTTP_404)
     * @param message 오류 메시지
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    public TaskFailureException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    public TaskFailureException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
