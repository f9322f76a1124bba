package com.ryuqq.taskflow.core.outcome;

/**
 * 실패 결과 (종료 상태, 재시도 없음).
 *
 * <p>Producer의 실패는 Consumer 입력에 실패 마커로 전달되고,
 * Consumer의 실패는 워크플로우의 최종 실패가 됩니다.</p>
 *
 * <p><strong>오류 코드:</strong></p>
 * <ul>
 *   <li>{@link #TASK_FAILED}: operation이 예외를 던짐</li>
 *   <li>{@link #NO_INPUT}: 입력이 없어 Producer가 건너뛰어짐</li>
 *   <li>{@link #NULL_RESULT}: operation이 결과 없이 반환함</li>
 *   <li>그 외: operation이 {@link com.ryuqq.taskflow.core.exception.TaskFailureException}으로 지정한 코드</li>
 * </ul>
 *
 * @param errorCode 오류 코드
 * @param message 오류 메시지
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public record Failure(
    String errorCode,
    String message
) implements Outcome {

    public static final String TASK_FAILED = "TASK_FAILED";
    public static final String NO_INPUT = "NO_INPUT";
    public static final String NULL_RESULT = "NULL_RESULT";

    private static final String NO_INPUT_MESSAGE = "no input provided";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Failure {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * Failure 생성.
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @return Failure 인스턴스
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public static Failure of(String errorCode, String message) {
        return new Failure(errorCode, message);
    }

    /**
     * 입력 누락으로 건너뛴 Producer의 결과 생성.
     *
     * @return Failure(NO_INPUT, "no input provided")
     */
    public static Failure noInput() {
        return new Failure(NO_INPUT, NO_INPUT_MESSAGE);
    }

    /**
     * 입력 누락으로 건너뛴 결과인지 확인.
     *
     * @return NO_INPUT 코드인 경우 true
     */
    public boolean isNoInput() {
        return NO_INPUT.equals(errorCode);
    }
}
