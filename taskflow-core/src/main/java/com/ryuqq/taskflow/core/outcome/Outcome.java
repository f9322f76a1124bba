package com.ryuqq.taskflow.core.outcome;

/**
 * Task 또는 워크플로우 Run의 종료 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: Task가 결과 데이터를 만들고 완료됨</li>
 *   <li>{@link Failure}: Task가 실패함 (재시도 없음, 종료 상태)</li>
 *   <li>{@link Timeout}: Run 전체가 deadline 내에 끝나지 못함 (Run 결과 전용)</li>
 * </ul>
 *
 * <p>{@link Success}와 {@link Failure}는 Task 결과로 Run State에 기록될 수 있고,
 * {@link Timeout}은 Run Driver만 반환하며 Run State에 기록되지 않습니다.</p>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 고정됩니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Success success) {
 *     render(success.payload());
 * } else if (outcome instanceof Failure failure) {
 *     report(failure.errorCode(), failure.message());
 * } else if (outcome instanceof Timeout timeout) {
 *     report("TIMEOUT", "deadline " + timeout.deadlineMs() + "ms exceeded");
 * }
 * </pre>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Success, Failure, Timeout {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * 결과가 Run deadline 초과인지 확인.
     *
     * @return 타임아웃 여부
     */
    default boolean isTimeout() {
        return this instanceof Timeout;
    }

    /**
     * Run State에 기록 가능한 Task 결과인지 확인.
     *
     * @return Success 또는 Failure인 경우 true
     */
    default boolean isTaskOutcome() {
        return !isTimeout();
    }
}
