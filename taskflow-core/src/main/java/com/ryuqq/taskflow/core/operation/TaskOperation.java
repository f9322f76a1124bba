package com.ryuqq.taskflow.core.operation;

import com.ryuqq.taskflow.core.model.Payload;

/**
 * Guarded Task가 실행하는 단일 작업 단위.
 *
 * <p>Producer는 입력과 묶인 상태로, Consumer는 구성된 입력과 묶인 상태로
 * 이 인터페이스로 변환되어 Guarded Task에 전달됩니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>Run당 최대 한 번 호출됨 (Guarded Task가 보장)</li>
 *   <li>외부 응답 대기 중 블로킹 가능 (네트워크 호출, 파일 읽기)</li>
 *   <li>예외는 Failure 결과로 변환되며 호출자에게 전파되지 않음</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskOperation {

    /**
     * 작업 실행.
     *
     * @return 결과 데이터 (null 반환 시 NULL_RESULT 실패로 기록)
     * @throws Exception 작업 실패 시 (TaskFailureException이면 오류 코드 유지)
     */
    Payload execute() throws Exception;
}
