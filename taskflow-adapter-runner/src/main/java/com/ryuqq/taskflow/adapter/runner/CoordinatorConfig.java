package com.ryuqq.taskflow.adapter.runner;

/**
 * Coordinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>dispatchMode: Producer 디스패치 방식 (기본 CONCURRENT)</li>
 *   <li>producerConcurrency: Producer 워커 스레드 수 (기본 4)</li>
 * </ul>
 *
 * <p>producerConcurrency가 Producer 수보다 작으면 남은 Producer는 큐에서 대기합니다.
 * SEQUENTIAL 모드에서는 사용되지 않습니다.</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 * @param dispatchMode 디스패치 방식 (null 불가)
 * @param producerConcurrency 워커 스레드 수 (1 이상)
 */
public record CoordinatorConfig(DispatchMode dispatchMode, int producerConcurrency) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: dispatchMode=CONCURRENT, producerConcurrency=4</p>
     */
    public CoordinatorConfig() {
        this(DispatchMode.CONCURRENT, 4);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CoordinatorConfig {
        if (dispatchMode == null) {
            throw new IllegalArgumentException("dispatchMode cannot be null");
        }
        if (producerConcurrency <= 0) {
            throw new IllegalArgumentException(
                "producerConcurrency must be positive (current: " + producerConcurrency + ")"
            );
        }
    }

    /**
     * dispatchMode만 변경한 새 인스턴스 생성.
     *
     * @param dispatchMode 새 디스패치 방식
     * @return 새 CoordinatorConfig 인스턴스
     */
    public CoordinatorConfig withDispatchMode(DispatchMode dispatchMode) {
        return new CoordinatorConfig(dispatchMode, this.producerConcurrency);
    }

    /**
     * producerConcurrency만 변경한 새 인스턴스 생성.
     *
     * @param producerConcurrency 새 워커 스레드 수
     * @return 새 CoordinatorConfig 인스턴스
     */
    public CoordinatorConfig withProducerConcurrency(int producerConcurrency) {
        return new CoordinatorConfig(this.dispatchMode, producerConcurrency);
    }
}
