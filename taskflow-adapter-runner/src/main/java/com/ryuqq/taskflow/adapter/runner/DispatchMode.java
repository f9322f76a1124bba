package com.ryuqq.taskflow.adapter.runner;

/**
 * Producer 디스패치 방식.
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public enum DispatchMode {

    /**
     * Producer마다 Coordinator의 워커 스레드에 제출 (기본값).
     */
    CONCURRENT,

    /**
     * 호출 스레드에서 Producer를 하나씩 순서대로 실행.
     */
    SEQUENTIAL
}
