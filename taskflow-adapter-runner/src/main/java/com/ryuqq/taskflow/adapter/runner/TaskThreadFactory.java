package com.ryuqq.taskflow.adapter.runner;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Taskflow 워커 스레드 팩토리.
 *
 * <p>스레드 이름은 {@code taskflow-<pool>-<n>} 형식이며 모두 daemon 스레드입니다.
 * deadline 초과로 버려진 작업이 JVM 종료를 막지 않도록 합니다.</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class TaskThreadFactory implements ThreadFactory {

    private final String namePrefix;
    private final AtomicInteger sequence = new AtomicInteger(1);

    /**
     * 생성자.
     *
     * @param poolName 풀 이름 (예: "producer", "run")
     * @throws IllegalArgumentException poolName이 null이거나 빈 문자열인 경우
     */
    public TaskThreadFactory(String poolName) {
        if (poolName == null || poolName.isBlank()) {
            throw new IllegalArgumentException("poolName cannot be null or blank");
        }
        this.namePrefix = "taskflow-" + poolName + "-";
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, namePrefix + sequence.getAndIncrement());
        thread.setDaemon(true);
        return thread;
    }
}
