package com.ryuqq.taskflow.adapter.runner;

import com.ryuqq.taskflow.application.coordinator.ConsumerTask;
import com.ryuqq.taskflow.application.coordinator.Coordinator;
import com.ryuqq.taskflow.application.coordinator.ProducerTask;
import com.ryuqq.taskflow.core.contract.ComposeInput;
import com.ryuqq.taskflow.core.exception.InvariantViolationException;
import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.outcome.Outcome;
import com.ryuqq.taskflow.core.spi.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Fan-out / Fan-in Coordinator 구현체.
 *
 * <p>모든 Producer를 Guarded Task로 디스패치하고, join barrier에서 전부 종료될 때까지
 * 기다린 뒤, Run State에 기록된 결과로 Consumer를 실행합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>Producer 디스패치 (CONCURRENT: 워커 스레드에 제출, SEQUENTIAL: 호출 스레드에서 순차 실행)</li>
 *   <li>Join barrier: 디스패치된 모든 Producer가 종료 상태가 될 때까지 대기</li>
 *   <li>Run State에서 Producer 결과를 모아 {@link ComposeInput} 구성 (Failure는 실패 마커로 그대로 전달)</li>
 *   <li>Consumer를 Guarded Task로 실행</li>
 *   <li>Consumer 결과 반환</li>
 * </ol>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>Producer 실패는 다른 Producer나 Consumer 실행을 막지 않음</li>
 *   <li>{@link InvariantViolationException}은 모든 Producer가 끝난 뒤 그대로 전파 (Run 중단)</li>
 * </ul>
 *
 * <p>Coordinator 인스턴스는 Run 상태를 갖지 않으므로 여러 Run이 동시에 사용해도 안전합니다.
 * Run마다 전달되는 {@link RunState}만 변경됩니다.</p>
 *
 * <p>CONCURRENT 모드의 워커 풀은 Run마다 새로 만들고 join barrier 이후 종료합니다.
 * 데드라인을 넘겨 버려진 Run의 Producer가 다음 Run의 워커를 점유하지 않습니다.</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class FanOutFanInCoordinator implements Coordinator {

    private static final Logger log = LoggerFactory.getLogger(FanOutFanInCoordinator.class);

    private final CoordinatorConfig config;

    /**
     * 생성자 (기본 설정).
     */
    public FanOutFanInCoordinator() {
        this(new CoordinatorConfig());
    }

    /**
     * 생성자.
     *
     * @param config Coordinator 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public FanOutFanInCoordinator(CoordinatorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public Outcome execute(List<ProducerTask> producers, ConsumerTask consumer, RunState runState) {
        if (producers == null || producers.isEmpty()) {
            throw new IllegalArgumentException("producers cannot be null or empty");
        }
        if (consumer == null) {
            throw new IllegalArgumentException("consumer cannot be null");
        }
        if (runState == null) {
            throw new IllegalArgumentException("runState cannot be null");
        }

        GuardedTask guardedTask = new GuardedTask(runState);

        // 1-2. Fan-out + join barrier
        log.debug("Dispatching {} producers ({})", producers.size(), config.dispatchMode());
        if (config.dispatchMode() == DispatchMode.SEQUENTIAL) {
            dispatchSequentially(producers, guardedTask);
        } else {
            dispatchConcurrently(producers, guardedTask);
        }

        // 3. Fan-in
        ComposeInput composeInput = collectInput(producers, consumer, runState);
        log.info("Join barrier passed: {} producers, {} failed", producers.size(), composeInput.failedTasks().size());

        // 4-5. Consumer
        return guardedTask.run(consumer.taskId(), consumer.operation().bind(composeInput));
    }

    private void dispatchSequentially(List<ProducerTask> producers, GuardedTask guardedTask) {
        for (ProducerTask producer : producers) {
            guardedTask.run(producer.taskId(), producer.operation());
        }
    }

    /**
     * 이 Run 전용 워커 풀에 Producer를 제출하고 전부 끝날 때까지 대기.
     *
     * <p>예외가 발생해도 다른 Producer가 끝날 때까지 기다린 뒤 전파합니다.</p>
     *
     * @param producers Producer 목록
     * @param guardedTask 이 Run의 Guarded Task
     */
    private void dispatchConcurrently(List<ProducerTask> producers, GuardedTask guardedTask) {
        ExecutorService producerExecutor = Executors.newFixedThreadPool(
            Math.min(config.producerConcurrency(), producers.size()),
            new TaskThreadFactory("producer")
        );
        try {
            awaitAll(submitAll(producers, guardedTask, producerExecutor));
        } finally {
            // 타임아웃으로 버려진 Run의 Producer는 이 풀 안에서만 계속 실행됨
            producerExecutor.shutdown();
        }
    }

    private List<CompletableFuture<Outcome>> submitAll(List<ProducerTask> producers, GuardedTask guardedTask,
                                                       ExecutorService producerExecutor) {
        List<CompletableFuture<Outcome>> futures = new ArrayList<>(producers.size());
        for (ProducerTask producer : producers) {
            futures.add(CompletableFuture.supplyAsync(
                () -> guardedTask.run(producer.taskId(), producer.operation()),
                producerExecutor
            ));
        }
        return futures;
    }

    private void awaitAll(List<CompletableFuture<Outcome>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Producer dispatch failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting at join barrier", e);
        }
    }

    private ComposeInput collectInput(List<ProducerTask> producers, ConsumerTask consumer, RunState runState) {
        Map<TaskId, Outcome> producerOutcomes = new LinkedHashMap<>();
        for (ProducerTask producer : producers) {
            Outcome outcome = runState.findOutcome(producer.taskId());
            if (outcome == null) {
                throw new InvariantViolationException(producer.taskId(), "Producer has no outcome after join barrier");
            }
            producerOutcomes.put(producer.taskId(), outcome);
        }
        return new ComposeInput(producerOutcomes, consumer.freeFormFields());
    }
}
