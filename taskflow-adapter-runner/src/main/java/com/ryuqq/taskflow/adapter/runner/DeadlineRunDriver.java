package com.ryuqq.taskflow.adapter.runner;

import com.ryuqq.taskflow.application.coordinator.ConsumerTask;
import com.ryuqq.taskflow.application.coordinator.Coordinator;
import com.ryuqq.taskflow.application.coordinator.ProducerTask;
import com.ryuqq.taskflow.application.driver.RunDriver;
import com.ryuqq.taskflow.application.driver.WorkflowResult;
import com.ryuqq.taskflow.core.contract.ProducerSpec;
import com.ryuqq.taskflow.core.contract.WorkflowDefinition;
import com.ryuqq.taskflow.core.contract.WorkflowInputs;
import com.ryuqq.taskflow.core.exception.TaskFailureException;
import com.ryuqq.taskflow.core.model.Payload;
import com.ryuqq.taskflow.core.model.RunId;
import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.operation.TaskOperation;
import com.ryuqq.taskflow.core.outcome.Failure;
import com.ryuqq.taskflow.core.outcome.Outcome;
import com.ryuqq.taskflow.core.outcome.Timeout;
import com.ryuqq.taskflow.core.spi.RunState;
import com.ryuqq.taskflow.core.spi.RunStateFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Deadline 기반 Run Driver 구현체.
 *
 * <p>호출마다 새 Run State를 만들고, Coordinator를 드라이버 스레드에서 실행한 뒤
 * deadline까지만 결과를 기다립니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>RunId 생성, RunStateFactory로 빈 Run State 생성</li>
 *   <li>Producer를 입력과 바인딩 (입력이 없으면 Failure(NO_INPUT)을 기록하는 작업으로 바인딩)</li>
 *   <li>입력 요약 로깅</li>
 *   <li>Coordinator.execute를 드라이버 executor에 제출 (비블로킹)</li>
 *   <li>deadline까지 대기</li>
 *   <li>완료 시: Consumer 결과 반환</li>
 *   <li>deadline 초과 시: 진행 중인 작업은 버리고(대기/인터럽트 없음) Timeout 반환</li>
 * </ol>
 *
 * <p><strong>스레드 모델:</strong></p>
 * <ul>
 *   <li>드라이버 executor는 daemon 스레드의 cached pool ({@code taskflow-run-<n>})</li>
 *   <li>버려진 Run은 작업이 반환될 때까지 스레드를 점유하지만 다른 Run의 Run State에는 접근하지 않음</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class DeadlineRunDriver implements RunDriver {

    private static final Logger log = LoggerFactory.getLogger(DeadlineRunDriver.class);

    private final WorkflowDefinition definition;
    private final Coordinator coordinator;
    private final RunStateFactory runStateFactory;
    private final RunDriverConfig config;
    private final ExecutorService runExecutor;

    /**
     * 생성자.
     *
     * @param definition 워크플로우 정의 (Producer 목록과 Consumer)
     * @param coordinator Coordinator
     * @param runStateFactory Run State 팩토리
     * @param config 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DeadlineRunDriver(
        WorkflowDefinition definition,
        Coordinator coordinator,
        RunStateFactory runStateFactory,
        RunDriverConfig config
    ) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (runStateFactory == null) {
            throw new IllegalArgumentException("runStateFactory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.definition = definition;
        this.coordinator = coordinator;
        this.runStateFactory = runStateFactory;
        this.config = config;
        this.runExecutor = Executors.newCachedThreadPool(new TaskThreadFactory("run"));
    }

    @Override
    public WorkflowResult runWorkflow(WorkflowInputs inputs) {
        return runWorkflow(inputs, config.deadlineMs());
    }

    @Override
    public WorkflowResult runWorkflow(WorkflowInputs inputs, long deadlineMs) {
        if (inputs == null) {
            throw new IllegalArgumentException("inputs cannot be null");
        }
        RunDriverConfig.validateDeadline(deadlineMs);

        // 1. 이 호출 전용 Run State
        RunId runId = RunId.generate();
        RunState runState = runStateFactory.create();
        if (runState == null) {
            throw new IllegalStateException("runStateFactory returned null");
        }

        // 2. Producer / Consumer 바인딩
        List<ProducerTask> producers = bindProducers(inputs);
        ConsumerTask consumer = new ConsumerTask(
            definition.consumer().taskId(),
            definition.consumer().operation(),
            inputs.getFreeFormFields()
        );
        logInputSummary(runId, inputs, deadlineMs);

        // 3. 드라이버 스레드에서 Coordinator 실행
        long startNanos = System.nanoTime();
        Future<Outcome> future = runExecutor.submit(() -> coordinator.execute(producers, consumer, runState));

        // 4-6. deadline까지 대기
        Outcome outcome = awaitOutcome(runId, future, deadlineMs, startNanos);
        long elapsedMs = elapsedMsSince(startNanos);

        WorkflowResult result = new WorkflowResult(runId, outcome, runState.snapshot(), elapsedMs);
        log.info("Run {} finished in {}ms: {}", runId, elapsedMs, outcome);
        return result;
    }

    /**
     * 입력이 없는 Producer는 작업 대신 NO_INPUT 실패를 기록하도록 바인딩.
     *
     * <p>Guarded Task를 거치므로 건너뛴 Producer도 admission 됩니다.</p>
     *
     * @param inputs 호출자 입력
     * @return 바인딩된 Producer 목록 (정의 순서)
     */
    private List<ProducerTask> bindProducers(WorkflowInputs inputs) {
        List<ProducerTask> producers = new ArrayList<>(definition.producers().size());
        for (ProducerSpec spec : definition.producers()) {
            String input = inputs.inputFor(spec.taskId());
            TaskOperation operation = input != null
                ? spec.operation().bind(input)
                : DeadlineRunDriver::noInput;
            producers.add(new ProducerTask(spec.taskId(), operation));
        }
        return producers;
    }

    private static Payload noInput() throws TaskFailureException {
        throw new TaskFailureException(Failure.NO_INPUT, Failure.noInput().message());
    }

    private Outcome awaitOutcome(RunId runId, Future<Outcome> future, long deadlineMs, long startNanos) {
        try {
            return future.get(deadlineMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // 버린 Run은 취소하지 않음: 진행 중인 작업이 끝나면 자신의 Run State에만 기록
            long elapsedMs = Math.max(elapsedMsSince(startNanos), deadlineMs);
            log.warn("Run {} exceeded deadline of {}ms, abandoning in-flight tasks", runId, deadlineMs);
            return new Timeout(deadlineMs, elapsedMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("Run {} aborted", runId, cause);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Run " + runId + " aborted", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for run " + runId, e);
        }
    }

    private void logInputSummary(RunId runId, WorkflowInputs inputs, long deadlineMs) {
        List<TaskId> provided = new ArrayList<>();
        List<TaskId> skipped = new ArrayList<>();
        for (TaskId taskId : definition.producerIds()) {
            if (inputs.hasInput(taskId)) {
                provided.add(taskId);
            } else {
                skipped.add(taskId);
            }
        }
        log.info("Run {} started (deadline {}ms): inputs provided for {}, skipped {}, free-form fields {}",
            runId, deadlineMs, provided, skipped, inputs.getFreeFormFields().keySet());
    }

    private static long elapsedMsSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * 드라이버 executor 종료.
     *
     * <p>shutdownGraceMs 동안 진행 중인 Run을 기다린 뒤, 남아 있으면 인터럽트합니다.
     * 종료 후에는 runWorkflow 호출이 거부됩니다.</p>
     */
    public void shutdown() {
        runExecutor.shutdown();
        try {
            if (!runExecutor.awaitTermination(config.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Run executor did not terminate in {}ms, forcing shutdown", config.shutdownGraceMs());
                runExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runExecutor.shutdownNow();
        }
    }
}
