package com.ryuqq.taskflow.adapter.runner;

import com.ryuqq.taskflow.core.exception.InvariantViolationException;
import com.ryuqq.taskflow.core.exception.TaskFailureException;
import com.ryuqq.taskflow.core.model.Payload;
import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.operation.TaskOperation;
import com.ryuqq.taskflow.core.outcome.Failure;
import com.ryuqq.taskflow.core.outcome.Outcome;
import com.ryuqq.taskflow.core.outcome.Success;
import com.ryuqq.taskflow.core.spi.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guarded Task.
 *
 * <p>하나의 Run State에 대해 작업을 최대 한 번만 실행하고, 결과를 Outcome으로 기록합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. runState.tryAdmit(taskId)
 *    - false → 기록된 결과 즉시 반환 (재실행/대기 없음)
 *              기록된 결과가 없으면 InvariantViolationException
 * 2. operation.execute() 정확히 한 번 호출
 *    - 반환값 → Success (null이면 Failure(NULL_RESULT))
 *    - TaskFailureException → Failure(errorCode 유지)
 *    - 그 외 예외, Error → Failure(TASK_FAILED)
 *    - VirtualMachineError → Failure(TASK_FAILED) 기록 후 전파
 * 3. runState.recordOutcome(taskId, outcome) 후 반환
 * </pre>
 *
 * <p>작업 예외는 호출자에게 전파되지 않습니다. Run State의 불변식 위반과
 * {@link VirtualMachineError}만 전파되며, 후자도 Task를 종료 상태로 기록한 뒤 전파합니다.</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class GuardedTask {

    private static final Logger log = LoggerFactory.getLogger(GuardedTask.class);

    private final RunState runState;

    /**
     * 생성자.
     *
     * @param runState 이 Run의 Run State
     * @throws IllegalArgumentException runState가 null인 경우
     */
    public GuardedTask(RunState runState) {
        if (runState == null) {
            throw new IllegalArgumentException("runState cannot be null");
        }
        this.runState = runState;
    }

    /**
     * 작업 실행 (Run당 최대 한 번).
     *
     * @param taskId Task 식별자
     * @param operation 실행할 작업
     * @return 기록된 결과 (Success 또는 Failure)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws InvariantViolationException 이미 admission된 Task의 결과가 아직 없거나, 결과 기록이 거부된 경우
     */
    public Outcome run(TaskId taskId, TaskOperation operation) {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        if (!runState.tryAdmit(taskId)) {
            return recordedOutcomeOf(taskId);
        }
        log.debug("Task admitted: {}", taskId);

        Outcome outcome;
        try {
            outcome = invoke(taskId, operation);
        } catch (VirtualMachineError e) {
            // 진행 중 상태로 남지 않도록 기록 후 전파
            runState.recordOutcome(taskId, Failure.of(Failure.TASK_FAILED, describe(e)));
            log.error("Task {} aborted by {}", taskId, e.getClass().getName());
            throw e;
        }
        runState.recordOutcome(taskId, outcome);

        if (outcome instanceof Failure failure) {
            log.warn("Task {} failed: [{}] {}", taskId, failure.errorCode(), failure.message());
        } else {
            log.info("Task {} succeeded: {}", taskId, outcome);
        }
        return outcome;
    }

    private Outcome recordedOutcomeOf(TaskId taskId) {
        Outcome recorded = runState.findOutcome(taskId);
        if (recorded == null) {
            throw new InvariantViolationException(taskId, "Task admitted twice while still in progress");
        }
        log.info("Duplicate admission for {}, returning recorded outcome {}", taskId, recorded);
        return recorded;
    }

    /**
     * 작업 호출 및 결과 변환.
     *
     * @param taskId Task 식별자
     * @param operation 작업
     * @return Success 또는 Failure
     * @throws VirtualMachineError JVM 자원 고갈 시 (변환하지 않음)
     */
    private Outcome invoke(TaskId taskId, TaskOperation operation) {
        try {
            Payload payload = operation.execute();
            if (payload == null) {
                return Failure.of(Failure.NULL_RESULT, "operation returned no result");
            }
            return new Success(payload);
        } catch (TaskFailureException e) {
            return Failure.of(e.getErrorCode(), describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Task {} interrupted", taskId);
            return Failure.of(Failure.TASK_FAILED, describe(e));
        } catch (Exception e) {
            log.debug("Task {} threw {}", taskId, e.getClass().getName(), e);
            return Failure.of(Failure.TASK_FAILED, describe(e));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            log.warn("Task {} threw error {}", taskId, e.getClass().getName(), e);
            return Failure.of(Failure.TASK_FAILED, describe(e));
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }
}
