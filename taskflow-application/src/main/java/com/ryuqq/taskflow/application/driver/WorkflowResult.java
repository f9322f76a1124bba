package com.ryuqq.taskflow.application.driver;

import com.ryuqq.taskflow.core.model.RunId;
import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.outcome.Outcome;
import com.ryuqq.taskflow.core.outcome.Success;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 워크플로우 Run 결과 핸들.
 *
 * <p>Run Driver 호출 한 번에 대해 정확히 하나의 종료 결과를 담습니다.</p>
 *
 * <p><strong>세 가지 가능한 결과:</strong></p>
 * <ul>
 *   <li><strong>Success:</strong> Consumer가 구조화 결과를 만듦</li>
 *   <li><strong>Failure:</strong> Consumer가 실패함 (Producer 실패는 taskOutcomes로 확인)</li>
 *   <li><strong>Timeout:</strong> Run이 deadline 내에 끝나지 않음</li>
 * </ul>
 *
 * <p><strong>taskOutcomes:</strong> Run Driver가 대기를 멈춘 시점의 Run State 스냅샷입니다.
 * 타임아웃의 경우 어떤 Task가 끝나지 않았는지 진단하는 데 사용할 수 있습니다
 * (스냅샷에 없는 Task = 미완료).</p>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class WorkflowResult {

    private final RunId runId;
    private final Outcome outcome;
    private final Map<TaskId, Outcome> taskOutcomes;
    private final long elapsedMs;

    /**
     * 생성자.
     *
     * @param runId Run 식별자
     * @param outcome 워크플로우 결과
     * @param taskOutcomes Task별 결과 스냅샷
     * @param elapsedMs 경과 시간 (밀리초)
     * @throws IllegalArgumentException 인자가 null이거나 elapsedMs가 음수인 경우
     */
    public WorkflowResult(RunId runId, Outcome outcome, Map<TaskId, Outcome> taskOutcomes, long elapsedMs) {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (taskOutcomes == null) {
            throw new IllegalArgumentException("taskOutcomes cannot be null");
        }
        if (elapsedMs < 0) {
            throw new IllegalArgumentException("elapsedMs must be non-negative (current: " + elapsedMs + ")");
        }
        this.runId = runId;
        this.outcome = outcome;
        this.taskOutcomes = Collections.unmodifiableMap(new LinkedHashMap<>(taskOutcomes));
        this.elapsedMs = elapsedMs;
    }

    public RunId getRunId() {
        return runId;
    }

    /**
     * 워크플로우 결과 (Consumer 결과 또는 Timeout).
     *
     * @return Outcome (non-null)
     */
    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * Task별 결과 스냅샷 (기록 순서).
     *
     * @return TaskId → Outcome (불변)
     */
    public Map<TaskId, Outcome> getTaskOutcomes() {
        return taskOutcomes;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    public boolean isTimeout() {
        return outcome.isTimeout();
    }

    /**
     * 성공 시 Consumer 결과 값.
     *
     * @return 결과 값, 성공이 아니면 null
     */
    public String payloadOrNull() {
        if (outcome instanceof Success success) {
            return success.payload().getValue();
        }
        return null;
    }

    /**
     * Task별 실패 요약 (Failure가 기록된 Task 목록, 기록 순서).
     *
     * @return 실패 TaskId 목록 (불변)
     */
    public List<TaskId> failedTasks() {
        List<TaskId> failed = new ArrayList<>();
        for (Map.Entry<TaskId, Outcome> entry : taskOutcomes.entrySet()) {
            if (entry.getValue().isFailure()) {
                failed.add(entry.getKey());
            }
        }
        return List.copyOf(failed);
    }

    @Override
    public String toString() {
        return "WorkflowResult{runId=" + runId + ", outcome=" + outcome
            + ", tasks=" + taskOutcomes.size() + ", elapsedMs=" + elapsedMs + "}";
    }
}
