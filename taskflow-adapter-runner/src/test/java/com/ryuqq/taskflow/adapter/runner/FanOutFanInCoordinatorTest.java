package com.ryuqq.taskflow.adapter.runner;

import com.ryuqq.taskflow.adapter.inmemory.state.InMemoryRunState;
import com.ryuqq.taskflow.application.coordinator.ConsumerTask;
import com.ryuqq.taskflow.application.coordinator.ProducerTask;
import com.ryuqq.taskflow.core.contract.ComposeInput;
import com.ryuqq.taskflow.core.exception.InvariantViolationException;
import com.ryuqq.taskflow.core.exception.TaskFailureException;
import com.ryuqq.taskflow.core.model.Payload;
import com.ryuqq.taskflow.core.model.TaskId;
import com.ryuqq.taskflow.core.outcome.Failure;
import com.ryuqq.taskflow.core.outcome.Outcome;
import com.ryuqq.taskflow.core.outcome.Success;
import com.ryuqq.taskflow.core.spi.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FanOutFanInCoordinator 유닛 테스트.
 *
 * <ul>
 *   <li>Join barrier: Consumer는 모든 Producer 종료 후에만 시작</li>
 *   <li>실패 격리: Producer 실패는 실패 마커로 Consumer에 전달</li>
 *   <li>CONCURRENT / SEQUENTIAL 디스패치</li>
 *   <li>불변식 위반 전파</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
class FanOutFanInCoordinatorTest {

    private static final TaskId REPO_FETCH = TaskId.of("repo-fetch");
    private static final TaskId PAGE_SCRAPE = TaskId.of("page-scrape");
    private static final TaskId KEYWORDS = TaskId.of("keywords");
    private static final TaskId COMPOSE = TaskId.of("compose");

    private FanOutFanInCoordinator coordinator;
    private RunState runState;

    @BeforeEach
    void setUp() {
        coordinator = new FanOutFanInCoordinator(new CoordinatorConfig());
        runState = new InMemoryRunState();
    }

    // ============================================================
    // 1. Join barrier
    // ============================================================

    @Test
    void execute_Consumer는_가장_느린_Producer가_끝난_뒤_시작() {
        // given
        AtomicLong slowestFinishedAt = new AtomicLong();
        AtomicLong consumerStartedAt = new AtomicLong();
        List<ProducerTask> producers = List.of(
            new ProducerTask(REPO_FETCH, () -> Payload.of("R1")),
            new ProducerTask(PAGE_SCRAPE, () -> {
                Thread.sleep(150);
                slowestFinishedAt.set(System.nanoTime());
                return Payload.of("P1");
            })
        );
        ConsumerTask consumer = new ConsumerTask(COMPOSE, input -> {
            consumerStartedAt.set(System.nanoTime());
            return Payload.of("composed");
        }, Map.of());

        // when
        Outcome outcome = coordinator.execute(producers, consumer, runState);

        // then
        assertThat(outcome).isEqualTo(Success.of("composed"));
        assertThat(consumerStartedAt.get()).isGreaterThanOrEqualTo(slowestFinishedAt.get());
    }

    @Test
    void execute_Producer는_동시에_실행된다() throws InterruptedException {
        // given: 두 Producer가 서로를 기다림 (동시 실행이 아니면 데드락)
        CountDownLatch bothStarted = new CountDownLatch(2);
        List<ProducerTask> producers = List.of(
            new ProducerTask(REPO_FETCH, () -> awaitPeer(bothStarted, "R1")),
            new ProducerTask(PAGE_SCRAPE, () -> awaitPeer(bothStarted, "P1"))
        );
        ConsumerTask consumer = new ConsumerTask(COMPOSE, input -> Payload.of("done"), Map.of());

        // when
        Outcome outcome = coordinator.execute(producers, consumer, runState);

        // then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(runState.findOutcome(REPO_FETCH)).isEqualTo(Success.of("R1"));
        assertThat(runState.findOutcome(PAGE_SCRAPE)).isEqualTo(Success.of("P1"));
    }

    private static Payload awaitPeer(CountDownLatch latch, String value) throws Exception {
        latch.countDown();
        if (!latch.await(2, TimeUnit.SECONDS)) {
            throw new TaskFailureException("NOT_CONCURRENT", "peer producer never started");
        }
        return Payload.of(value);
    }

    // ============================================================
    // 2. 실패 격리
    // ============================================================

    @Test
    void execute_Producer_실패는_실패_마커로_Consumer에_전달() {
        // given
        AtomicReference<ComposeInput> received = new AtomicReference<>();
        List<ProducerTask> producers = List.of(
            new ProducerTask(REPO_FETCH, () -> Payload.of("R1")),
            new ProducerTask(PAGE_SCRAPE, () -> {
                throw new IllegalStateException("page not reachable");
            }),
            new ProducerTask(KEYWORDS, () -> Payload.of("K1"))
        );
        ConsumerTask consumer = new ConsumerTask(COMPOSE, input -> {
            received.set(input);
            return Payload.of("partial");
        }, Map.of("skills", "java"));

        // when
        Outcome outcome = coordinator.execute(producers, consumer, runState);

        // then
        assertThat(outcome).isEqualTo(Success.of("partial"));
        ComposeInput input = received.get();
        assertThat(input.outcomeOf(REPO_FETCH)).isEqualTo(Success.of("R1"));
        assertThat(input.outcomeOf(PAGE_SCRAPE)).isEqualTo(Failure.of(Failure.TASK_FAILED, "page not reachable"));
        assertThat(input.outcomeOf(KEYWORDS)).isEqualTo(Success.of("K1"));
        assertThat(input.failedTasks()).containsExactly(PAGE_SCRAPE);
        assertThat(input.field("skills")).isEqualTo("java");
    }

    @Test
    void execute_Consumer_실패는_최종_결과() {
        // given
        List<ProducerTask> producers = List.of(new ProducerTask(REPO_FETCH, () -> Payload.of("R1")));
        ConsumerTask consumer = new ConsumerTask(COMPOSE, input -> {
            throw new TaskFailureException("COMPOSE_FAILED", "model unavailable");
        }, Map.of());

        // when
        Outcome outcome = coordinator.execute(producers, consumer, runState);

        // then
        assertThat(outcome).isEqualTo(Failure.of("COMPOSE_FAILED", "model unavailable"));
        assertThat(runState.findOutcome(COMPOSE)).isEqualTo(outcome);
    }

    // ============================================================
    // 3. SEQUENTIAL 모드
    // ============================================================

    @Test
    void execute_SEQUENTIAL은_호출_스레드에서_하나씩_실행() {
        // given
        FanOutFanInCoordinator sequential = new FanOutFanInCoordinator(
            new CoordinatorConfig().withDispatchMode(DispatchMode.SEQUENTIAL));
        Thread caller = Thread.currentThread();
        Map<TaskId, Thread> threads = new ConcurrentHashMap<>();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<ProducerTask> producers = List.of(
            new ProducerTask(REPO_FETCH, () -> track(REPO_FETCH, threads, running, maxRunning)),
            new ProducerTask(PAGE_SCRAPE, () -> track(PAGE_SCRAPE, threads, running, maxRunning))
        );
        ConsumerTask consumer = new ConsumerTask(COMPOSE, input -> Payload.of("done"), Map.of());

        // when
        Outcome outcome = sequential.execute(producers, consumer, runState);

        // then
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(threads.values()).containsOnly(caller);
        assertThat(maxRunning.get()).isEqualTo(1);
    }

    private static Payload track(TaskId taskId, Map<TaskId, Thread> threads,
                                 AtomicInteger running, AtomicInteger maxRunning) throws InterruptedException {
        threads.put(taskId, Thread.currentThread());
        maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
        Thread.sleep(20);
        running.decrementAndGet();
        return Payload.of(taskId.getValue());
    }

    // ============================================================
    // 4. 불변식 위반 / 입력 검증
    // ============================================================

    @Test
    void execute_이미_admission된_Producer가_진행중이면_InvariantViolation_전파() {
        // given: 같은 Run State에서 다른 호출자가 이미 실행 중
        runState.tryAdmit(REPO_FETCH);
        List<ProducerTask> producers = List.of(new ProducerTask(REPO_FETCH, () -> Payload.of("R1")));
        ConsumerTask consumer = new ConsumerTask(COMPOSE, input -> Payload.of("done"), Map.of());

        // when & then
        assertThatThrownBy(() -> coordinator.execute(producers, consumer, runState))
            .isInstanceOf(InvariantViolationException.class);
        assertThat(runState.findOutcome(COMPOSE)).isNull();
    }

    @Test
    void execute_빈_Producer_목록은_IllegalArgumentException() {
        ConsumerTask consumer = new ConsumerTask(COMPOSE, input -> Payload.of("done"), Map.of());

        assertThatThrownBy(() -> coordinator.execute(List.of(), consumer, runState))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("producers");
    }

    @Test
    void 생성자_null_config는_IllegalArgumentException() {
        assertThatThrownBy(() -> new FanOutFanInCoordinator((CoordinatorConfig) null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }
}
