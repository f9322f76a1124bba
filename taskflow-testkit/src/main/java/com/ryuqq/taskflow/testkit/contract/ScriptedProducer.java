package com.ryuqq.taskflow.testkit.contract;

import com.ryuqq.taskflow.core.exception.TaskFailureException;
import com.ryuqq.taskflow.core.model.Payload;
import com.ryuqq.taskflow.core.operation.ProducerOperation;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Scripted producer test double.
 *
 * <p>Behaves according to a fixed script and records every invocation so contract tests
 * can assert on call counts and timing.</p>
 *
 * <p><strong>Scripts:</strong></p>
 * <ul>
 *   <li>{@link #succeeding(String)}: returns the given value immediately</li>
 *   <li>{@link #delayed(String, long)}: sleeps, then returns the given value</li>
 *   <li>{@link #failing(String, String)}: throws {@link TaskFailureException}</li>
 *   <li>{@link #hanging(CountDownLatch, String)}: blocks until the latch is released</li>
 * </ul>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class ScriptedProducer implements ProducerOperation {

    /**
     * Timestamp value reported for an event that never happened.
     */
    public static final long NEVER = Long.MIN_VALUE;

    private static final long HANG_LIMIT_SECONDS = 30;

    private final String result;
    private final long delayMs;
    private final String errorCode;
    private final String errorMessage;
    private final CountDownLatch release;

    private final AtomicInteger invocations = new AtomicInteger();
    private final List<String> receivedInputs = new CopyOnWriteArrayList<>();
    private final AtomicLong startedAtNanos = new AtomicLong(NEVER);
    private final AtomicLong finishedAtNanos = new AtomicLong(NEVER);

    private ScriptedProducer(String result, long delayMs, String errorCode, String errorMessage, CountDownLatch release) {
        this.result = result;
        this.delayMs = delayMs;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
        this.release = release;
    }

    public static ScriptedProducer succeeding(String result) {
        return new ScriptedProducer(result, 0, null, null, null);
    }

    public static ScriptedProducer delayed(String result, long delayMs) {
        return new ScriptedProducer(result, delayMs, null, null, null);
    }

    public static ScriptedProducer failing(String errorCode, String message) {
        return new ScriptedProducer(null, 0, errorCode, message, null);
    }

    /**
     * Producer that blocks until {@code release} is counted down.
     *
     * @param release latch the test releases in its cleanup
     * @param result value returned once released
     * @return scripted producer
     */
    public static ScriptedProducer hanging(CountDownLatch release, String result) {
        return new ScriptedProducer(result, 0, null, null, release);
    }

    @Override
    public Payload produce(String input) throws Exception {
        startedAtNanos.compareAndSet(NEVER, System.nanoTime());
        invocations.incrementAndGet();
        receivedInputs.add(input);
        try {
            if (release != null) {
                release.await(HANG_LIMIT_SECONDS, TimeUnit.SECONDS);
            }
            if (delayMs > 0) {
                Thread.sleep(delayMs);
            }
            if (errorCode != null) {
                throw new TaskFailureException(errorCode, errorMessage);
            }
            return Payload.of(result);
        } finally {
            finishedAtNanos.set(System.nanoTime());
        }
    }

    public int invocationCount() {
        return invocations.get();
    }

    public List<String> receivedInputs() {
        return List.copyOf(receivedInputs);
    }

    /**
     * @return {@link System#nanoTime()} of the first invocation, {@link #NEVER} if never invoked
     */
    public long startedAtNanos() {
        return startedAtNanos.get();
    }

    /**
     * @return {@link System#nanoTime()} when the last invocation returned or threw, {@link #NEVER} if none did
     */
    public long finishedAtNanos() {
        return finishedAtNanos.get();
    }
}
