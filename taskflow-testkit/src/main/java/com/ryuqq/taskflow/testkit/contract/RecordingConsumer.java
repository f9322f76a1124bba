package com.ryuqq.taskflow.testkit.contract;

import com.ryuqq.taskflow.core.contract.ComposeInput;
import com.ryuqq.taskflow.core.exception.TaskFailureException;
import com.ryuqq.taskflow.core.model.Payload;
import com.ryuqq.taskflow.core.operation.ConsumerOperation;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Consumer test double that records the input it was composed from.
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class RecordingConsumer implements ConsumerOperation {

    private final String result;
    private final String errorCode;
    private final String errorMessage;

    private final AtomicInteger invocations = new AtomicInteger();
    private final AtomicReference<ComposeInput> lastInput = new AtomicReference<>();
    private final AtomicLong startedAtNanos = new AtomicLong(ScriptedProducer.NEVER);

    private RecordingConsumer(String result, String errorCode, String errorMessage) {
        this.result = result;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public static RecordingConsumer returning(String result) {
        return new RecordingConsumer(result, null, null);
    }

    public static RecordingConsumer failing(String errorCode, String message) {
        return new RecordingConsumer(null, errorCode, message);
    }

    @Override
    public Payload compose(ComposeInput input) throws Exception {
        startedAtNanos.compareAndSet(ScriptedProducer.NEVER, System.nanoTime());
        invocations.incrementAndGet();
        lastInput.set(input);
        if (errorCode != null) {
            throw new TaskFailureException(errorCode, errorMessage);
        }
        return Payload.of(result);
    }

    public int invocationCount() {
        return invocations.get();
    }

    /**
     * @return input of the most recent invocation, null if never invoked
     */
    public ComposeInput lastInput() {
        return lastInput.get();
    }

    /**
     * @return {@link System#nanoTime()} of the first invocation, {@link ScriptedProducer#NEVER} if never invoked
     */
    public long startedAtNanos() {
        return startedAtNanos.get();
    }
}
