package com.ryuqq.taskflow.adapter.inmemory.state;

import com.ryuqq.taskflow.core.spi.RunState;
import com.ryuqq.taskflow.core.spi.RunStateFactory;

/**
 * {@link RunStateFactory} handing out a new, empty {@link InMemoryRunState} on every call.
 *
 * <p>The factory itself is stateless and may be shared by any number of run drivers.</p>
 *
 * @author Taskflow Team
 * @since 1.0.0
 */
public final class InMemoryRunStateFactory implements RunStateFactory {

    @Override
    public RunState create() {
        return new InMemoryRunState();
    }
}
