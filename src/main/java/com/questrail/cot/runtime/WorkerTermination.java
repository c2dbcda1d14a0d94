package com.questrail.cot.runtime;

import java.util.Objects;
import java.util.Optional;

/**
 * The first task to finish in {@link CotTransportRuntime#run()}.
 *
 * @param task    name the task was registered under
 * @param failure what ended it; empty when it returned normally
 */
public record WorkerTermination(String task, Optional<Throwable> failure)
{
    public WorkerTermination {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(failure, "failure");
    }

    public boolean failed() {
        return failure.isPresent();
    }
}
