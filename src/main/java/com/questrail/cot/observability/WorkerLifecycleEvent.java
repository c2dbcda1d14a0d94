package com.questrail.cot.observability;

import java.time.Instant;

/**
 * Record representing a worker starting or terminating.
 *
 * @param cause the failure that ended the worker; {@code null} when it
 *              started, completed normally, or was cancelled
 */
public record WorkerLifecycleEvent(
    Instant timestamp,
    String worker,
    Phase phase,
    Throwable cause
) {
    public enum Phase {
        STARTED,
        TERMINATED
    }
}
