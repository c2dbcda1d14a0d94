package com.questrail.cot.observability;

import java.time.Instant;

/**
 * Record representing an error that ended an endpoint or one of its workers.
 */
public record CotErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
