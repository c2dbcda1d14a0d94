package com.questrail.cot.observability;

import java.time.Instant;

/**
 * Record representing a condition worth an operator's attention that the
 * pipeline resolved locally.
 */
public record CotWarningEvent(
    Instant timestamp,
    String source,
    String message
) {
}
