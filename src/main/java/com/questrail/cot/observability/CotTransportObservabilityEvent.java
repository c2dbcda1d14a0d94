package com.questrail.cot.observability;

import java.time.Instant;

/**
 * Record representing a transport lifecycle change.
 */
public record CotTransportObservabilityEvent(
    Instant timestamp,
    String transport,
    Kind kind,
    String detail
) {
    public enum Kind {
        OPENED,
        CLOSED,
        /** A datagram stream received a second connection callback. */
        REPLACED
    }
}
