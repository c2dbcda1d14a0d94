package com.questrail.cot.observability;

import java.time.Instant;

/**
 * Record representing one drop-oldest eviction.
 *
 * @param worker          name of the worker that admitted the new entry
 * @param capacity        configured queue capacity
 * @param capacitySetting configuration key that controls the capacity
 */
public record QueueOverflowEvent(
    Instant timestamp,
    String worker,
    int capacity,
    String capacitySetting
) {
}
