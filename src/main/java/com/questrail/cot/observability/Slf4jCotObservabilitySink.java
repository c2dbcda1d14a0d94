package com.questrail.cot.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CotObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCotObservabilitySink implements CotObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCotObservabilitySink.class);

    @Override
    public void onWorkerEvent(WorkerLifecycleEvent event) {
        if (event.phase() == WorkerLifecycleEvent.Phase.STARTED) {
            log.info("Running: {}", event.worker());
        } else if (event.cause() != null) {
            log.error("Worker {} terminated: {}", event.worker(), event.cause().toString(), event.cause());
        } else {
            log.info("Worker {} terminated", event.worker());
        }
    }

    @Override
    public void onTransportEvent(CotTransportObservabilityEvent event) {
        if (event.kind() == CotTransportObservabilityEvent.Kind.REPLACED) {
            log.warn("Transport {} replaced: {}", event.transport(), event.detail());
        } else {
            log.debug("Transport {} {}: {}", event.transport(), event.kind(), event.detail());
        }
    }

    @Override
    public void onQueueOverflow(QueueOverflowEvent event) {
        log.warn("Queue full ({}), dropping oldest data in {}. Consider raising {}",
            event.capacity(), event.worker(), event.capacitySetting());
    }

    @Override
    public void onWarning(CotWarningEvent event) {
        log.warn("{}: {}", event.source(), event.message());
    }

    @Override
    public void onError(CotErrorEvent event) {
        log.error("CoT transport error: {}", event.message(), event.cause());
    }
}
