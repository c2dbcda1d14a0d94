package com.questrail.cot.observability;

/**
 * Main interface for receiving transport-layer observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>One sink is shared by every component of a runtime through
 * {@code TransportContext}; callbacks may arrive from worker threads and
 * Netty event loops concurrently.</p>
 */
public interface CotObservabilitySink {
    /**
     * Called when a worker starts or terminates.
     * @param event the lifecycle event
     */
    void onWorkerEvent(WorkerLifecycleEvent event);

    /**
     * Called when a transport opens, closes, or is replaced.
     * @param event the transport event
     */
    void onTransportEvent(CotTransportObservabilityEvent event);

    /**
     * Called when a bounded queue evicted its oldest entry to admit a new one.
     * @param event the overflow details
     */
    void onQueueOverflow(QueueOverflowEvent event);

    /**
     * Called for conditions an operator should see but that do not stop the pipeline
     * (relaxed TLS checks, dropped payloads, codec fallbacks).
     * @param event the warning
     */
    void onWarning(CotWarningEvent event);

    /**
     * Called when an error ends an endpoint or one of its workers.
     * @param event the error event
     */
    void onError(CotErrorEvent event);
}
