package com.questrail.cot.observability;

/**
 * No-op implementation of CotObservabilitySink.
 */
public final class NullObservabilitySink implements CotObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onWorkerEvent(WorkerLifecycleEvent event) {}

    @Override
    public void onTransportEvent(CotTransportObservabilityEvent event) {}

    @Override
    public void onQueueOverflow(QueueOverflowEvent event) {}

    @Override
    public void onWarning(CotWarningEvent event) {}

    @Override
    public void onError(CotErrorEvent event) {}
}
