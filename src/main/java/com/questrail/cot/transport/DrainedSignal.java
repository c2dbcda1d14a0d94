package com.questrail.cot.transport;

/**
 * Boolean condition meaning "the outbound buffer is below its high-water mark".
 *
 * <p>Set by default. Netty writability callbacks clear and set it; senders
 * block in {@link #await()} while it is clear. Closing a transport sets it so
 * that no sender stays blocked on a dead channel.</p>
 */
public final class DrainedSignal
{
    private boolean drained = true;

    public synchronized void set() {
        drained = true;
        notifyAll();
    }

    public synchronized void clear() {
        drained = false;
    }

    public synchronized boolean isSet() {
        return drained;
    }

    public synchronized void await() throws InterruptedException {
        while (!drained) {
            wait();
        }
    }
}
