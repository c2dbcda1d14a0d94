package com.questrail.cot.worker;

import com.questrail.cot.codec.ProtocolFormat;
import com.questrail.cot.codec.TakProtoCodec;
import com.questrail.cot.config.CotConfig;
import com.questrail.cot.config.CotConfigKeys;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.CotWarningEvent;
import com.questrail.cot.observability.QueueOverflowEvent;
import com.questrail.cot.observability.WorkerLifecycleEvent;
import com.questrail.cot.transport.TransportContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Worker
 * =============================================================================
 * Base class for the tasks that move events between a bounded queue and a
 * transport.
 *
 * <h2>Lifecycle</h2>
 * {@link #call()} reports a start event, then invokes {@link #runOnce()} until
 * the thread is interrupted or a transport exception escapes. An interrupt
 * ends the loop normally. Any other exception is reported and rethrown to
 * the runtime.
 *
 * <h2>Backpressure</h2>
 * {@link #putQueue(byte[], BlockingQueue)} never blocks: when the target is
 * full, exactly the oldest entry is evicted to admit the new one.
 */
public abstract class Worker implements Callable<Void>
{
    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final BlockingQueue<byte[]> queue;
    protected final CotConfig config;
    protected final ProtocolFormat format;
    protected final CotObservabilitySink observabilitySink;

    private final TakProtoCodec codec;

    /**
     * @param codec required when {@code TAK_PROTO > 0}; may be {@code null} otherwise
     * @throws com.questrail.cot.config.CotConfigurationException if binary framing
     *         is configured without a codec
     */
    protected Worker(BlockingQueue<byte[]> queue,
                     CotConfig config,
                     TakProtoCodec codec,
                     CotObservabilitySink observabilitySink)
    {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.codec = codec;
        this.format = ProtocolFormat.resolve(config, codec);
    }

    protected Worker(BlockingQueue<byte[]> queue, CotConfig config, TransportContext context) {
        this(queue, config, context.codec().orElse(null), context.observabilitySink());
    }

    @Override
    public final Void call() throws Exception {
        observabilitySink.onWorkerEvent(new WorkerLifecycleEvent(
                Instant.now(), name(), WorkerLifecycleEvent.Phase.STARTED, null));
        try {
            while (!Thread.currentThread().isInterrupted()) {
                runOnce();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            observabilitySink.onWorkerEvent(new WorkerLifecycleEvent(
                    Instant.now(), name(), WorkerLifecycleEvent.Phase.TERMINATED, e));
            throw e;
        }
        observabilitySink.onWorkerEvent(new WorkerLifecycleEvent(
                Instant.now(), name(), WorkerLifecycleEvent.Phase.TERMINATED, null));
        return null;
    }

    /**
     * One iteration of the worker loop.
     */
    protected abstract void runOnce() throws IOException, InterruptedException;

    public void putQueue(byte[] data) {
        putQueue(data, queue);
    }

    /**
     * Admit {@code data} to {@code target}, evicting the oldest entry if it is full.
     * A zero-capacity target with no waiting consumer drops {@code data} with a warning.
     */
    public void putQueue(byte[] data, BlockingQueue<byte[]> target) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(target, "target");
        log.debug("Queue size={}", target.size());

        while (!target.offer(data)) {
            if (target.poll() != null) {
                observabilitySink.onQueueOverflow(new QueueOverflowEvent(
                        Instant.now(), name(), target.size() + target.remainingCapacity(), capacitySetting()));
            } else if (target.remainingCapacity() == 0) {
                // Nothing to evict and no room: a hand-off queue with no taker.
                observabilitySink.onWarning(new CotWarningEvent(Instant.now(), name(),
                        "Queue has no capacity and no waiting consumer, dropping data"));
                return;
            }
        }
    }

    /** Configuration key that sizes this worker's queue; named in overflow warnings. */
    protected String capacitySetting() {
        return CotConfigKeys.MAX_OUT_QUEUE;
    }

    /**
     * FreeTAKServer compatibility pause: {@code PYTAK_SLEEP} seconds, or a random
     * whole number of seconds below {@code DEFAULT_SLEEP} when only {@code FTS_COMPAT} is set.
     */
    protected void compatDelay() throws InterruptedException {
        int fixed = config.getInt(CotConfigKeys.PYTAK_SLEEP, 0);
        if (fixed <= 0 && !config.getBoolean(CotConfigKeys.FTS_COMPAT)) {
            return;
        }
        long seconds = fixed > 0
                ? fixed
                : (long) (CotConfigKeys.DEFAULT_SLEEP * ThreadLocalRandom.current().nextDouble());
        log.debug("COMPAT: Sleeping for {}s", seconds);
        TimeUnit.SECONDS.sleep(seconds);
    }

    protected Optional<TakProtoCodec> codec() {
        return Optional.ofNullable(codec);
    }

    public ProtocolFormat format() {
        return format;
    }

    public CotConfig config() {
        return config;
    }

    public BlockingQueue<byte[]> queue() {
        return queue;
    }

    public String name() {
        return getClass().getSimpleName() + "[" + config.name() + "]";
    }

    @Override
    public String toString() {
        return name();
    }
}
