package com.questrail.cot.runtime;

import com.questrail.cot.codec.TakProtoCodec;
import com.questrail.cot.config.CotConfig;
import com.questrail.cot.config.CotConfigKeys;
import com.questrail.cot.config.CotConfigurationException;
import com.questrail.cot.observability.CotErrorEvent;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.CotWarningEvent;
import com.questrail.cot.observability.NullObservabilitySink;
import com.questrail.cot.transport.TransportContext;
import com.questrail.cot.transport.TransportEndpoint;
import com.questrail.cot.transport.TransportFactory;
import com.questrail.cot.transport.TransportWriter;
import com.questrail.cot.transport.tls.CertificateEnrollment;
import com.questrail.cot.worker.RXWorker;
import com.questrail.cot.worker.TXWorker;
import com.questrail.cot.worker.Worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * CotTransportRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one or more named CoT endpoints.
 *
 * <h2>Architectural Role</h2>
 * Each call to {@link #createWorkers(CotConfig)} opens one destination
 * through the {@link TransportFactory} and registers a {@link TXWorker} and an
 * {@link RXWorker} bound to a fresh pair of bounded queues. The first endpoint
 * created supplies the default queues ({@link #txQueue()}, {@link #rxQueue()})
 * that application producers and consumers use, unless the caller supplied
 * its own pair through {@link Builder#withQueues(BlockingQueue, BlockingQueue)}
 * or bound the defaults with {@link #setup()}. Pinned defaults are never replaced.
 *
 * <h2>Execution model</h2>
 * {@link #run()} starts every registered task on the executor and returns as
 * soon as the first one finishes, whether it failed or not. The remaining
 * tasks keep running; a supervisor decides whether to {@link #stop()} and
 * rebuild. No timeouts, reconnects or retries are applied here.
 */
public final class CotTransportRuntime
{
    private static final Logger log = LoggerFactory.getLogger(CotTransportRuntime.class);

    private final CotConfig config;
    private final TransportContext context;
    private final boolean ownsContext;
    private final TransportFactory factory;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final CotObservabilitySink observabilitySink;
    private final Function<String, byte[]> helloEvent;

    private final Map<String, EndpointQueues> queues = new LinkedHashMap<>();
    private final List<TransportEndpoint> endpoints = new ArrayList<>();
    private final Map<String, Callable<?>> pending = new LinkedHashMap<>();
    private final Map<Future<?>, String> running = new LinkedHashMap<>();

    private EndpointQueues defaultQueues;
    private boolean defaultsPinned;
    private boolean helloSent;
    private CompletionService<Object> completion;

    private CotTransportRuntime(Builder b, TransportContext context, boolean ownsContext,
                                ExecutorService executor, boolean ownsExecutor) {
        this.config = b.config;
        this.context = context;
        this.ownsContext = ownsContext;
        this.factory = new TransportFactory(context);
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.observabilitySink = context.observabilitySink();
        this.helloEvent = b.helloEvent;
        this.defaultQueues = b.queues != null ? b.queues : newQueues(config);
        this.defaultsPinned = b.queues != null;
    }

    public static Builder builder(CotConfig config) {
        return new Builder(config);
    }

    // -------------------------------------------------------------------------
    // Endpoint wiring
    // -------------------------------------------------------------------------

    /**
     * Open the destination described by {@code endpointConfig} and register its worker pair.
     *
     * @throws CotConfigurationException if the configuration is invalid or the name is already in use
     * @throws IOException if the transport cannot be opened
     */
    public synchronized void createWorkers(CotConfig endpointConfig) throws IOException, InterruptedException {
        Objects.requireNonNull(endpointConfig, "endpointConfig");
        requireUniqueName(endpointConfig.name());
        register(endpointConfig, newQueues(endpointConfig));
    }

    /**
     * Open this runtime's own destination onto the default queues and pin them.
     *
     * @throws IllegalStateException if an endpoint already took over unpinned defaults
     * @throws CotConfigurationException if the configuration is invalid or the name is already in use
     * @throws IOException if the transport cannot be opened
     */
    public synchronized void setup() throws IOException, InterruptedException {
        if (!defaultsPinned && !queues.isEmpty()) {
            throw new IllegalStateException("setup() must precede createWorkers() unless queues were supplied");
        }
        requireUniqueName(config.name());
        register(config, defaultQueues);
        defaultsPinned = true;
    }

    private void requireUniqueName(String name) {
        if (queues.containsKey(name)) {
            throw new CotConfigurationException("Duplicate endpoint name: " + name);
        }
    }

    private void register(CotConfig endpointConfig, EndpointQueues endpointQueues)
            throws IOException, InterruptedException
    {
        String name = endpointConfig.name();
        TransportEndpoint endpoint = factory.create(endpointConfig);

        TXWorker tx;
        RXWorker rx;
        try {
            tx = new TXWorker(endpointQueues.txQueue(), endpointConfig, requireWriter(endpoint, name), context);
            rx = new RXWorker(endpointQueues.rxQueue(), endpointConfig, endpoint.reader().orElse(null), context);
        } catch (RuntimeException e) {
            endpoint.close();
            throw e;
        }

        if (!defaultsPinned && queues.isEmpty()) {
            defaultQueues = endpointQueues;
        }
        queues.put(name, endpointQueues);
        endpoints.add(endpoint);
        addWorker(tx);
        addWorker(rx);
        log.info("Created workers for {} ({})", name, endpointConfig.cotUrl());
    }

    /**
     * Open every destination independently. A destination that fails is
     * reported through the observability sink and skipped.
     *
     * @return failures keyed by endpoint name; empty when every endpoint opened
     * @throws IOException if no endpoint could be opened; each failure is attached as suppressed
     */
    public Map<String, Exception> createWorkers(Collection<CotConfig> endpointConfigs)
            throws IOException, InterruptedException
    {
        if (endpointConfigs.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint configuration is required");
        }

        Map<String, Exception> failures = new LinkedHashMap<>();
        int created = 0;
        for (CotConfig endpointConfig : endpointConfigs) {
            try {
                createWorkers(endpointConfig);
                created++;
            } catch (IOException | RuntimeException e) {
                failures.put(endpointConfig.name(), e);
                observabilitySink.onError(new CotErrorEvent(Instant.now(),
                        "Endpoint " + endpointConfig.name() + " (" + endpointConfig.cotUrl() + ") failed to open", e));
            }
        }

        if (created == 0) {
            IOException none = new IOException("No endpoint could be opened: " + failures.keySet());
            failures.values().forEach(none::addSuppressed);
            throw none;
        }
        return failures;
    }

    // -------------------------------------------------------------------------
    // Tasks
    // -------------------------------------------------------------------------

    /**
     * Register an application task to run alongside the transport workers.
     */
    public synchronized void addTask(String name, Callable<?> task) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(task, "task");
        if (pending.containsKey(name) || running.containsValue(name)) {
            throw new IllegalArgumentException("Task already registered: " + name);
        }
        log.debug("Add Task: {}", name);
        pending.put(name, task);
    }

    public void addWorker(Worker worker) {
        addTask(worker.name(), worker);
    }

    /**
     * Start every registered task and block until the first one finishes.
     *
     * @return the task that finished and, if it failed, why
     * @throws IllegalStateException if no task has been registered
     */
    public WorkerTermination run() throws InterruptedException {
        synchronized (this) {
            if (pending.isEmpty() && running.isEmpty()) {
                throw new IllegalStateException("No tasks registered");
            }
            log.info("Run: {}", config.name());
            sendHello();

            if (completion == null) {
                completion = new ExecutorCompletionService<>(executor);
            }
            for (Map.Entry<String, Callable<?>> e : pending.entrySet()) {
                Callable<?> task = e.getValue();
                running.put(completion.submit(task::call), e.getKey());
            }
            pending.clear();
        }

        Future<Object> done = completion.take();
        String name;
        synchronized (this) {
            name = running.remove(done);
        }
        WorkerTermination termination = new WorkerTermination(name, failureOf(done));
        log.info("Complete: {}{}", name,
                termination.failure().map(t -> " (" + t + ")").orElse(""));
        return termination;
    }

    /**
     * Cancel every task, close every endpoint and release the executor and
     * event loops this runtime created.
     */
    public void stop() {
        List<TransportEndpoint> toClose;
        synchronized (this) {
            // Cancelled futures stay registered so a blocked run() can still name them.
            running.keySet().forEach(f -> f.cancel(true));
            pending.clear();
            toClose = new ArrayList<>(endpoints);
            endpoints.clear();
        }

        for (TransportEndpoint endpoint : toClose) {
            try {
                endpoint.close();
            } catch (IOException e) {
                observabilitySink.onError(new CotErrorEvent(Instant.now(), "Failed to close " + endpoint, e));
            }
        }

        if (ownsExecutor) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Worker threads did not stop within 5s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (ownsContext) {
            context.close();
        }
    }

    // -------------------------------------------------------------------------
    // Queues
    // -------------------------------------------------------------------------

    public synchronized BlockingQueue<byte[]> txQueue() {
        return defaultQueues.txQueue();
    }

    public synchronized BlockingQueue<byte[]> rxQueue() {
        return defaultQueues.rxQueue();
    }

    public synchronized Optional<EndpointQueues> queues(String endpointName) {
        return Optional.ofNullable(queues.get(endpointName));
    }

    public synchronized Set<String> endpointNames() {
        return Set.copyOf(queues.keySet());
    }

    public TransportContext context() {
        return context;
    }

    public CotConfig config() {
        return config;
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private EndpointQueues newQueues(CotConfig endpointConfig) {
        int maxOut = endpointConfig.getInt(CotConfigKeys.MAX_OUT_QUEUE,
                config.getInt(CotConfigKeys.MAX_OUT_QUEUE, CotConfigKeys.DEFAULT_MAX_OUT_QUEUE));
        int maxIn = endpointConfig.getInt(CotConfigKeys.MAX_IN_QUEUE,
                config.getInt(CotConfigKeys.MAX_IN_QUEUE, CotConfigKeys.DEFAULT_MAX_IN_QUEUE));
        if (maxOut < 1 || maxIn < 1) {
            throw new CotConfigurationException(CotConfigKeys.MAX_OUT_QUEUE + " and "
                    + CotConfigKeys.MAX_IN_QUEUE + " must be at least 1");
        }
        return new EndpointQueues(new ArrayBlockingQueue<>(maxOut), new ArrayBlockingQueue<>(maxIn));
    }

    private static TransportWriter requireWriter(TransportEndpoint endpoint, String name) {
        return endpoint.writer().orElseThrow(
                () -> new CotConfigurationException("Endpoint " + name + " has no writer"));
    }

    private void sendHello() {
        if (helloSent || helloEvent == null || config.getBoolean(CotConfigKeys.NO_HELLO)) {
            return;
        }
        helloSent = true;
        byte[] hello = helloEvent.apply(config.get(CotConfigKeys.COT_HOST_ID, CotConfigKeys.DEFAULT_COT_HOST_ID));
        if (hello == null || hello.length == 0) {
            return;
        }
        if (!defaultQueues.txQueue().offer(hello)) {
            observabilitySink.onWarning(new CotWarningEvent(Instant.now(), config.name(),
                    "Transmit queue full, hello event not sent"));
        }
    }

    private static Optional<Throwable> failureOf(Future<?> done) throws InterruptedException {
        try {
            done.get();
            return Optional.empty();
        } catch (ExecutionException e) {
            return Optional.of(e.getCause());
        } catch (CancellationException e) {
            return Optional.of(e);
        }
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private final CotConfig config;
        private TransportContext context;
        private TakProtoCodec codec;
        private CertificateEnrollment enrollment;
        private CotObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Function<String, byte[]> helloEvent;
        private ExecutorService executor;
        private EndpointQueues queues;

        private Builder(CotConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        /**
         * Use a caller-owned context. Codec, enrollment and sink settings on this
         * builder are then ignored in favor of the context's own.
         */
        public Builder withTransportContext(TransportContext context) {
            this.context = context;
            return this;
        }

        public Builder withCodec(TakProtoCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder withEnrollment(CertificateEnrollment enrollment) {
            this.enrollment = enrollment;
            return this;
        }

        public Builder withObservabilitySink(CotObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * @param helloEvent builds the liveness event from the {@code COT_HOST_ID} uid
         */
        public Builder withHelloEvent(Function<String, byte[]> helloEvent) {
            this.helloEvent = helloEvent;
            return this;
        }

        /**
         * Use caller-owned default queues, for example ones shared with another
         * executor. They are never replaced by {@link CotTransportRuntime#createWorkers(CotConfig)}.
         */
        public Builder withQueues(BlockingQueue<byte[]> txQueue, BlockingQueue<byte[]> rxQueue) {
            this.queues = new EndpointQueues(
                    Objects.requireNonNull(txQueue, "txQueue"), Objects.requireNonNull(rxQueue, "rxQueue"));
            return this;
        }

        /** Use a caller-owned executor; {@link #stop()} will not shut it down. */
        public Builder withExecutor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public CotTransportRuntime build() {
            boolean ownsContext = context == null;
            TransportContext ctx = ownsContext
                    ? TransportContext.builder()
                        .withObservabilitySink(observabilitySink)
                        .withCodec(codec)
                        .withEnrollment(enrollment)
                        .build()
                    : context;

            boolean ownsExecutor = executor == null;
            ExecutorService exec = ownsExecutor ? Executors.newCachedThreadPool(workerThreads()) : executor;

            return new CotTransportRuntime(this, ctx, ownsContext, exec, ownsExecutor);
        }

        private static ThreadFactory workerThreads() {
            AtomicInteger seq = new AtomicInteger();
            return r -> {
                Thread t = new Thread(r, "cot-worker-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
        }
    }
}
