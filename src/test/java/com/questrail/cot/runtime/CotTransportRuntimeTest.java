package com.questrail.cot.runtime;

import com.questrail.cot.config.CotConfig;
import com.questrail.cot.config.CotConfigKeys;
import com.questrail.cot.config.CotConfigurationException;
import com.questrail.cot.observability.CotErrorEvent;
import com.questrail.cot.observability.RecordingObservabilitySink;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CotTransportRuntimeTest
 * -----------------------------------------------------------------------------
 * Validates endpoint wiring, the hello event and first-finisher semantics of
 * {@link CotTransportRuntime#run()}.
 */
final class CotTransportRuntimeTest {

    @TempDir
    Path dir;

    private RecordingObservabilitySink sink;
    private CotTransportRuntime runtime;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
    }

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.stop();
        }
    }

    private CotTransportRuntime.Builder builder(CotConfig config) {
        return CotTransportRuntime.builder(config).withObservabilitySink(sink);
    }

    private CotConfig fileEndpoint(String name) {
        return CotConfig.builder(name)
                .withCotUrl("file://" + dir.resolve(name + ".xml"))
                .build();
    }

    private static byte[] hello(String uid) {
        return ("<event uid=\"" + uid + "\" type=\"t-x-d-d\"/>").getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void helloIsQueuedBeforeTasksStart() throws Exception {
        // GIVEN a runtime with a hello event and a host id
        CotConfig config = CotConfig.builder("main").put(CotConfigKeys.COT_HOST_ID, "node-1").build();
        runtime = builder(config).withHelloEvent(CotTransportRuntimeTest::hello).build();
        runtime.addTask("done", () -> null);

        // WHEN it runs
        WorkerTermination termination = runtime.run();

        // THEN the hello event waits on the transmit queue
        assertEquals("done", termination.task());
        assertFalse(termination.failed());
        assertArrayEquals(hello("node-1"), runtime.txQueue().poll());
    }

    @Test
    void helloUsesDefaultHostId() throws Exception {
        runtime = builder(CotConfig.builder("main").build()).withHelloEvent(CotTransportRuntimeTest::hello).build();
        runtime.addTask("done", () -> null);

        runtime.run();

        assertArrayEquals(hello(CotConfigKeys.DEFAULT_COT_HOST_ID), runtime.txQueue().poll());
    }

    @Test
    void noHelloFlagSuppressesHello() throws Exception {
        CotConfig config = CotConfig.builder("main").put(CotConfigKeys.NO_HELLO, "1").build();
        runtime = builder(config).withHelloEvent(CotTransportRuntimeTest::hello).build();
        runtime.addTask("done", () -> null);

        runtime.run();

        assertTrue(runtime.txQueue().isEmpty());
    }

    @Test
    void helloIsQueuedOnlyOnFirstRun() throws Exception {
        // GIVEN a runtime that is run, then run again after a new task is added
        runtime = builder(CotConfig.builder("main").build()).withHelloEvent(CotTransportRuntimeTest::hello).build();
        runtime.addTask("first", () -> null);
        runtime.run();
        runtime.addTask("second", () -> null);

        // WHEN it runs the second time
        WorkerTermination termination = runtime.run();

        // THEN only one hello event was queued
        assertEquals("second", termination.task());
        assertEquals(1, runtime.txQueue().size());
    }

    @Test
    void suppliedQueuesAreTheDefaultsAndAreNotReplaced() throws Exception {
        // GIVEN caller-owned queues
        BlockingQueue<byte[]> tx = new LinkedBlockingQueue<>();
        BlockingQueue<byte[]> rx = new LinkedBlockingQueue<>();
        runtime = builder(CotConfig.builder("main").build()).withQueues(tx, rx).build();

        // WHEN an endpoint is created
        runtime.createWorkers(fileEndpoint("first"));

        // THEN the supplied pair stays the default and the endpoint gets its own
        assertSame(tx, runtime.txQueue());
        assertSame(rx, runtime.rxQueue());
        assertNotSame(tx, runtime.queues("first").orElseThrow().txQueue());
    }

    @Test
    void setupOpensOwnDestinationOntoSuppliedQueues() throws Exception {
        // GIVEN a runtime whose own config names a file destination, with caller-owned queues
        Path out = dir.resolve("setup.xml");
        BlockingQueue<byte[]> tx = new LinkedBlockingQueue<>();
        BlockingQueue<byte[]> rx = new LinkedBlockingQueue<>();
        CotConfig config = CotConfig.builder("main").withCotUrl("file://" + out).build();
        runtime = builder(config).withQueues(tx, rx).build();

        // WHEN it is set up and an event is put on the supplied queue
        runtime.setup();
        assertSame(tx, runtime.queues("main").orElseThrow().txQueue());
        byte[] event = "<event uid=\"s1\"/>".getBytes(StandardCharsets.UTF_8);
        tx.put(event);
        CompletableFuture.runAsync(() -> {
            try {
                runtime.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        // THEN the event reaches the destination
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            while (!Files.exists(out) || Files.size(out) < event.length) {
                Thread.sleep(20);
            }
        });
        assertArrayEquals(event, Files.readAllBytes(out));
    }

    @Test
    void setupPinsDefaultsAgainstLaterEndpoints() throws Exception {
        CotConfig config = CotConfig.builder("main").withCotUrl("file://" + dir.resolve("main.xml")).build();
        runtime = builder(config).build();
        BlockingQueue<byte[]> defaults = runtime.txQueue();

        runtime.setup();
        runtime.createWorkers(fileEndpoint("other"));

        assertSame(defaults, runtime.txQueue());
        assertEquals(Set.of("main", "other"), runtime.endpointNames());
    }

    @Test
    void setupAfterEndpointTookOverDefaultsIsRejected() throws Exception {
        CotConfig config = CotConfig.builder("main").withCotUrl("file://" + dir.resolve("main.xml")).build();
        runtime = builder(config).build();
        runtime.createWorkers(fileEndpoint("first"));

        assertThrows(IllegalStateException.class, runtime::setup);
    }

    @Test
    void runReturnsFirstFailureWhileOthersKeepRunning() throws Exception {
        // GIVEN one task that fails and one that never finishes
        runtime = builder(CotConfig.builder("main").build()).build();
        runtime.addTask("forever", () -> {
            Thread.sleep(Long.MAX_VALUE);
            return null;
        });
        runtime.addTask("boom", () -> {
            throw new IllegalStateException("boom");
        });

        // WHEN it runs
        WorkerTermination termination = assertTimeoutPreemptively(Duration.ofSeconds(5), runtime::run);

        // THEN the failing task is reported with its cause
        assertEquals("boom", termination.task());
        assertInstanceOf(IllegalStateException.class, termination.failure().orElseThrow());
    }

    @Test
    void runWithoutTasksIsRejected() {
        runtime = builder(CotConfig.builder("main").build()).build();

        assertThrows(IllegalStateException.class, runtime::run);
    }

    @Test
    void duplicateTaskNameIsRejected() {
        runtime = builder(CotConfig.builder("main").build()).build();
        runtime.addTask("a", () -> null);

        assertThrows(IllegalArgumentException.class, () -> runtime.addTask("a", () -> null));
    }

    @Test
    void firstEndpointSuppliesDefaultQueues() throws Exception {
        // GIVEN two endpoints, the first with its own outbound capacity
        runtime = builder(CotConfig.builder("main").build()).build();
        CotConfig first = CotConfig.builder("first")
                .withCotUrl("file://" + dir.resolve("first.xml"))
                .put(CotConfigKeys.MAX_OUT_QUEUE, 7)
                .build();

        // WHEN both are created
        runtime.createWorkers(first);
        runtime.createWorkers(fileEndpoint("second"));

        // THEN the first endpoint's queues are the defaults
        EndpointQueues firstQueues = runtime.queues("first").orElseThrow();
        assertSame(firstQueues.txQueue(), runtime.txQueue());
        assertSame(firstQueues.rxQueue(), runtime.rxQueue());
        assertEquals(7, runtime.txQueue().remainingCapacity());
        assertNotSame(firstQueues.txQueue(), runtime.queues("second").orElseThrow().txQueue());
        assertEquals(Set.of("first", "second"), runtime.endpointNames());
    }

    @Test
    void queueCapacityFallsBackToRuntimeConfig() throws Exception {
        CotConfig config = CotConfig.builder("main").put(CotConfigKeys.MAX_IN_QUEUE, 3).build();
        runtime = builder(config).build();

        runtime.createWorkers(fileEndpoint("only"));

        assertEquals(3, runtime.rxQueue().remainingCapacity());
    }

    @Test
    void zeroCapacityIsAConfigurationError() {
        runtime = builder(CotConfig.builder("main").build()).build();
        CotConfig bad = CotConfig.builder("bad")
                .withCotUrl("file://" + dir.resolve("bad.xml"))
                .put(CotConfigKeys.MAX_OUT_QUEUE, 0)
                .build();

        assertThrows(CotConfigurationException.class, () -> runtime.createWorkers(bad));
    }

    @Test
    void duplicateEndpointNameIsAConfigurationError() throws Exception {
        runtime = builder(CotConfig.builder("main").build()).build();
        runtime.createWorkers(fileEndpoint("dup"));

        assertThrows(CotConfigurationException.class, () -> runtime.createWorkers(fileEndpoint("dup")));
    }

    @Test
    void failingEndpointDoesNotPreventOthers() throws Exception {
        // GIVEN one valid endpoint and one missing its TLS certificate
        runtime = builder(CotConfig.builder("main").build()).build();
        CotConfig broken = CotConfig.builder("broken").withCotUrl("tls://127.0.0.1:8089").build();

        // WHEN both are created
        Map<String, Exception> failures = runtime.createWorkers(List.of(fileEndpoint("good"), broken));

        // THEN only the broken one is reported
        assertEquals(Set.of("broken"), failures.keySet());
        assertInstanceOf(CotConfigurationException.class, failures.get("broken"));
        assertEquals(Set.of("good"), runtime.endpointNames());
        assertEquals(1, sink.eventsOfType(CotErrorEvent.class).size());
    }

    @Test
    void allEndpointsFailingIsAnError() {
        runtime = builder(CotConfig.builder("main").build()).build();
        List<CotConfig> configs = List.of(
                CotConfig.builder("a").withCotUrl("tls://127.0.0.1:8089").build(),
                CotConfig.builder("b").withCotUrl("bogus://127.0.0.1:1").build());

        IOException e = assertThrows(IOException.class, () -> runtime.createWorkers(configs));

        assertEquals(2, e.getSuppressed().length);
        assertTrue(runtime.endpointNames().isEmpty());
    }

    @Test
    void queuedEventReachesFileEndpointUntilStopped() throws Exception {
        // GIVEN a file endpoint with one queued event
        Path out = dir.resolve("events/out.xml");
        runtime = builder(CotConfig.builder("main").build()).build();
        runtime.createWorkers(CotConfig.builder("file").withCotUrl("file://" + out).build());
        byte[] event = "<event uid=\"e1\"/>".getBytes(StandardCharsets.UTF_8);
        runtime.txQueue().put(event);

        // WHEN the runtime runs
        CompletableFuture<WorkerTermination> run = CompletableFuture.supplyAsync(() -> {
            try {
                return runtime.run();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        // THEN the event is written, and stopping ends the run
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            while (!Files.exists(out) || Files.size(out) < event.length) {
                Thread.sleep(20);
            }
        });
        assertArrayEquals(event, Files.readAllBytes(out));

        runtime.stop();
        WorkerTermination termination = run.get(5, TimeUnit.SECONDS);
        assertTrue(termination.failed());
        assertInstanceOf(CancellationException.class, termination.failure().orElseThrow());
        runtime = null;
    }
}
