package com.questrail.cot.worker;

import com.questrail.cot.config.CotConfig;
import com.questrail.cot.config.CotConfigKeys;
import com.questrail.cot.observability.CotWarningEvent;
import com.questrail.cot.observability.QueueOverflowEvent;
import com.questrail.cot.observability.RecordingObservabilitySink;
import com.questrail.cot.observability.WorkerLifecycleEvent;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueueWorkerTest
 * -----------------------------------------------------------------------------
 * Validates drop-oldest admission and the worker lifecycle around
 * {@link QueueWorker#runOnce()}.
 */
final class QueueWorkerTest {

    private static final CotConfig CONFIG = CotConfig.builder("producer")
            .withCotUrl("udp+wo://239.2.3.1:6969")
            .build();

    /** Producer that admits a scripted list of events, then waits to be cancelled. */
    private static final class ScriptedProducer extends QueueWorker {
        private final List<String> script;

        ScriptedProducer(BlockingQueue<byte[]> queue, RecordingObservabilitySink sink, List<String> script) {
            super(queue, CONFIG, null, sink);
            this.script = new ArrayList<>(script);
        }

        @Override
        protected void runOnce() throws InterruptedException {
            if (script.isEmpty()) {
                Thread.sleep(Long.MAX_VALUE);
            }
            handleData(script.remove(0).getBytes(StandardCharsets.UTF_8));
        }
    }

    private static List<String> drain(BlockingQueue<byte[]> queue) {
        List<byte[]> items = new ArrayList<>();
        queue.drainTo(items);
        List<String> out = new ArrayList<>();
        for (byte[] item : items) {
            out.add(new String(item, StandardCharsets.UTF_8));
        }
        return out;
    }

    @Test
    void fullQueueEvictsExactlyTheOldestEntry() {
        // GIVEN a queue with capacity 3
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        BlockingQueue<byte[]> queue = new ArrayBlockingQueue<>(3);
        ScriptedProducer producer = new ScriptedProducer(queue, sink, List.of());

        // WHEN four events are admitted
        for (int i = 1; i <= 4; i++) {
            producer.putQueue(("E" + i).getBytes(StandardCharsets.UTF_8));
        }

        // THEN the first is gone and the rest keep their order
        assertEquals(List.of("E2", "E3", "E4"), drain(queue));

        List<QueueOverflowEvent> overflows = sink.eventsOfType(QueueOverflowEvent.class);
        assertEquals(1, overflows.size());
        assertEquals(3, overflows.get(0).capacity());
        assertEquals(CotConfigKeys.MAX_OUT_QUEUE, overflows.get(0).capacitySetting());
        assertEquals("ScriptedProducer[producer]", overflows.get(0).worker());
    }

    @Test
    void queueBelowCapacityAdmitsWithoutEviction() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        BlockingQueue<byte[]> queue = new ArrayBlockingQueue<>(3);
        ScriptedProducer producer = new ScriptedProducer(queue, sink, List.of());

        producer.putQueue("A".getBytes(StandardCharsets.UTF_8));
        producer.putQueue("B".getBytes(StandardCharsets.UTF_8));

        assertEquals(List.of("A", "B"), drain(queue));
        assertFalse(sink.hasEventOfType(QueueOverflowEvent.class));
    }

    @Test
    void putQueueCanTargetAnotherQueue() {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        BlockingQueue<byte[]> own = new ArrayBlockingQueue<>(1);
        BlockingQueue<byte[]> other = new ArrayBlockingQueue<>(1);
        ScriptedProducer producer = new ScriptedProducer(own, sink, List.of());

        producer.putQueue("X".getBytes(StandardCharsets.UTF_8), other);

        assertTrue(own.isEmpty());
        assertEquals(List.of("X"), drain(other));
    }

    @Test
    void handOffQueueWithoutConsumerDropsInsteadOfSpinning() {
        // GIVEN a zero-capacity target nobody is taking from
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        ScriptedProducer producer = new ScriptedProducer(new ArrayBlockingQueue<>(1), sink, List.of());
        BlockingQueue<byte[]> handOff = new SynchronousQueue<>();

        // WHEN an event is admitted
        assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> producer.putQueue("A".getBytes(StandardCharsets.UTF_8), handOff));

        // THEN it is dropped with a warning and nothing counts as an eviction
        assertTrue(sink.hasEventOfType(CotWarningEvent.class));
        assertFalse(sink.hasEventOfType(QueueOverflowEvent.class));
    }

    @Test
    void cancellationEndsTheLoopWithoutFailure() throws Exception {
        // GIVEN a producer with two scripted events
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        BlockingQueue<byte[]> queue = new ArrayBlockingQueue<>(10);
        ScriptedProducer producer = new ScriptedProducer(queue, sink, List.of("A", "B"));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Void> task = executor.submit(producer);

            // WHEN both are admitted and the task is cancelled
            assertNotNull(queue.poll(5, TimeUnit.SECONDS));
            assertNotNull(queue.poll(5, TimeUnit.SECONDS));
            task.cancel(true);
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }

        // THEN the lifecycle closes with a clean termination
        List<WorkerLifecycleEvent> lifecycle = sink.eventsOfType(WorkerLifecycleEvent.class);
        assertEquals(2, lifecycle.size());
        assertEquals(WorkerLifecycleEvent.Phase.STARTED, lifecycle.get(0).phase());
        assertEquals(WorkerLifecycleEvent.Phase.TERMINATED, lifecycle.get(1).phase());
        assertNull(lifecycle.get(1).cause());
    }
}
