package com.questrail.cot.transport.stream;

import com.questrail.cot.transport.IncompleteReadException;
import com.questrail.cot.transport.TransportClosedException;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BufferedStreamSourceTest {

    private static final byte[] END = "</event>".getBytes(StandardCharsets.UTF_8);

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void readReturnsThroughDelimiterAndKeepsRemainder() throws Exception {
        BufferedStreamSource source = new BufferedStreamSource();
        source.append(bytes("<event>A</event><event>B"));

        assertArrayEquals(bytes("<event>A</event>"), source.readUntil(END));
        assertEquals(8, source.buffered());
    }

    @Test
    void delimiterSplitAcrossAppendsIsFound() throws Exception {
        BufferedStreamSource source = new BufferedStreamSource();
        source.append(bytes("<event>A</ev"));
        source.append(bytes("ent>"));

        assertArrayEquals(bytes("<event>A</event>"), source.readUntil(END));
    }

    @Test
    void endOfStreamYieldsPartialOnceThenClosed() throws Exception {
        BufferedStreamSource source = new BufferedStreamSource();
        source.append(bytes("<event>A</event><event>B"));
        source.endOfStream();

        assertArrayEquals(bytes("<event>A</event>"), source.readUntil(END));
        IncompleteReadException incomplete = assertThrows(IncompleteReadException.class, () -> source.readUntil(END));
        assertArrayEquals(bytes("<event>B"), incomplete.partial());
        assertThrows(TransportClosedException.class, () -> source.readUntil(END));
    }

    @Test
    void blockedReaderWakesOnAppend() throws Exception {
        BufferedStreamSource source = new BufferedStreamSource();
        CompletableFuture<byte[]> read = CompletableFuture.supplyAsync(() -> {
            try {
                return source.readUntil(END);
            } catch (IOException | InterruptedException e) {
                throw new RuntimeException(e);
            }
        });

        Thread.sleep(50);
        assertFalse(read.isDone());
        source.append(bytes("<event/></event>"));

        assertArrayEquals(bytes("<event/></event>"), read.get(5, TimeUnit.SECONDS));
    }

    @Test
    void failureIsRaisedByNextRead() {
        BufferedStreamSource source = new BufferedStreamSource();
        source.fail(new IOException("connection reset"));

        IOException e = assertThrows(IOException.class, () -> source.readUntil(END));
        assertEquals("connection reset", e.getMessage());
        assertThrows(TransportClosedException.class, () -> source.readUntil(END));
    }

    @Test
    void oversizedChunkWithoutDelimiterFails() {
        BufferedStreamSource source = new BufferedStreamSource(16, () -> {});
        source.append(new byte[32]);

        assertThrows(IOException.class, () -> source.readUntil(END));
    }

    @Test
    void closeRunsHookOnce() {
        AtomicInteger closes = new AtomicInteger();
        BufferedStreamSource source = new BufferedStreamSource(BufferedStreamSource.DEFAULT_LIMIT, closes::incrementAndGet);

        source.close();
        source.close();

        assertEquals(1, closes.get());
        assertThrows(TransportClosedException.class, () -> source.readUntil(END));
    }
}
