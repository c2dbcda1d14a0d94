package com.questrail.cot.transport;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Test-only {@link StreamSink} recording the order of write, drain and flush calls.
 */
public final class FakeStreamSink implements StreamSink {

    private final ByteArrayOutputStream written = new ByteArrayOutputStream();
    private final List<String> calls = new ArrayList<>();

    @Override
    public synchronized void write(byte[] data) {
        calls.add("write");
        written.writeBytes(data);
    }

    @Override
    public synchronized void drain() {
        calls.add("drain");
    }

    @Override
    public synchronized void flush() {
        calls.add("flush");
    }

    @Override
    public synchronized void close() {
        calls.add("close");
    }

    public synchronized byte[] written() {
        return written.toByteArray();
    }

    public synchronized List<String> calls() {
        return new ArrayList<>(calls);
    }
}
