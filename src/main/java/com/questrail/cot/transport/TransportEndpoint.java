package com.questrail.cot.transport;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * The (reader, writer) pair built by {@link TransportFactory} for one destination.
 *
 * <p>Either half may be absent: write-only UDP, {@code log} and {@code file}
 * destinations have no reader. Closing the endpoint closes both halves; when
 * they are the same underlying connection it is closed once.</p>
 */
public final class TransportEndpoint implements Closeable
{
    private final TransportReader reader;
    private final TransportWriter writer;
    private final Closeable resource;

    public TransportEndpoint(TransportReader reader, TransportWriter writer) {
        this(reader, writer, null);
    }

    /**
     * @param resource an object owning both halves, closed instead of them;
     *                 may be {@code null}
     */
    public TransportEndpoint(TransportReader reader, TransportWriter writer, Closeable resource) {
        if (reader == null && writer == null) {
            throw new IllegalArgumentException("An endpoint needs a reader, a writer, or both");
        }
        this.reader = reader;
        this.writer = writer;
        this.resource = resource;
    }

    public Optional<TransportReader> reader() {
        return Optional.ofNullable(reader);
    }

    public Optional<TransportWriter> writer() {
        return Optional.ofNullable(writer);
    }

    @Override
    public void close() throws IOException {
        if (resource != null) {
            resource.close();
            return;
        }
        IOException failure = null;
        for (Closeable c : new Closeable[] { writer, reader }) {
            if (c == null) {
                continue;
            }
            try {
                c.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String toString() {
        return "TransportEndpoint[reader=" + reader + ", writer=" + writer + "]";
    }
}
