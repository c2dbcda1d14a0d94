package com.questrail.cot.transport.stream;

import com.questrail.cot.transport.IncompleteReadException;
import com.questrail.cot.transport.StreamSource;
import com.questrail.cot.transport.TransportClosedException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

/**
 * BufferedStreamSource
 * -----------------------------------------------------------------------------
 * Blocking byte buffer fed by a transport callback and drained by
 * {@link #readUntil(byte[])}.
 *
 * <p>The producer side ({@link #append}, {@link #endOfStream}, {@link #fail})
 * is called from a single callback thread; any number of readers may block.
 * After end of stream, the first read that cannot find the delimiter raises
 * {@link IncompleteReadException} with whatever was buffered; every later read
 * raises {@link TransportClosedException}.</p>
 */
public class BufferedStreamSource implements StreamSource
{
    /** Upper bound on buffered bytes while waiting for a delimiter. */
    public static final int DEFAULT_LIMIT = 65536;

    private final int limit;
    private final Runnable onClose;

    private byte[] buffer = new byte[0];
    private boolean eof;
    private boolean exhausted;
    private boolean closed;
    private IOException failure;

    public BufferedStreamSource() {
        this(DEFAULT_LIMIT, () -> {});
    }

    /**
     * @param onClose invoked once by {@link #close()} to release the underlying connection
     */
    public BufferedStreamSource(int limit, Runnable onClose) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        this.limit = limit;
        this.onClose = Objects.requireNonNull(onClose, "onClose");
    }

    public synchronized void append(byte[] data) {
        if (eof || data.length == 0) {
            return;
        }
        byte[] merged = Arrays.copyOf(buffer, buffer.length + data.length);
        System.arraycopy(data, 0, merged, buffer.length, data.length);
        buffer = merged;
        notifyAll();
    }

    public synchronized void endOfStream() {
        eof = true;
        notifyAll();
    }

    /** Records a transport failure; it is raised by the next read and ends the stream. */
    public synchronized void fail(IOException cause) {
        if (failure == null) {
            failure = cause;
        }
        eof = true;
        notifyAll();
    }

    @Override
    public synchronized byte[] readUntil(byte[] delimiter) throws IOException, InterruptedException {
        if (delimiter.length == 0) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        while (true) {
            int at = indexOf(buffer, delimiter);
            if (at >= 0) {
                int end = at + delimiter.length;
                byte[] chunk = Arrays.copyOfRange(buffer, 0, end);
                buffer = Arrays.copyOfRange(buffer, end, buffer.length);
                return chunk;
            }
            if (buffer.length > limit) {
                throw new IOException("Separator is not found, and chunk exceed the limit of " + limit + " bytes");
            }
            if (failure != null) {
                IOException e = failure;
                failure = null;
                exhausted = true;
                buffer = new byte[0];
                throw e;
            }
            if (eof) {
                if (exhausted) {
                    throw new TransportClosedException("Stream ended");
                }
                exhausted = true;
                byte[] partial = buffer;
                buffer = new byte[0];
                throw new IncompleteReadException(partial);
            }
            wait();
        }
    }

    public synchronized int buffered() {
        return buffer.length;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            eof = true;
            exhausted = true;
            notifyAll();
        }
        onClose.run();
    }

    static int indexOf(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
