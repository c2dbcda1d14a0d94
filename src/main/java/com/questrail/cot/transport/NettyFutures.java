package com.questrail.cot.transport;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import java.io.IOException;

/**
 * Blocking bridge from Netty channel futures to checked exceptions.
 *
 * <p>Never call from an event loop thread.</p>
 */
public final class NettyFutures
{
    private NettyFutures() {}

    /**
     * Wait for {@code future} and return its channel.
     *
     * @throws IOException carrying (or wrapping) the failure cause
     */
    public static Channel await(ChannelFuture future) throws IOException, InterruptedException {
        future.await();
        if (future.isSuccess()) {
            return future.channel();
        }
        throw asIOException(future.cause());
    }

    public static IOException asIOException(Throwable cause) {
        if (cause instanceof IOException io) {
            return io;
        }
        return new IOException(String.valueOf(cause), cause);
    }
}
