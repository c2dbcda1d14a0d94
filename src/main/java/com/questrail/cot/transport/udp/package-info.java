/**
 * Datagram streams.
 * =============================================================================
 *
 * Bridges Netty's callback-driven UDP channels into blocking
 * {@code send}/{@code recv} objects with flow control.
 *
 * <h2>Callback confinement</h2>
 * Each {@link com.questrail.cot.transport.udp.DatagramStream} registers exactly
 * one inbound handler. That handler, running on the channel's event loop, is
 * the only producer into the stream's inbound queue, error queue and drained
 * signal; callers are the only consumers.
 *
 * <h2>Retrospective errors</h2>
 * A UDP send can fail after the call that caused it has returned (ICMP port
 * unreachable, a failed write future). Such failures are queued and raised by
 * the <em>next</em> {@code send} or {@code recv}.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code ByteBuf}, {@code DatagramPacket})
 * MUST NOT escape this package.
 */
package com.questrail.cot.transport.udp;
