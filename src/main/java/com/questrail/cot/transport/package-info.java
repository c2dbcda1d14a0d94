/**
 * CoT Transport Ports
 * =============================================================================
 *
 * These types define the <em>framework-agnostic transport boundary</em>
 * between concrete networking code (Netty TCP/TLS/UDP channels, standard
 * streams, files, or a test double) and the worker pipeline.
 *
 * <h2>Why these ports exist</h2>
 * Production transports are built on Netty (event loop model, mature UDP and
 * TLS support, robust lifecycle handling) <strong>without</strong> allowing
 * Netty types to leak into the workers.
 *
 * <p>Everything above the transport factory sees only:</p>
 * <ul>
 *   <li>Raw payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>One of exactly two reader capabilities
 *       ({@link com.questrail.cot.transport.StreamSource},
 *       {@link com.questrail.cot.transport.DatagramSource}) and two writer
 *       capabilities ({@link com.questrail.cot.transport.StreamSink},
 *       {@link com.questrail.cot.transport.DatagramSink}), resolved once when
 *       the endpoint is built</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no CoT interpretation)</li>
 *   <li>Not transcode between XML and TAK protocol framing</li>
 *   <li>Not schedule retries, reconnects, or timeouts</li>
 * </ul>
 */
package com.questrail.cot.transport;
