/**
 * TAK protocol codec boundary.
 * =============================================================================
 *
 * The transport layer moves opaque frames. Two concrete wire formats exist
 * above it:
 * <ul>
 *   <li>CoT XML, delimited on stream transports by {@code </event>}</li>
 *   <li>TAK protocol version 1 (protobuf), with <em>Mesh</em> framing for
 *       multicast destinations and <em>Stream</em> framing for point-to-point
 *       ones</li>
 * </ul>
 *
 * <p>Transcoding between them is supplied by a {@link com.questrail.cot.codec.TakProtoCodec}
 * implementation outside this library. This package only decides
 * <em>which</em> format an endpoint uses ({@link com.questrail.cot.codec.ProtocolFormat})
 * and defines the collaborator port.</p>
 */
package com.questrail.cot.codec;
