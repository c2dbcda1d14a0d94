package com.questrail.cot.codec;

/**
 * Port for the TAK protocol (protobuf) codec.
 *
 * <p>Implementations must be thread-safe; one instance is shared by every
 * worker of a runtime.</p>
 */
public interface TakProtoCodec
{
    /**
     * Transcode a CoT XML event into TAK protocol framing.
     *
     * @param xml    CoT XML document bytes
     * @param format {@link ProtocolFormat#MESH} or {@link ProtocolFormat#STREAM}
     * @return the framed binary payload
     * @throws CodecException if {@code xml} is not a well-formed CoT event
     */
    byte[] xmlToProto(byte[] xml, ProtocolFormat format) throws CodecException;

    /**
     * Decode a received TAK protocol frame back into CoT XML.
     *
     * @param frame bytes as received from the transport
     * @return decoded event bytes
     * @throws CodecException if {@code frame} is not a TAK protocol frame
     */
    byte[] protoToXml(byte[] frame) throws CodecException;
}
