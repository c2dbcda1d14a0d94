package com.questrail.cot.codec;

/**
 * Raised by a {@link TakProtoCodec} when a frame cannot be transcoded.
 *
 * <p>Callers treat this as a payload-level fault: the frame is passed on
 * unmodified (transmit) or left as received (receive). It never ends a
 * worker.</p>
 */
public final class CodecException extends Exception
{
    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
