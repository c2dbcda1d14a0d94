package com.questrail.cot;

/**
 * Root of the unchecked exceptions raised by the CoT transport layer.
 *
 * <p>Socket-level faults are reported as {@link java.io.IOException}; this
 * hierarchy covers conditions that are not plain I/O failures, such as an
 * unusable configuration or a TLS trust failure that needs operator action.</p>
 */
public class CotTransportException extends RuntimeException
{
    public CotTransportException(String message) {
        super(message);
    }

    public CotTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
