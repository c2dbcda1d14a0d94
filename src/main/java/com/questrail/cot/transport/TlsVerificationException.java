package com.questrail.cot.transport;

import com.questrail.cot.CotTransportException;

/**
 * The TAK server's certificate could not be verified during the TLS handshake.
 *
 * <p>The message names the configuration overrides that relax verification,
 * so an operator can act on it directly.</p>
 */
public final class TlsVerificationException extends CotTransportException
{
    public TlsVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
