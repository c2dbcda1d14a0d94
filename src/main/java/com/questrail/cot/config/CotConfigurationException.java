package com.questrail.cot.config;

import com.questrail.cot.CotTransportException;

/**
 * Indicates that a destination descriptor or its parameters cannot be used
 * to build a transport.
 *
 * This typically reflects:
 * <ul>
 *   <li>A {@code COT_URL} without a {@code ://} separator</li>
 *   <li>An unrecognized scheme or scheme modifier</li>
 *   <li>Incomplete or unreadable TLS parameters</li>
 *   <li>Binary framing requested without a TAK protocol codec</li>
 * </ul>
 *
 * Configuration errors are raised before any worker starts and are never
 * retried automatically.
 */
public final class CotConfigurationException extends CotTransportException
{
    public CotConfigurationException(String message) {
        super(message);
    }

    public CotConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
