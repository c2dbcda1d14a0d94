package com.questrail.cot.codec;

import com.questrail.cot.config.CotConfig;
import com.questrail.cot.config.CotConfigKeys;
import com.questrail.cot.config.CotConfigurationException;
import com.questrail.cot.config.CotUrl;

import io.netty.util.NetUtil;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Wire format used by one endpoint.
 *
 * <p>Resolved once per worker from {@code TAK_PROTO} and the destination host:
 * binary framing is selected when {@code TAK_PROTO > 0}, using {@link #MESH}
 * for a multicast IP literal and {@link #STREAM} otherwise. A DNS name is never
 * treated as multicast; it is not resolved.</p>
 */
public enum ProtocolFormat
{
    XML,
    MESH,
    STREAM;

    public boolean isBinary() {
        return this != XML;
    }

    public static ProtocolFormat resolve(CotConfig config) {
        int takProto = config.getInt(CotConfigKeys.TAK_PROTO, CotConfigKeys.DEFAULT_TAK_PROTO);
        if (takProto <= 0) {
            return XML;
        }
        CotUrl url = CotUrl.parse(config.cotUrl());
        return isMulticastHost(url.host()) ? MESH : STREAM;
    }

    /**
     * Resolves the format and checks that binary framing has a codec to use.
     *
     * @param codec the configured codec; may be {@code null}
     * @throws CotConfigurationException if binary framing is requested without a codec
     */
    public static ProtocolFormat resolve(CotConfig config, TakProtoCodec codec) {
        ProtocolFormat format = resolve(config);
        if (format.isBinary() && codec == null) {
            throw new CotConfigurationException(
                    "TAK_PROTO is set to '" + config.get(CotConfigKeys.TAK_PROTO, "") +
                    "', but no TAK protocol codec is available. Set TAK_PROTO=0 or supply a TakProtoCodec.");
        }
        return format;
    }

    /**
     * True if {@code host} is an IPv4 or IPv6 literal in the multicast range.
     */
    public static boolean isMulticastHost(String host) {
        if (host == null || !(NetUtil.isValidIpV4Address(host) || NetUtil.isValidIpV6Address(host))) {
            return false;
        }
        try {
            // Literal addresses are parsed without a lookup.
            return InetAddress.getByName(host).isMulticastAddress();
        } catch (UnknownHostException e) {
            return false;
        }
    }
}
