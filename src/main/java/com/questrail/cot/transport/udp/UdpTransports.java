package com.questrail.cot.transport.udp;

import com.questrail.cot.codec.ProtocolFormat;
import com.questrail.cot.config.CotConfig;
import com.questrail.cot.config.CotConfigKeys;
import com.questrail.cot.config.CotConfigurationException;
import com.questrail.cot.config.CotUrl;
import com.questrail.cot.transport.TransportContext;
import com.questrail.cot.transport.TransportEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.NetworkInterface;
import java.net.ProtocolFamily;
import java.net.SocketException;
import java.net.StandardProtocolFamily;
import java.net.StandardSocketOptions;
import java.nio.channels.DatagramChannel;
import java.util.Collections;
import java.util.Locale;

/**
 * UdpTransports
 * -----------------------------------------------------------------------------
 * Builds the (reader, writer) pair for a {@code udp} destination.
 *
 * <p>Sockets are opened and configured as plain JDK {@link DatagramChannel}s
 * (broadcast and reuse flags, multicast TTL and membership) and then adapted
 * with {@link DatagramStreams#fromSocket}. Options that affect binding are set
 * before the bind.</p>
 *
 * <ul>
 *   <li>Writer: bound to {@code PYTAK_MULTICAST_LOCAL_ADDR:0} and connected to
 *       the destination. {@code SO_BROADCAST} for broadcast destinations,
 *       {@code IP_MULTICAST_TTL} for multicast ones.</li>
 *   <li>Reader: bound to the destination {@code host:port} (the wildcard
 *       address on Windows). Absent for {@code +wo}.</li>
 * </ul>
 */
public final class UdpTransports
{
    private static final Logger log = LoggerFactory.getLogger(UdpTransports.class);

    private static final boolean BIND_ALL =
            System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");

    private UdpTransports() {}

    public static TransportEndpoint open(TransportContext context, CotUrl url, CotConfig config)
            throws IOException, InterruptedException
    {
        boolean broadcast = url.isBroadcast();
        boolean multicast = url.isMulticastScheme() || ProtocolFormat.isMulticastHost(url.host());

        InetAddress destination = InetAddress.getByName(url.host());
        ProtocolFamily family = destination instanceof Inet6Address
                ? StandardProtocolFamily.INET6
                : StandardProtocolFamily.INET;

        InetAddress localAddress = localAddress(config, family);
        int ttl = config.getInt(CotConfigKeys.MULTICAST_TTL, CotConfigKeys.DEFAULT_MULTICAST_TTL);

        DatagramClient writer = openWriter(context, family, new InetSocketAddress(destination, url.port()),
                localAddress, broadcast, multicast, ttl);

        if (url.isWriteOnly()) {
            return new TransportEndpoint(null, writer);
        }

        DatagramServer reader;
        try {
            reader = openReader(context, family, destination, url.port(), localAddress, broadcast, multicast);
        } catch (IOException | RuntimeException e) {
            writer.close();
            throw e;
        }
        return new TransportEndpoint(reader, writer);
    }

    private static DatagramClient openWriter(TransportContext context,
                                             ProtocolFamily family,
                                             InetSocketAddress remote,
                                             InetAddress localAddress,
                                             boolean broadcast,
                                             boolean multicast,
                                             int ttl)
            throws IOException, InterruptedException
    {
        DatagramChannel ch = DatagramChannel.open(family);
        try {
            if (broadcast) {
                ch.setOption(StandardSocketOptions.SO_BROADCAST, true);
            }
            if (multicast) {
                ch.setOption(StandardSocketOptions.IP_MULTICAST_TTL, ttl);
            }
            ch.bind(new InetSocketAddress(localAddress, 0));
            ch.connect(remote);
            return (DatagramClient) DatagramStreams.fromSocket(context, ch);
        } catch (IOException | RuntimeException e) {
            ch.close();
            throw e;
        }
    }

    private static DatagramServer openReader(TransportContext context,
                                             ProtocolFamily family,
                                             InetAddress host,
                                             int port,
                                             InetAddress localAddress,
                                             boolean broadcast,
                                             boolean multicast)
            throws IOException, InterruptedException
    {
        DatagramChannel ch = DatagramChannel.open(family);
        try {
            if (broadcast) {
                ch.setOption(StandardSocketOptions.SO_BROADCAST, true);
            }
            if (broadcast || multicast) {
                ch.setOption(StandardSocketOptions.SO_REUSEADDR, true);
                if (ch.supportedOptions().contains(StandardSocketOptions.SO_REUSEPORT)) {
                    ch.setOption(StandardSocketOptions.SO_REUSEPORT, true);
                }
            }

            ch.bind(BIND_ALL ? new InetSocketAddress(port) : new InetSocketAddress(host, port));

            if (multicast) {
                NetworkInterface nif = multicastInterface(localAddress);
                ch.join(host, nif);
                log.debug("Joined multicast group {} on {}", host.getHostAddress(), nif.getName());
            }
            return (DatagramServer) DatagramStreams.fromSocket(context, ch);
        } catch (IOException | RuntimeException e) {
            ch.close();
            throw e;
        }
    }

    private static InetAddress localAddress(CotConfig config, ProtocolFamily family) throws IOException {
        String configured = config.get(CotConfigKeys.MULTICAST_LOCAL_ADDR, CotConfigKeys.DEFAULT_MULTICAST_LOCAL_ADDR);
        InetAddress address = InetAddress.getByName(configured);
        if (family == StandardProtocolFamily.INET6 && !(address instanceof Inet6Address) && address.isAnyLocalAddress()) {
            // An IPv6 socket cannot bind the IPv4 wildcard.
            return InetAddress.getByName("::");
        }
        return address;
    }

    /**
     * Interface used to join a multicast group: the one owning {@code localAddress},
     * or the first active multicast-capable interface when it is the wildcard.
     */
    static NetworkInterface multicastInterface(InetAddress localAddress) throws SocketException {
        if (!localAddress.isAnyLocalAddress()) {
            NetworkInterface nif = NetworkInterface.getByInetAddress(localAddress);
            if (nif == null) {
                throw new CotConfigurationException(
                        "No network interface has address " + CotConfigKeys.MULTICAST_LOCAL_ADDR + "="
                        + localAddress.getHostAddress());
            }
            return nif;
        }

        NetworkInterface loopback = null;
        for (NetworkInterface nif : Collections.list(NetworkInterface.getNetworkInterfaces())) {
            if (!nif.isUp() || !nif.supportsMulticast()) {
                continue;
            }
            if (!nif.isLoopback()) {
                return nif;
            }
            if (loopback == null) {
                loopback = nif;
            }
        }
        if (loopback != null) {
            return loopback;
        }
        throw new SocketException("No multicast-capable network interface is up");
    }
}
