package com.questrail.cot.config;

/**
 * Configuration keys recognized by the transport layer, with their defaults.
 *
 * <p>Key names match the ones TAK tooling has historically used in
 * environment variables and INI sections, so existing deployments can hand
 * their settings over unchanged.</p>
 */
public final class CotConfigKeys
{
    private CotConfigKeys() {}

    /** Destination descriptor, {@code scheme://host[:port]}. */
    public static final String COT_URL = "COT_URL";

    /** ATAK default multicast group, write-only. */
    public static final String DEFAULT_COT_URL = "udp+wo://239.2.3.1:6969";

    public static final String MAX_OUT_QUEUE = "MAX_OUT_QUEUE";
    public static final int DEFAULT_MAX_OUT_QUEUE = 100;

    public static final String MAX_IN_QUEUE = "MAX_IN_QUEUE";
    public static final int DEFAULT_MAX_IN_QUEUE = 500;

    /** 0 selects CoT XML; anything greater selects TAK protocol (Mesh/Stream) framing. */
    public static final String TAK_PROTO = "TAK_PROTO";
    public static final int DEFAULT_TAK_PROTO = 0;

    public static final String MULTICAST_LOCAL_ADDR = "PYTAK_MULTICAST_LOCAL_ADDR";
    public static final String DEFAULT_MULTICAST_LOCAL_ADDR = "0.0.0.0";

    public static final String MULTICAST_TTL = "PYTAK_MULTICAST_TTL";
    public static final int DEFAULT_MULTICAST_TTL = 1;

    /** FreeTAKServer compatibility: random per-event delay of up to {@link #DEFAULT_SLEEP} seconds. */
    public static final String FTS_COMPAT = "FTS_COMPAT";

    /** Fixed per-event delay in seconds; takes precedence over {@link #FTS_COMPAT}. */
    public static final String PYTAK_SLEEP = "PYTAK_SLEEP";
    public static final int DEFAULT_SLEEP = 5;

    public static final String COT_HOST_ID = "COT_HOST_ID";
    public static final String DEFAULT_COT_HOST_ID = "takPing";

    /** Suppresses the hello event the runtime sends when it starts. */
    public static final String NO_HELLO = "PYTAK_NO_HELLO";

    public static final String TLS_CLIENT_CERT = "PYTAK_TLS_CLIENT_CERT";
    public static final String TLS_CLIENT_KEY = "PYTAK_TLS_CLIENT_KEY";
    public static final String TLS_CLIENT_CAFILE = "PYTAK_TLS_CLIENT_CAFILE";
    public static final String TLS_CLIENT_PASSWORD = "PYTAK_TLS_CLIENT_PASSWORD";
    public static final String TLS_CLIENT_CIPHERS = "PYTAK_TLS_CLIENT_CIPHERS";
    public static final String TLS_DONT_CHECK_HOSTNAME = "PYTAK_TLS_DONT_CHECK_HOSTNAME";
    public static final String TLS_DONT_VERIFY = "PYTAK_TLS_DONT_VERIFY";
    public static final String TLS_SERVER_EXPECTED_HOSTNAME = "PYTAK_TLS_SERVER_EXPECTED_HOSTNAME";
    public static final String TLS_CERT_ENROLLMENT_USERNAME = "PYTAK_TLS_CERT_ENROLLMENT_USERNAME";
    public static final String TLS_CERT_ENROLLMENT_PASSWORD = "PYTAK_TLS_CERT_ENROLLMENT_PASSWORD";
    public static final String TLS_CERT_ENROLLMENT_PASSPHRASE = "PYTAK_TLS_CERT_ENROLLMENT_PASSPHRASE";
    public static final String TLS_CERT_ENROLLMENT_URL = "PYTAK_TLS_CERT_ENROLLMENT_URL";

    /** Port used by the stream family (tcp, tls) when the descriptor has none. */
    public static final int DEFAULT_COT_PORT = 8087;

    /** Port used by the broadcast/multicast family when the descriptor has none. */
    public static final int DEFAULT_BROADCAST_PORT = 6969;
}
