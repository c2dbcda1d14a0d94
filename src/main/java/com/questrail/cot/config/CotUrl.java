package com.questrail.cot.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * CotUrl
 * -----------------------------------------------------------------------------
 * Parsed destination descriptor: {@code scheme://host[:port][/path]}.
 *
 * <h2>Schemes</h2>
 * <ul>
 *   <li>{@code tcp}: plain stream connection</li>
 *   <li>{@code tls}, {@code ssl}: TLS stream connection</li>
 *   <li>{@code udp} with any combination of the modifiers {@code +broadcast},
 *       {@code +multicast} and {@code +wo} (write-only)</li>
 *   <li>{@code log}: process standard output, or standard error when the host
 *       contains {@code stderr}</li>
 *   <li>{@code file}: local file at {@code host + path}</li>
 * </ul>
 *
 * <p>When no port is given, the broadcast/multicast family defaults to
 * {@value CotConfigKeys#DEFAULT_BROADCAST_PORT} and everything else to
 * {@value CotConfigKeys#DEFAULT_COT_PORT}. Bracketed IPv6 literals are
 * accepted ({@code udp://[ff02::1]:6969}).</p>
 */
public record CotUrl(String raw, String scheme, String host, int port, String path)
{
    private static final String SEPARATOR = "://";
    private static final Set<String> BASE_SCHEMES = Set.of("tcp", "tls", "ssl", "udp", "log", "file");
    private static final Set<String> UDP_MODIFIERS = Set.of("broadcast", "multicast", "wo");

    public CotUrl {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(path, "path");
    }

    /**
     * Parses and validates a descriptor.
     *
     * @throws CotConfigurationException if the separator is missing, the scheme
     *         or one of its modifiers is not recognized, or the port is malformed
     */
    public static CotUrl parse(String raw) {
        Objects.requireNonNull(raw, "raw");

        int sep = raw.indexOf(SEPARATOR);
        if (sep <= 0) {
            throw new CotConfigurationException(
                    "Invalid COT_URL=" + raw + ". Specify COT_URL as a full URL, for example: tcp://tak.example.com:8087");
        }

        String scheme = raw.substring(0, sep).toLowerCase(Locale.ROOT);
        validateScheme(raw, scheme);

        String rest = raw.substring(sep + SEPARATOR.length());
        int slash = rest.indexOf('/');
        String authority = slash >= 0 ? rest.substring(0, slash) : rest;
        String path = slash >= 0 ? rest.substring(slash) : "";

        String host = authority;
        String portText = null;

        if (authority.startsWith("[")) {
            int close = authority.indexOf(']');
            if (close < 0) {
                throw new CotConfigurationException("Unterminated IPv6 literal in COT_URL=" + raw);
            }
            host = authority.substring(1, close);
            String tail = authority.substring(close + 1);
            if (tail.startsWith(":")) {
                portText = tail.substring(1);
            } else if (!tail.isEmpty()) {
                throw new CotConfigurationException("Unexpected characters after IPv6 literal in COT_URL=" + raw);
            }
        } else {
            int colon = authority.indexOf(':');
            // A bare IPv6 literal has several colons and no port.
            if (colon >= 0 && colon == authority.lastIndexOf(':')) {
                host = authority.substring(0, colon);
                portText = authority.substring(colon + 1);
            }
        }

        int port = portText == null || portText.isEmpty()
                ? defaultPort(scheme)
                : parsePort(raw, portText);

        return new CotUrl(raw, scheme, host, port, path);
    }

    private static void validateScheme(String raw, String scheme) {
        String[] parts = scheme.split("\\+");
        String base = parts[0];
        if (!BASE_SCHEMES.contains(base)) {
            throw new CotConfigurationException(
                    "Invalid COT_URL protocol specified: " + raw + ". Expected one of " + BASE_SCHEMES);
        }
        for (int i = 1; i < parts.length; i++) {
            if (!"udp".equals(base) || !UDP_MODIFIERS.contains(parts[i])) {
                throw new CotConfigurationException(
                        "Invalid COT_URL protocol modifier '+" + parts[i] + "' in " + raw);
            }
        }
    }

    private static int parsePort(String raw, String text) {
        try {
            int port = Integer.parseInt(text);
            if (port < 0 || port > 0xFFFF) {
                throw new CotConfigurationException("Port out of range in COT_URL=" + raw);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new CotConfigurationException("Invalid port in COT_URL=" + raw, e);
        }
    }

    private static int defaultPort(String scheme) {
        if (scheme.contains("broadcast") || scheme.contains("multicast")) {
            return CotConfigKeys.DEFAULT_BROADCAST_PORT;
        }
        return CotConfigKeys.DEFAULT_COT_PORT;
    }

    private String baseScheme() {
        int plus = scheme.indexOf('+');
        return plus < 0 ? scheme : scheme.substring(0, plus);
    }

    public boolean isTcp() {
        return "tcp".equals(baseScheme());
    }

    public boolean isTls() {
        String base = baseScheme();
        return "tls".equals(base) || "ssl".equals(base);
    }

    public boolean isUdp() {
        return "udp".equals(baseScheme());
    }

    public boolean isBroadcast() {
        return isUdp() && scheme.contains("+broadcast");
    }

    /** True only for an explicit {@code +multicast} modifier; see {@code ProtocolFormat} for address detection. */
    public boolean isMulticastScheme() {
        return isUdp() && scheme.contains("+multicast");
    }

    public boolean isWriteOnly() {
        return isUdp() && scheme.contains("+wo");
    }

    public boolean isLog() {
        return "log".equals(baseScheme());
    }

    public boolean isFile() {
        return "file".equals(baseScheme());
    }

    /** Location of a {@code file} sink: the authority and path joined. */
    public String filePath() {
        return host + path;
    }

    @Override
    public String toString() {
        return raw;
    }
}
