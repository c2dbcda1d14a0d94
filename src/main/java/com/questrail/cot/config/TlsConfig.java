package com.questrail.cot.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TlsConfig
 * -----------------------------------------------------------------------------
 * Validated projection of a {@link CotConfig} restricted to TLS parameters.
 *
 * <p>A client certificate is always required. It may be configured directly
 * ({@code PYTAK_TLS_CLIENT_CERT}) or obtained at connect time through
 * certificate enrollment, in which case the enrollment username and password
 * stand in for it until {@link #withClientCert(String, String)} is applied.</p>
 *
 * <p>The two trust overrides are independent. {@code dontVerify} implies
 * {@code dontCheckHostname}.</p>
 */
public record TlsConfig(
        Optional<String> clientCert,
        Optional<String> clientKey,
        Optional<String> caFile,
        Optional<String> password,
        List<String> ciphers,
        boolean dontCheckHostname,
        boolean dontVerify,
        Optional<String> expectedHostname,
        Optional<String> enrollmentUsername,
        Optional<String> enrollmentPassword,
        Optional<String> enrollmentPassphrase,
        Optional<String> enrollmentUrl
) {
    public TlsConfig {
        Objects.requireNonNull(clientCert, "clientCert");
        Objects.requireNonNull(clientKey, "clientKey");
        Objects.requireNonNull(caFile, "caFile");
        Objects.requireNonNull(password, "password");
        ciphers = List.copyOf(Objects.requireNonNull(ciphers, "ciphers"));
        Objects.requireNonNull(expectedHostname, "expectedHostname");
        Objects.requireNonNull(enrollmentUsername, "enrollmentUsername");
        Objects.requireNonNull(enrollmentPassword, "enrollmentPassword");
        Objects.requireNonNull(enrollmentPassphrase, "enrollmentPassphrase");
        Objects.requireNonNull(enrollmentUrl, "enrollmentUrl");

        if (clientCert.isEmpty() && !(enrollmentUsername.isPresent() && enrollmentPassword.isPresent())) {
            throw new CotConfigurationException("Missing value: " + CotConfigKeys.TLS_CLIENT_CERT);
        }
    }

    /**
     * @throws CotConfigurationException if no client certificate (or enrollment
     *         credentials in its place) is configured
     */
    public static TlsConfig from(CotConfig config) {
        Objects.requireNonNull(config, "config");

        List<String> ciphers = config.get(CotConfigKeys.TLS_CLIENT_CIPHERS)
                .map(TlsConfig::splitCiphers)
                .orElse(List.of());

        return new TlsConfig(
                config.get(CotConfigKeys.TLS_CLIENT_CERT),
                config.get(CotConfigKeys.TLS_CLIENT_KEY),
                config.get(CotConfigKeys.TLS_CLIENT_CAFILE),
                config.get(CotConfigKeys.TLS_CLIENT_PASSWORD),
                ciphers,
                config.getBoolean(CotConfigKeys.TLS_DONT_CHECK_HOSTNAME),
                config.getBoolean(CotConfigKeys.TLS_DONT_VERIFY),
                config.get(CotConfigKeys.TLS_SERVER_EXPECTED_HOSTNAME),
                config.get(CotConfigKeys.TLS_CERT_ENROLLMENT_USERNAME),
                config.get(CotConfigKeys.TLS_CERT_ENROLLMENT_PASSWORD),
                config.get(CotConfigKeys.TLS_CERT_ENROLLMENT_PASSPHRASE),
                config.get(CotConfigKeys.TLS_CERT_ENROLLMENT_URL)
        );
    }

    private static List<String> splitCiphers(String value) {
        if ("ALL".equalsIgnoreCase(value)) {
            return List.of();
        }
        return List.of(value.split("[:,]"));
    }

    public boolean enrollmentRequested() {
        return enrollmentUsername.isPresent() && enrollmentPassword.isPresent();
    }

    public boolean checkHostname() {
        return !dontCheckHostname && !dontVerify;
    }

    /** Enrollment passphrase, falling back to the configured key password. */
    public Optional<String> effectivePassword() {
        return enrollmentPassphrase.isPresent() ? enrollmentPassphrase : password;
    }

    public boolean isPkcs12() {
        return clientCert.map(c -> c.endsWith(".p12") || c.endsWith(".pfx")).orElse(false);
    }

    /**
     * Returns a copy using an enrolled certificate and its passphrase.
     */
    public TlsConfig withClientCert(String certPath, String passphrase) {
        return new TlsConfig(
                Optional.of(certPath), clientKey, caFile, password, ciphers,
                dontCheckHostname, dontVerify, expectedHostname,
                enrollmentUsername, enrollmentPassword, Optional.ofNullable(passphrase), enrollmentUrl);
    }

    /**
     * Checks that the certificate and key files exist.
     *
     * @throws CotConfigurationException naming the missing resource
     */
    public void requireResources() {
        String cert = clientCert.orElseThrow(
                () -> new CotConfigurationException("Missing value: " + CotConfigKeys.TLS_CLIENT_CERT));
        if (!Files.exists(Path.of(cert))) {
            throw new CotConfigurationException("Resource not found: " + CotConfigKeys.TLS_CLIENT_CERT + "=" + cert);
        }
        clientKey.ifPresent(key -> {
            if (!Files.exists(Path.of(key))) {
                throw new CotConfigurationException("Resource not found: " + CotConfigKeys.TLS_CLIENT_KEY + "=" + key);
            }
        });
        caFile.ifPresent(ca -> {
            if (!Files.exists(Path.of(ca))) {
                throw new CotConfigurationException("Resource not found: " + CotConfigKeys.TLS_CLIENT_CAFILE + "=" + ca);
            }
        });
    }
}
