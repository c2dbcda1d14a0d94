package com.questrail.cot.transport.tls;

import com.questrail.cot.config.CotConfigKeys;
import com.questrail.cot.config.CotConfigurationException;
import com.questrail.cot.config.TlsConfig;
import com.questrail.cot.observability.CotObservabilitySink;
import com.questrail.cot.observability.CotWarningEvent;
import com.questrail.cot.transport.TlsVerificationException;

import io.netty.buffer.ByteBufAllocator;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.SupportedCipherSuiteFilter;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import io.netty.util.NetUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.CertificateException;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TlsContextFactory
 * =============================================================================
 * Turns a {@link TlsConfig} into a client {@link SslContext} and per-connection
 * {@link SslHandler}s.
 *
 * <h2>Trust policy</h2>
 * <ul>
 *   <li>Only TLS 1.2 and 1.3 are offered.</li>
 *   <li>The server chain is verified against the configured CA file, or the
 *       JDK trust store when none is given.</li>
 *   <li>The server name is checked with the {@code HTTPS} endpoint
 *       identification algorithm against {@code PYTAK_TLS_SERVER_EXPECTED_HOSTNAME},
 *       falling back to the destination host.</li>
 * </ul>
 *
 * <p>{@code PYTAK_TLS_DONT_CHECK_HOSTNAME} and {@code PYTAK_TLS_DONT_VERIFY}
 * relax those checks. Each relaxation is reported as a warning through the
 * observability sink every time a context is built.</p>
 */
public final class TlsContextFactory
{
    private static final Logger log = LoggerFactory.getLogger(TlsContextFactory.class);

    static final String SOURCE = "tls";
    static final String[] PROTOCOLS = { "TLSv1.3", "TLSv1.2" };

    private final CotObservabilitySink observabilitySink;
    private final SecureRandom random = new SecureRandom();

    public TlsContextFactory(CotObservabilitySink observabilitySink) {
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Builds the client context, enrolling for a client certificate first when
     * enrollment credentials are configured. The enrolled PKCS#12 bundle only
     * lives on disk until its key material is loaded.
     *
     * @param host destination host, used as the enrollment domain unless
     *             {@code PYTAK_TLS_CERT_ENROLLMENT_URL} is set
     * @throws CotConfigurationException if enrollment is requested but no enrollment
     *         client is available, or a certificate, key or CA file is unusable
     */
    public SslContext newClientContext(TlsConfig tls, String host, Optional<CertificateEnrollment> enrollment)
            throws IOException, InterruptedException
    {
        if (!tls.enrollmentRequested()) {
            return newClientContext(tls);
        }
        CertificateEnrollment client = enrollment.orElseThrow(() -> new CotConfigurationException(
                CotConfigKeys.TLS_CERT_ENROLLMENT_USERNAME + " is set, but no CertificateEnrollment is available"));

        Path output = Files.createTempFile("cot-enrollment-", ".p12");
        try {
            return newClientContext(enroll(tls, host, client, output));
        } finally {
            Files.deleteIfExists(output);
        }
    }

    private TlsConfig enroll(TlsConfig tls, String host, CertificateEnrollment client, Path output)
            throws IOException, InterruptedException
    {
        String passphrase = tls.enrollmentPassphrase().orElseGet(() -> {
            log.info("Using generated passphrase for certificate enrollment");
            return generatePassphrase();
        });

        EnrollmentRequest request = new EnrollmentRequest(
                tls.enrollmentUrl().orElse(host),
                tls.enrollmentUsername().orElseThrow(),
                tls.enrollmentPassword().orElseThrow(),
                output,
                passphrase);

        log.info("Enrolling for a client certificate with {}", request.domain());
        EnrolledCertificate enrolled = client.enroll(request);
        return tls.withClientCert(enrolled.certificate().toString(), enrolled.passphrase());
    }

    /**
     * @throws CotConfigurationException if a certificate, key or CA file is missing or unreadable
     */
    public SslContext newClientContext(TlsConfig tls) {
        tls.requireResources();

        SslContextBuilder builder = SslContextBuilder.forClient()
                .protocols(PROTOCOLS)
                .ciphers(tls.ciphers().isEmpty() ? null : tls.ciphers(), SupportedCipherSuiteFilter.INSTANCE);

        configureKeyMaterial(builder, tls);

        if (tls.dontVerify()) {
            builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
        } else if (tls.caFile().isPresent()) {
            String ca = tls.caFile().get();
            try {
                builder.trustManager(new File(ca));
            } catch (IllegalArgumentException e) {
                throw new CotConfigurationException(
                        "Error opening resource " + CotConfigKeys.TLS_CLIENT_CAFILE + "=" + ca, e);
            }
        }

        if (tls.dontCheckHostname()) {
            warn("Disabled TLS Server Common Name Verification (" + CotConfigKeys.TLS_DONT_CHECK_HOSTNAME + ")");
        }
        if (tls.dontVerify()) {
            warn("Disabled TLS Server Certificate Verification (" + CotConfigKeys.TLS_DONT_VERIFY + ")");
        }

        try {
            return builder.build();
        } catch (SSLException e) {
            throw new CotConfigurationException("Error opening resource. Using: "
                    + CotConfigKeys.TLS_CLIENT_CERT + "=" + tls.clientCert().orElse("")
                    + " [" + CotConfigKeys.TLS_CLIENT_KEY + "=" + tls.clientKey().orElse("") + "]"
                    + " Using Password: " + tls.effectivePassword().isPresent(), e);
        }
    }

    /**
     * Creates the handler for one connection, configuring SNI and hostname checking.
     */
    public SslHandler newHandler(SslContext context, TlsConfig tls, ByteBufAllocator alloc, String host, int port) {
        String serverName = tls.checkHostname() ? tls.expectedHostname().orElse(host) : host;
        SslHandler handler = context.newHandler(alloc, serverName, port);

        SSLEngine engine = handler.engine();
        SSLParameters params = engine.getSSLParameters();
        if (tls.checkHostname()) {
            params.setEndpointIdentificationAlgorithm("HTTPS");
        }
        if (isHostName(serverName)) {
            params.setServerNames(List.of(new SNIHostName(serverName)));
        }
        engine.setSSLParameters(params);
        return handler;
    }

    /**
     * Classifies a handshake failure: a rejected server certificate (untrusted
     * chain or name mismatch) becomes a {@link TlsVerificationException}.
     */
    public static Optional<TlsVerificationException> verificationFailure(Throwable cause) {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof CertificateException) {
                return Optional.of(new TlsVerificationException(
                        "Could not verify TLS Certificate for TAK Server. Bypass with "
                        + CotConfigKeys.TLS_DONT_CHECK_HOSTNAME + "=1 or "
                        + CotConfigKeys.TLS_DONT_VERIFY + "=1", cause));
            }
        }
        return Optional.empty();
    }

    private void configureKeyMaterial(SslContextBuilder builder, TlsConfig tls) {
        String cert = tls.clientCert().orElseThrow();
        String password = tls.effectivePassword().orElse(null);

        if (tls.isPkcs12()) {
            char[] pw = password == null ? new char[0] : password.toCharArray();
            try (InputStream in = Files.newInputStream(Path.of(cert))) {
                KeyStore keyStore = KeyStore.getInstance("PKCS12");
                keyStore.load(in, pw);

                KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
                kmf.init(keyStore, pw);
                builder.keyManager(kmf);
            } catch (IOException | GeneralSecurityException e) {
                throw new CotConfigurationException(
                        "Error opening PKCS#12 resource " + CotConfigKeys.TLS_CLIENT_CERT + "=" + cert, e);
            }
            return;
        }

        // A PEM certificate file may carry its own key.
        String key = tls.clientKey().orElse(cert);
        try {
            builder.keyManager(new File(cert), new File(key), password);
        } catch (IllegalArgumentException e) {
            throw new CotConfigurationException("Error opening resource. Using: "
                    + CotConfigKeys.TLS_CLIENT_CERT + "=" + cert
                    + " [" + CotConfigKeys.TLS_CLIENT_KEY + "=" + key + "]"
                    + " Using Password: " + (password != null), e);
        }
    }

    private String generatePassphrase() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private void warn(String message) {
        observabilitySink.onWarning(new CotWarningEvent(Instant.now(), SOURCE, message));
    }

    private static boolean isHostName(String name) {
        return !NetUtil.isValidIpV4Address(name) && !NetUtil.isValidIpV6Address(name);
    }
}
