package com.questrail.cot.transport.tls;

import java.nio.file.Path;
import java.util.Objects;

/**
 * @param domain     enrollment server host
 * @param outputPath where the PKCS#12 bundle is written
 * @param passphrase protects the written bundle
 */
public record EnrollmentRequest(
        String domain,
        String username,
        String password,
        Path outputPath,
        String passphrase
) {
    public EnrollmentRequest {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(outputPath, "outputPath");
        Objects.requireNonNull(passphrase, "passphrase");
    }

    @Override
    public String toString() {
        return "EnrollmentRequest[domain=" + domain + ", username=" + username + ", outputPath=" + outputPath + "]";
    }
}
