package com.questrail.cot.transport.tls;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of a successful enrollment: a PKCS#12 bundle and the passphrase that opens it.
 */
public record EnrolledCertificate(Path certificate, String passphrase)
{
    public EnrolledCertificate {
        Objects.requireNonNull(certificate, "certificate");
        Objects.requireNonNull(passphrase, "passphrase");
    }

    @Override
    public String toString() {
        return "EnrolledCertificate[" + certificate + "]";
    }
}
