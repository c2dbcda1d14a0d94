package com.questrail.cot.transport.tls;

import java.io.IOException;

/**
 * Port for TAK server certificate enrollment.
 *
 * <p>Implementations request a client certificate from the server's
 * enrollment API and write it as a PKCS#12 file to
 * {@link EnrollmentRequest#outputPath()}.</p>
 */
public interface CertificateEnrollment
{
    EnrolledCertificate enroll(EnrollmentRequest request) throws IOException, InterruptedException;
}
