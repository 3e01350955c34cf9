package com.urlguardian.scanner.collector;

import java.io.IOException;
import java.time.Duration;

/**
 * Performs a TLS handshake and reports the peer certificate.
 *
 * @author URL Guardian Team
 */
public interface CertificateProbe {

    /**
     * @return the certificate, or {@link CertificateInfo#untrusted(String)} when
     *         the handshake completes the TCP connection but fails validation
     * @throws IOException when the endpoint cannot be reached
     */
    CertificateInfo probe(String host, int port, Duration timeout) throws IOException;
}
