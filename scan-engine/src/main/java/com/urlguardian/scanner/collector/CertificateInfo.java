package com.urlguardian.scanner.collector;

import java.time.Instant;
import java.util.List;

/**
 * Leaf certificate presented by a TLS endpoint.
 *
 * @param trusted         the chain validated against the default trust store and matched the host
 * @param issuer          issuer distinguished name, or null when untrusted
 * @param validFrom       notBefore, or null when untrusted
 * @param validTo         notAfter, or null when untrusted
 * @param subjectAltNames DNS subject alternative names
 * @param error           handshake failure reason when untrusted
 * @author URL Guardian Team
 */
public record CertificateInfo(boolean trusted, String issuer, Instant validFrom, Instant validTo,
        List<String> subjectAltNames, String error) {

    public CertificateInfo {
        subjectAltNames = subjectAltNames == null ? List.of() : List.copyOf(subjectAltNames);
    }

    public static CertificateInfo untrusted(String error) {
        return new CertificateInfo(false, null, null, null, List.of(), error);
    }
}
