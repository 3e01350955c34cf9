package com.urlguardian.scanner.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * {@link CertificateProbe} backed by the JDK's default SSL socket factory,
 * with SNI and HTTPS host name verification enabled.
 *
 * <p>
 * The handshake blocks and does not react to cancellation of the calling
 * pipeline. It is bounded by the connect and read timeouts, both set to the
 * collector timeout.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
public class JsseCertificateProbe implements CertificateProbe {

    private static final Logger log = LoggerFactory.getLogger(JsseCertificateProbe.class);

    /** subjectAltName type for dNSName entries (RFC 5280). */
    private static final int SAN_DNS_NAME = 2;

    @Override
    public CertificateInfo probe(String host, int port, Duration timeout) throws IOException {
        SSLSocketFactory factory = (SSLSocketFactory) SSLSocketFactory.getDefault();
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());

        try (SSLSocket socket = (SSLSocket) factory.createSocket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMs);
            socket.setSoTimeout(timeoutMs);

            SSLParameters params = socket.getSSLParameters();
            params.setServerNames(List.of(new SNIHostName(host)));
            params.setEndpointIdentificationAlgorithm("HTTPS");
            socket.setSSLParameters(params);

            try {
                socket.startHandshake();
            } catch (SSLException e) {
                log.debug("TLS handshake with {}:{} failed validation: {}", host, port, e.getMessage());
                return CertificateInfo.untrusted(e.getMessage());
            }

            X509Certificate leaf = (X509Certificate) socket.getSession().getPeerCertificates()[0];
            return new CertificateInfo(
                    true,
                    leaf.getIssuerX500Principal().getName(),
                    leaf.getNotBefore().toInstant(),
                    leaf.getNotAfter().toInstant(),
                    dnsNames(leaf),
                    null);
        }
    }

    private static List<String> dnsNames(X509Certificate certificate) {
        List<String> names = new ArrayList<>();
        try {
            Collection<List<?>> entries = certificate.getSubjectAlternativeNames();
            if (entries == null) {
                return names;
            }
            for (List<?> entry : entries) {
                if (entry.size() >= 2 && Integer.valueOf(SAN_DNS_NAME).equals(entry.get(0))) {
                    names.add(String.valueOf(entry.get(1)));
                }
            }
        } catch (CertificateParsingException e) {
            log.debug("Unreadable subjectAltName extension: {}", e.getMessage());
        }
        return names;
    }
}
