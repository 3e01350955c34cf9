package com.urlguardian.scanner.collector;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.urlguardian.scanner.signal.RiskSignal;

import java.util.List;

/**
 * TLS posture of a URL.
 *
 * @param https           the URL uses HTTPS
 * @param certificate     probed certificate, null for plain HTTP
 * @param daysUntilExpiry whole days until notAfter, -1 when unknown
 * @param securityHeaders response security headers, null when the page could not be fetched
 * @author URL Guardian Team
 */
public record TlsAudit(boolean https, CertificateInfo certificate, long daysUntilExpiry,
        SecurityHeaders securityHeaders, List<String> flags, int riskScore) implements RiskSignal {

    public TlsAudit {
        flags = List.copyOf(flags);
    }

    @Override
    @JsonIgnore
    public List<String> redFlags() {
        return RiskSignal.describeAll(flags);
    }

    public record SecurityHeaders(boolean hsts, boolean csp, boolean xFrameOptions, boolean xContentTypeOptions,
            boolean referrerPolicy) {

        public static SecurityHeaders of(PageSnapshot page) {
            return new SecurityHeaders(
                    page.hasHeader("strict-transport-security"),
                    page.hasHeader("content-security-policy"),
                    page.hasHeader("x-frame-options"),
                    page.hasHeader("x-content-type-options"),
                    page.hasHeader("referrer-policy"));
        }
    }
}
