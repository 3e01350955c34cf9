package com.urlguardian.scanner.collector;

import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.feature.HeuristicDictionary;
import com.urlguardian.scanner.feature.UrlFeatureExtractor;
import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.signal.SignalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TlsAuditorTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private static final TlsAudit.SecurityHeaders ALL_HEADERS =
            new TlsAudit.SecurityHeaders(true, true, true, true, true);

    private ScannerConfig config;
    private UrlFeatureExtractor extractor;
    private CertificateInfo certificate;
    private TlsAuditor auditor;

    @BeforeEach
    void setUp() {
        config = new ScannerConfig();
        extractor = new UrlFeatureExtractor(HeuristicDictionary.loadDefault());
        certificate = validCertificate(NOW.minus(Duration.ofDays(200)), NOW.plus(Duration.ofDays(165)));
        auditor = new TlsAuditor((host, port, timeout) -> certificate,
                new PageFetcher(WebClient.builder(), config), config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldPassHealthyHttpsSite() {
        TlsAudit audit = auditor.audit(features("https://example.com"), certificate, ALL_HEADERS);

        assertTrue(audit.https());
        assertTrue(audit.flags().isEmpty());
        assertEquals(0, audit.riskScore());
        assertEquals(165, audit.daysUntilExpiry());
    }

    @Test
    void shouldFlagPlainHttp() {
        TlsAudit audit = auditor.audit(features("http://example.com"), null, ALL_HEADERS);

        assertFalse(audit.https());
        assertEquals(List.of("no_tls_encryption"), audit.flags());
        assertEquals(50, audit.riskScore());
    }

    @Test
    void shouldFlagUntrustedCertificate() {
        TlsAudit audit = auditor.audit(features("https://example.com"),
                CertificateInfo.untrusted("PKIX path building failed"), ALL_HEADERS);

        assertEquals(List.of("invalid_certificate"), audit.flags());
        assertEquals(60, audit.riskScore());
        assertEquals(-1, audit.daysUntilExpiry());
    }

    @Test
    void shouldFlagExpiredCertificate() {
        CertificateInfo expired = validCertificate(NOW.minus(Duration.ofDays(400)), NOW.minus(Duration.ofDays(1)));

        TlsAudit audit = auditor.audit(features("https://example.com"), expired, ALL_HEADERS);

        assertEquals(List.of("certificate_expired"), audit.flags());
    }

    @Test
    void shouldFlagExpiringSoonAndVeryNewCertificate() {
        CertificateInfo fresh = validCertificate(NOW.minus(Duration.ofDays(2)), NOW.plus(Duration.ofDays(10)));

        TlsAudit audit = auditor.audit(features("https://example.com"), fresh, ALL_HEADERS);

        assertEquals(List.of("certificate_expiring_soon", "very_new_certificate"), audit.flags());
        assertEquals(45, audit.riskScore());
    }

    @Test
    void shouldFlagCertificateNotYetValid() {
        CertificateInfo future = validCertificate(NOW.plus(Duration.ofDays(3)), NOW.plus(Duration.ofDays(90)));

        TlsAudit audit = auditor.audit(features("https://example.com"), future, ALL_HEADERS);

        assertTrue(audit.flags().contains("certificate_not_yet_valid"));
    }

    @Test
    void shouldFlagMissingSecurityHeaders() {
        TlsAudit.SecurityHeaders none = new TlsAudit.SecurityHeaders(false, false, false, false, false);

        TlsAudit audit = auditor.audit(features("https://example.com"), certificate, none);

        assertEquals(List.of("missing_hsts", "missing_csp", "missing_x_frame_options",
                "missing_x_content_type_options"), audit.flags());
        assertEquals(60, audit.riskScore());
    }

    @Test
    void shouldReadHeadersFromSharedPage() {
        UrlFeatures features = features("https://example.com");
        PageSnapshot page = new PageSnapshot(features.fullUrl(), 200, Map.of(
                "strict-transport-security", "max-age=31536000",
                "content-security-policy", "default-src 'self'",
                "x-frame-options", "DENY",
                "x-content-type-options", "nosniff"), "", false);

        StepVerifier.create(auditor.collect(features, Mono.just(page)))
                .assertNext(result -> {
                    TlsAudit audit = result.value().orElseThrow();
                    assertTrue(audit.flags().isEmpty());
                    assertEquals(1.0, ((SignalResult.Available<TlsAudit>) result).confidence());
                })
                .verifyComplete();
    }

    @Test
    void shouldLowerConfidenceWhenPageUnavailable() {
        StepVerifier.create(auditor.collect(features("https://example.com"), Mono.error(new ConnectException())))
                .assertNext(result -> {
                    assertNull(result.value().orElseThrow().securityHeaders());
                    assertEquals(0.6, ((SignalResult.Available<TlsAudit>) result).confidence());
                })
                .verifyComplete();
    }

    @Test
    void shouldBeUnavailableWhenEndpointUnreachable() {
        TlsAuditor unreachable = new TlsAuditor((host, port, timeout) -> {
            throw new ConnectException("Connection refused");
        }, new PageFetcher(WebClient.builder(), config), config, Clock.fixed(NOW, ZoneOffset.UTC));

        StepVerifier.create(unreachable.collect(features("https://example.com"), Mono.empty()))
                .assertNext(result -> {
                    assertFalse(result.isAvailable());
                    assertEquals("Connection refused", ((SignalResult.Unavailable<TlsAudit>) result).reason());
                })
                .verifyComplete();
    }

    private UrlFeatures features(String url) {
        return extractor.extract(url);
    }

    private static CertificateInfo validCertificate(Instant from, Instant to) {
        return new CertificateInfo(true, "CN=Test CA", from, to, List.of("example.com"), null);
    }
}
