package com.urlguardian.scanner.collector;

import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.signal.CollectorGuard;
import com.urlguardian.scanner.signal.SignalResult;
import com.urlguardian.scanner.signal.SignalSource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Audits HTTPS usage, certificate validity and security headers.
 *
 * <p>
 * Plain HTTP is reported as a red flag, not a failure. The collector is
 * unavailable only when an HTTPS endpoint cannot be reached at all.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
public class TlsAuditor {

    private final CertificateProbe certificateProbe;
    private final PageFetcher pageFetcher;
    private final ScannerConfig config;
    private final Clock clock;

    public TlsAuditor(CertificateProbe certificateProbe, PageFetcher pageFetcher, ScannerConfig config,
            Clock clock) {
        this.certificateProbe = certificateProbe;
        this.pageFetcher = pageFetcher;
        this.config = config;
        this.clock = clock;
    }

    public Mono<SignalResult<TlsAudit>> collect(UrlFeatures features) {
        return collect(features, pageFetcher.fetch(features.fullUrl()));
    }

    public Mono<SignalResult<TlsAudit>> collect(UrlFeatures features, Mono<PageSnapshot> page) {
        Duration timeout = config.collectorTimeout();

        Mono<Optional<TlsAudit.SecurityHeaders>> headers = page
                .map(snapshot -> Optional.of(TlsAudit.SecurityHeaders.of(snapshot)))
                .onErrorReturn(Optional.empty())
                .defaultIfEmpty(Optional.empty());

        Mono<Optional<CertificateInfo>> certificate = features.isHttps()
                ? Mono.fromCallable(() -> Optional.of(
                                certificateProbe.probe(features.domain(), config.getTls().getPort(), timeout)))
                        .subscribeOn(Schedulers.boundedElastic())
                : Mono.just(Optional.empty());

        Mono<SignalResult<TlsAudit>> call = Mono.zip(certificate, headers)
                .map(tuple -> {
                    TlsAudit audit = audit(features, tuple.getT1().orElse(null), tuple.getT2().orElse(null));
                    double confidence = audit.securityHeaders() == null ? 0.6 : 1.0;
                    return SignalResult.available(SignalSource.TLS, audit, confidence);
                });
        return CollectorGuard.guard(SignalSource.TLS, call, timeout);
    }

    TlsAudit audit(UrlFeatures features, CertificateInfo certificate, TlsAudit.SecurityHeaders headers) {
        List<String> flags = new ArrayList<>();
        int score = 0;
        long daysUntilExpiry = -1;
        Instant now = clock.instant();

        if (!features.isHttps()) {
            flags.add("no_tls_encryption");
            score += 50;
        } else if (certificate != null) {
            if (!certificate.trusted()) {
                flags.add("invalid_certificate");
                score += 60;
            } else {
                daysUntilExpiry = Duration.between(now, certificate.validTo()).toDays();
                if (certificate.validFrom().isAfter(now)) {
                    flags.add("certificate_not_yet_valid");
                    score += 40;
                }
                if (certificate.validTo().isBefore(now)) {
                    flags.add("certificate_expired");
                    score += 60;
                } else if (daysUntilExpiry < config.getTls().getExpiryWarningDays()) {
                    flags.add("certificate_expiring_soon");
                    score += 25;
                }
                long ageDays = Duration.between(certificate.validFrom(), now).toDays();
                if (ageDays < config.getTls().getNewCertificateDays()) {
                    flags.add("very_new_certificate");
                    score += 20;
                }
            }
        }

        if (headers != null) {
            if (!headers.hsts() && features.isHttps()) {
                flags.add("missing_hsts");
                score += 20;
            }
            if (!headers.csp()) {
                flags.add("missing_csp");
                score += 15;
            }
            if (!headers.xFrameOptions()) {
                flags.add("missing_x_frame_options");
                score += 15;
            }
            if (!headers.xContentTypeOptions()) {
                flags.add("missing_x_content_type_options");
                score += 10;
            }
        }

        return new TlsAudit(features.isHttps(), certificate, daysUntilExpiry, headers, flags, Math.min(score, 100));
    }
}
