package com.urlguardian.scanner.scan;

import com.urlguardian.scanner.collector.FormInspector;
import com.urlguardian.scanner.collector.PageContentScanner;
import com.urlguardian.scanner.collector.PageFetcher;
import com.urlguardian.scanner.collector.PageSnapshot;
import com.urlguardian.scanner.collector.RedirectAnalyzer;
import com.urlguardian.scanner.collector.TlsAuditor;
import com.urlguardian.scanner.collector.UrlStructureAnalyzer;
import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.feature.UrlFeatureExtractor;
import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.incident.IncidentReport;
import com.urlguardian.scanner.incident.IncidentService;
import com.urlguardian.scanner.metrics.ScannerMetrics;
import com.urlguardian.scanner.policy.CategoryClassifier;
import com.urlguardian.scanner.policy.Classification;
import com.urlguardian.scanner.risk.RiskAggregator;
import com.urlguardian.scanner.risk.RiskAssessment;
import com.urlguardian.scanner.signal.RiskSignal;
import com.urlguardian.scanner.signal.SignalResult;
import com.urlguardian.scanner.signal.SignalSource;
import com.urlguardian.scanner.threatintel.BreachCheck;
import com.urlguardian.scanner.threatintel.EmailAddresses;
import com.urlguardian.scanner.threatintel.IpRiskProfiler;
import com.urlguardian.scanner.threatintel.ReputationLookup;
import com.urlguardian.scanner.threatintel.WhoisCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs the full pipeline: feature extraction, concurrent collectors,
 * aggregation, classification and incident persistence.
 *
 * <p>
 * All collectors start together and the aggregator waits until each has
 * settled; a collector that fails or times out arrives as
 * {@link SignalResult.Unavailable}. The page is fetched once and shared by
 * the page-content, form and TLS collectors. If the global deadline passes,
 * the pending collectors are cancelled and the scan fails with
 * {@link ScanDeadlineExceededException}.
 * </p>
 *
 * @author URL Guardian Team
 */
@Service
public class ComprehensiveScanService {

    private static final Logger log = LoggerFactory.getLogger(ComprehensiveScanService.class);

    static final String BREACH_NOT_REQUESTED = "not requested";

    private final UrlFeatureExtractor extractor;
    private final UrlStructureAnalyzer structureAnalyzer;
    private final RedirectAnalyzer redirectAnalyzer;
    private final PageFetcher pageFetcher;
    private final PageContentScanner pageContentScanner;
    private final FormInspector formInspector;
    private final TlsAuditor tlsAuditor;
    private final ReputationLookup reputationLookup;
    private final WhoisCheck whoisCheck;
    private final IpRiskProfiler ipRiskProfiler;
    private final BreachCheck breachCheck;
    private final RiskAggregator aggregator;
    private final CategoryClassifier classifier;
    private final IncidentService incidentService;
    private final ScannerMetrics metrics;
    private final ScannerConfig config;

    public ComprehensiveScanService(UrlFeatureExtractor extractor, UrlStructureAnalyzer structureAnalyzer,
            RedirectAnalyzer redirectAnalyzer, PageFetcher pageFetcher, PageContentScanner pageContentScanner,
            FormInspector formInspector, TlsAuditor tlsAuditor, ReputationLookup reputationLookup,
            WhoisCheck whoisCheck, IpRiskProfiler ipRiskProfiler, BreachCheck breachCheck,
            RiskAggregator aggregator, CategoryClassifier classifier, IncidentService incidentService,
            ScannerMetrics metrics, ScannerConfig config) {
        this.extractor = extractor;
        this.structureAnalyzer = structureAnalyzer;
        this.redirectAnalyzer = redirectAnalyzer;
        this.pageFetcher = pageFetcher;
        this.pageContentScanner = pageContentScanner;
        this.formInspector = formInspector;
        this.tlsAuditor = tlsAuditor;
        this.reputationLookup = reputationLookup;
        this.whoisCheck = whoisCheck;
        this.ipRiskProfiler = ipRiskProfiler;
        this.breachCheck = breachCheck;
        this.aggregator = aggregator;
        this.classifier = classifier;
        this.incidentService = incidentService;
        this.metrics = metrics;
        this.config = config;
    }

    /**
     * Full scan with persistence.
     *
     * @param email optional address for the breach check, may be null
     */
    public Mono<SecurityScanData> scan(String rawUrl, String email) {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            UrlFeatures features = extractor.extract(rawUrl);
            log.info("Comprehensive scan started for {}", features.fullUrl());
            return assess(features, email)
                    .flatMap(result -> persist(result, Map.of("source", "comprehensive-scan"))
                            .map(report -> SecurityScanData.of(result, report)))
                    .doOnNext(data -> {
                        metrics.scanCompleted(data.riskScore().verdict(),
                                Duration.ofNanos(System.nanoTime() - started));
                        log.info("Comprehensive scan finished for {}: score={} verdict={} incident={}",
                                data.url(), data.riskScore().overallScore(),
                                data.riskScore().verdict().wireName(), data.incidentId());
                    });
        });
    }

    /** Assessment and classification of a URL without persistence. */
    public Mono<ScanResult> assess(String rawUrl) {
        return Mono.defer(() -> assess(extractor.extract(rawUrl), null));
    }

    /** Full scan persisted as an incident carrying caller metadata. */
    public Mono<IncidentReport> generateIncident(String rawUrl, Map<String, String> metadata) {
        return assess(rawUrl).flatMap(result -> {
            Map<String, String> merged = new HashMap<>();
            if (metadata != null) {
                merged.putAll(metadata);
            }
            merged.putIfAbsent("source", "generate-incident-report");
            return persist(result, merged);
        });
    }

    Mono<ScanResult> assess(UrlFeatures features, String email) {
        String breachEmail = email == null || email.isBlank() ? null : EmailAddresses.requireValid(email);
        Duration deadline = config.scanDeadline();

        return collectAll(features, breachEmail)
                .timeout(deadline)
                .onErrorMap(TimeoutException.class,
                        e -> new ScanDeadlineExceededException(features.fullUrl(), deadline, e))
                .map(signals -> {
                    signals.stream()
                            .filter(s -> s instanceof SignalResult.Unavailable<?> u
                                    && !BREACH_NOT_REQUESTED.equals(u.reason()))
                            .forEach(s -> metrics.collectorUnavailable(s.source()));
                    RiskAssessment assessment = aggregator.aggregate(signals);
                    Classification classification = classifier.classify(features, assessment);
                    return new ScanResult(features, signals, assessment, classification);
                });
    }

    private Mono<List<SignalResult<? extends RiskSignal>>> collectAll(UrlFeatures features, String email) {
        // shared by three collectors; cancelled once the last of them gives up
        Mono<PageSnapshot> page = pageFetcher.fetch(features.fullUrl()).share();

        // invocation order fixes red-flag order
        List<Mono<? extends SignalResult<? extends RiskSignal>>> calls = new ArrayList<>();
        calls.add(Mono.fromSupplier(() -> structureAnalyzer.analyze(features)));
        calls.add(redirectAnalyzer.collect(features));
        calls.add(pageContentScanner.collect(features, page));
        calls.add(formInspector.collect(features, page));
        calls.add(tlsAuditor.collect(features, page));
        calls.add(reputationLookup.collect(features));
        calls.add(whoisCheck.collect(features));
        calls.add(ipRiskProfiler.collect(features));
        calls.add(email == null
                ? Mono.just(SignalResult.unavailable(SignalSource.BREACH, BREACH_NOT_REQUESTED))
                : breachCheck.collect(email));

        return Flux.fromIterable(calls)
                .<SignalResult<? extends RiskSignal>>flatMapSequential(call -> call, calls.size())
                .collectList();
    }

    private Mono<IncidentReport> persist(ScanResult result, Map<String, String> metadata) {
        return Mono.fromCallable(() -> incidentService.record(result.features().fullUrl(), result.assessment(),
                        result.classification(), metadata))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
