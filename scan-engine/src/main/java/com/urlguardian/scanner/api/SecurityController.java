package com.urlguardian.scanner.api;

import com.urlguardian.scanner.collector.FormInspection;
import com.urlguardian.scanner.collector.FormInspector;
import com.urlguardian.scanner.collector.PageContentAnalysis;
import com.urlguardian.scanner.collector.PageContentScanner;
import com.urlguardian.scanner.collector.RedirectAnalysis;
import com.urlguardian.scanner.collector.RedirectAnalyzer;
import com.urlguardian.scanner.collector.TlsAudit;
import com.urlguardian.scanner.collector.TlsAuditor;
import com.urlguardian.scanner.feature.UrlFeatureExtractor;
import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.incident.FeedbackRecord;
import com.urlguardian.scanner.incident.FeedbackService;
import com.urlguardian.scanner.incident.FeedbackStats;
import com.urlguardian.scanner.incident.IncidentReport;
import com.urlguardian.scanner.incident.IncidentService;
import com.urlguardian.scanner.policy.Classification;
import com.urlguardian.scanner.policy.PolicyCheck;
import com.urlguardian.scanner.policy.PolicyEvaluator;
import com.urlguardian.scanner.risk.RiskAssessment;
import com.urlguardian.scanner.scan.ComprehensiveScanService;
import com.urlguardian.scanner.scan.ScanResult;
import com.urlguardian.scanner.scan.SecurityScanData;
import com.urlguardian.scanner.scan.UrlAnalysis;
import com.urlguardian.scanner.scan.UrlAnalysisService;
import com.urlguardian.scanner.signal.SignalResult;
import com.urlguardian.scanner.threatintel.BreachCheck;
import com.urlguardian.scanner.threatintel.BreachReport;
import com.urlguardian.scanner.threatintel.IpRiskProfile;
import com.urlguardian.scanner.threatintel.IpRiskProfiler;
import com.urlguardian.scanner.threatintel.ReputationCheck;
import com.urlguardian.scanner.threatintel.ReputationLookup;
import com.urlguardian.scanner.threatintel.WhoisCheck;
import com.urlguardian.scanner.threatintel.WhoisData;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * HTTP surface of the pipeline. Each layer's collectors and services are
 * exposed individually; {@code comprehensive-scan} runs all of them.
 *
 * @author URL Guardian Team
 */
@RestController
@RequestMapping("/security")
public class SecurityController {

    private final UrlFeatureExtractor extractor;
    private final RedirectAnalyzer redirectAnalyzer;
    private final PageContentScanner pageContentScanner;
    private final FormInspector formInspector;
    private final TlsAuditor tlsAuditor;
    private final ReputationLookup reputationLookup;
    private final WhoisCheck whoisCheck;
    private final IpRiskProfiler ipRiskProfiler;
    private final BreachCheck breachCheck;
    private final PolicyEvaluator policyEvaluator;
    private final ComprehensiveScanService scanService;
    private final UrlAnalysisService urlAnalysisService;
    private final IncidentService incidentService;
    private final FeedbackService feedbackService;

    public SecurityController(UrlFeatureExtractor extractor, RedirectAnalyzer redirectAnalyzer,
            PageContentScanner pageContentScanner, FormInspector formInspector, TlsAuditor tlsAuditor,
            ReputationLookup reputationLookup, WhoisCheck whoisCheck, IpRiskProfiler ipRiskProfiler,
            BreachCheck breachCheck, PolicyEvaluator policyEvaluator, ComprehensiveScanService scanService,
            UrlAnalysisService urlAnalysisService, IncidentService incidentService,
            FeedbackService feedbackService) {
        this.extractor = extractor;
        this.redirectAnalyzer = redirectAnalyzer;
        this.pageContentScanner = pageContentScanner;
        this.formInspector = formInspector;
        this.tlsAuditor = tlsAuditor;
        this.reputationLookup = reputationLookup;
        this.whoisCheck = whoisCheck;
        this.ipRiskProfiler = ipRiskProfiler;
        this.breachCheck = breachCheck;
        this.policyEvaluator = policyEvaluator;
        this.scanService = scanService;
        this.urlAnalysisService = urlAnalysisService;
        this.incidentService = incidentService;
        this.feedbackService = feedbackService;
    }

    // Layer A

    @PostMapping("/analyze-redirects")
    public Mono<SignalResult<RedirectAnalysis>> analyzeRedirects(@RequestBody ScanRequests.UrlRequest request) {
        return Mono.defer(() -> redirectAnalyzer.collect(features(request.url())));
    }

    @PostMapping("/scan-page-content")
    public Mono<SignalResult<PageContentAnalysis>> scanPageContent(@RequestBody ScanRequests.UrlRequest request) {
        return Mono.defer(() -> pageContentScanner.collect(features(request.url())));
    }

    @PostMapping("/inspect-forms")
    public Mono<SignalResult<FormInspection>> inspectForms(@RequestBody ScanRequests.UrlRequest request) {
        return Mono.defer(() -> formInspector.collect(features(request.url())));
    }

    @PostMapping("/audit-tls")
    public Mono<SignalResult<TlsAudit>> auditTls(@RequestBody ScanRequests.UrlRequest request) {
        return Mono.defer(() -> tlsAuditor.collect(features(request.url())));
    }

    // Layer B

    @PostMapping("/lookup-reputation")
    public Mono<SignalResult<ReputationCheck>> lookupReputation(@RequestBody ScanRequests.UrlRequest request) {
        return Mono.defer(() -> reputationLookup.collect(features(request.url())));
    }

    @PostMapping("/check-whois")
    public Mono<SignalResult<WhoisData>> checkWhois(@RequestBody ScanRequests.UrlRequest request) {
        return Mono.defer(() -> whoisCheck.collect(features(request.url())));
    }

    @PostMapping("/ip-risk-profile")
    public Mono<SignalResult<IpRiskProfile>> ipRiskProfile(@RequestBody ScanRequests.UrlRequest request) {
        return Mono.defer(() -> ipRiskProfiler.collect(features(request.url())));
    }

    @PostMapping("/breach-check")
    public Mono<SignalResult<BreachReport>> breachCheck(@RequestBody ScanRequests.EmailRequest request) {
        return Mono.defer(() -> breachCheck.collect(request.email()));
    }

    // Layer C

    @PostMapping("/classify-category")
    public Mono<Classification> classifyCategory(@RequestBody ScanRequests.UrlRequest request) {
        return scanService.assess(request.url()).map(ScanResult::classification);
    }

    @PostMapping("/check-policy")
    public Mono<PolicyCheck> checkPolicy(@RequestBody ScanRequests.PolicyRequest request) {
        return scanService.assess(request.url())
                .map(result -> policyEvaluator.checkPolicy(result.features(), request.policyProfileId(),
                        result.classification()));
    }

    @PostMapping("/calculate-risk-score")
    public Mono<RiskAssessment> calculateRiskScore(@RequestBody ScanRequests.UrlRequest request) {
        return scanService.assess(request.url()).map(ScanResult::assessment);
    }

    // Layer D

    @PostMapping("/generate-incident-report")
    public Mono<IncidentReport> generateIncidentReport(@RequestBody ScanRequests.IncidentRequest request) {
        return scanService.generateIncident(request.url(), request.metadata());
    }

    @PostMapping("/submit-feedback")
    public Mono<FeedbackRecord> submitFeedback(@RequestBody ScanRequests.FeedbackRequest request) {
        return Mono.fromCallable(() -> feedbackService.recordFeedback(
                        request.incidentId(), request.judgment(), request.comment()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/feedback-stats")
    public Mono<FeedbackStats> feedbackStats() {
        return Mono.fromCallable(feedbackService::computeStats)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/recent-incidents")
    public Mono<List<IncidentReport>> recentIncidents(@RequestParam(defaultValue = "10") int limit) {
        return Mono.fromCallable(() -> incidentService.recent(limit))
                .subscribeOn(Schedulers.boundedElastic());
    }

    // Full pipeline

    @PostMapping("/comprehensive-scan")
    public Mono<SecurityScanData> comprehensiveScan(@RequestBody ScanRequests.ScanRequest request) {
        return scanService.scan(request.url(), request.email());
    }

    @PostMapping("/analyze-url")
    public Mono<UrlAnalysis> analyzeUrl(@RequestBody ScanRequests.UrlRequest request) {
        return Mono.fromCallable(() -> urlAnalysisService.analyze(request.url()));
    }

    private UrlFeatures features(String url) {
        return extractor.extract(url);
    }
}
