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

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PageContentScannerTest {

    private UrlFeatureExtractor extractor;
    private PageContentScanner scanner;

    @BeforeEach
    void setUp() {
        HeuristicDictionary dictionary = HeuristicDictionary.loadDefault();
        ScannerConfig config = new ScannerConfig();
        extractor = new UrlFeatureExtractor(dictionary);
        scanner = new PageContentScanner(new PageFetcher(WebClient.builder(), config), dictionary, config);
    }

    @Test
    void shouldFlagBrandedLoginPageOnForeignHost() {
        String html = """
                <html><head><title>PayPal - Log in to your account</title></head>
                <body><form action="/auth"><input type="email" name="user">
                <input type="password" name="pw"></form></body></html>
                """;

        PageContentAnalysis analysis = scan("https://secure-verify.tk/", html);

        assertEquals(List.of("login_form_detected", "brand_impersonation_paypal"), analysis.flags());
        assertEquals(50, analysis.riskScore());
        assertEquals(1, analysis.dom().forms());
    }

    @Test
    void shouldNotFlagBrandOnItsOwnDomain() {
        String html = "<html><body><p>Welcome to PayPal</p></body></html>";

        PageContentAnalysis analysis = scan("https://www.paypal.com/", html);

        assertTrue(analysis.flags().isEmpty());
        assertEquals(0, analysis.riskScore());
    }

    @Test
    void shouldFlagKeyloggingAndObfuscatedScript() {
        String html = """
                <html><body>
                <script>document.addEventListener('keydown', e => send(e.key));</script>
                <script>eval(atob('YWxlcnQoMSk='));</script>
                </body></html>
                """;

        PageContentAnalysis analysis = scan("https://example.com/", html);

        assertEquals(List.of("suspicious_javascript_clipboard_keylog", "obfuscated_javascript"), analysis.flags());
        assertEquals(60, analysis.riskScore());
        assertEquals(2, analysis.dom().scripts());
    }

    @Test
    void shouldFlagExcessiveHiddenInputsAndIframes() {
        String html = "<html><body><form>"
                + "<input type=hidden name=a>".repeat(6)
                + "</form>"
                + "<iframe src='https://a.example'></iframe>".repeat(4)
                + "</body></html>";

        PageContentAnalysis analysis = scan("https://example.com/", html);

        assertEquals(List.of("excessive_hidden_inputs", "excessive_iframes"), analysis.flags());
        assertEquals(35, analysis.riskScore());
        assertEquals(4, analysis.dom().iframes());
    }

    @Test
    void shouldCapScoreAtHundred() {
        String html = """
                <html><head><title>Sign in</title></head><body>
                <p>paypal apple google microsoft</p>
                <input type="password"></body></html>
                """;

        assertEquals(100, scan("https://example.com/", html).riskScore());
    }

    @Test
    void shouldDescribeFlagsAsRedFlags() {
        PageContentAnalysis analysis = scan("https://example.com/", "<script>eval(x)</script>");

        assertEquals(List.of("obfuscated javascript"), analysis.redFlags());
    }

    @Test
    void shouldLowerConfidenceForTruncatedPage() {
        UrlFeatures features = extractor.extract("https://example.com/");
        PageSnapshot truncated = new PageSnapshot(features.fullUrl(), 200, Map.of(), "<html>", true);

        StepVerifier.create(scanner.collect(features, Mono.just(truncated)))
                .assertNext(result -> {
                    assertTrue(result.isAvailable());
                    assertEquals(0.8, ((SignalResult.Available<PageContentAnalysis>) result).confidence());
                })
                .verifyComplete();
    }

    @Test
    void shouldBeUnavailableWhenPageCannotBeFetched() {
        UrlFeatures features = extractor.extract("https://unreachable.example/");

        StepVerifier.create(scanner.collect(features, Mono.error(new IOException("connection refused"))))
                .assertNext(result -> {
                    assertFalse(result.isAvailable());
                    assertEquals("connection refused",
                            ((SignalResult.Unavailable<PageContentAnalysis>) result).reason());
                })
                .verifyComplete();
    }

    private PageContentAnalysis scan(String url, String html) {
        UrlFeatures features = extractor.extract(url);
        return scanner.analyze(new PageSnapshot(features.fullUrl(), 200, Map.of(), html, false), features);
    }
}
