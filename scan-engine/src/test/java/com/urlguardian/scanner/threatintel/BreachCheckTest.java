package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.config.ThreatIntelConfig;
import com.urlguardian.scanner.signal.SignalResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BreachCheckTest {

    private static final Instant NOW = Instant.parse("2024-06-15T00:00:00Z");

    private ThreatIntelConfig threatIntelConfig;
    private BreachCheck breachCheck;

    @BeforeEach
    void setUp() {
        threatIntelConfig = new ThreatIntelConfig();
        breachCheck = breachCheckWith(WebClient.builder());
    }

    @Test
    void shouldScoreBreachHistory() {
        BreachReport report = breachCheck.parse("a***@example.com", """
                [
                  {"Name": "Adobe", "Title": "Adobe", "Domain": "adobe.com", "BreachDate": "2013-10-04",
                   "PwnCount": 152445165, "DataClasses": ["Email addresses", "Passwords", "Password hints"],
                   "IsVerified": true, "IsSensitive": false},
                  {"Name": "ShopX", "Title": "Shop X", "Domain": "shopx.example", "BreachDate": "2024-02-10",
                   "PwnCount": 1000, "DataClasses": ["Email addresses", "Credit cards"],
                   "IsVerified": true, "IsSensitive": true}
                ]
                """);

        assertEquals(2, report.totalBreaches());
        assertEquals(152446165L, report.totalPwnCount());
        assertEquals(LocalDate.of(2024, 2, 10), report.breaches().get(1).breachDate());
        assertTrue(report.passwordsExposed());
        assertTrue(report.financialDataExposed());
        assertEquals(List.of("low_breach_count", "recent_breaches", "sensitive_data_exposed", "passwords_exposed",
                "financial_data_exposed"), report.flags());
        assertEquals(100, report.riskScore());
    }

    @Test
    void shouldReportCleanForNoBreaches() {
        BreachReport report = breachCheck.parse("a***@example.com", "[]");

        assertEquals(0, report.totalBreaches());
        assertTrue(report.flags().isEmpty());
        assertEquals(0, report.riskScore());
    }

    @Test
    void shouldRejectMalformedEmailBeforeLookup() {
        assertThrows(InvalidEmailException.class, () -> breachCheck.collect("not-an-email"));
        assertThrows(InvalidEmailException.class, () -> breachCheck.collect(" "));
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        StepVerifier.create(breachCheck.collect("alice@example.com"))
                .assertNext(result -> assertEquals("HIBP API key not configured",
                        ((SignalResult.Unavailable<BreachReport>) result).reason()))
                .verifyComplete();
    }

    @Test
    void shouldTreatNotFoundAsNoBreaches() {
        threatIntelConfig.getHibp().setApiKey("test-key");
        BreachCheck keyed = breachCheckWith(WebClient.builder().exchangeFunction(request -> {
            assertEquals("test-key", request.headers().getFirst("hibp-api-key"));
            return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
        }));

        StepVerifier.create(keyed.collect("alice@example.com"))
                .assertNext(result -> {
                    BreachReport report = result.value().orElseThrow();
                    assertEquals("a***@example.com", report.email());
                    assertEquals(0, report.totalBreaches());
                })
                .verifyComplete();
    }

    @Test
    void shouldMaskEmailAddresses() {
        assertEquals("a***@example.com", EmailAddresses.mask("alice@example.com"));
        assertEquals("***", EmailAddresses.mask("@example.com"));
        assertEquals("bob@example.org", EmailAddresses.requireValid("  bob@example.org "));
    }

    private BreachCheck breachCheckWith(WebClient.Builder builder) {
        return new BreachCheck(threatIntelConfig, new ScannerConfig(), new ObjectMapper(), builder,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
