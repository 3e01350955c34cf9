package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlguardian.scanner.config.ThreatIntelConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class VirusTotalClientTest {

    private ThreatIntelConfig config;
    private VirusTotalClient client;

    @BeforeEach
    void setUp() {
        config = new ThreatIntelConfig();
        client = new VirusTotalClient(config, new ObjectMapper(), WebClient.builder());
    }

    @Test
    void shouldEncodeUrlIdWithoutPadding() {
        assertEquals("aHR0cHM6Ly9leGFtcGxlLmNvbS8", VirusTotalClient.urlId("https://example.com/"));
    }

    @Test
    void shouldVoteMaliciousOnAnyMaliciousEngine() {
        SourceVote vote = client.parseUrlResponse(analysis(3, 1, 60, 10));

        assertEquals(SourceVote.Status.MALICIOUS, vote.status());
        assertEquals(70, vote.score());
        assertEquals(74, vote.details().get("total_engines"));
    }

    @Test
    void shouldVoteSuspiciousWithoutMaliciousEngines() {
        SourceVote vote = client.parseUrlResponse(analysis(0, 2, 60, 10));

        assertEquals(SourceVote.Status.SUSPICIOUS, vote.status());
        assertEquals(40, vote.score());
    }

    @Test
    void shouldVoteCleanWhenNoEngineFlags() {
        assertEquals(SourceVote.Status.CLEAN, client.parseUrlResponse(analysis(0, 0, 70, 5)).status());
    }

    @Test
    void shouldVoteUnknownOnGarbage() {
        assertEquals(SourceVote.Status.UNKNOWN, client.parseUrlResponse("<html>").status());
    }

    @Test
    void shouldSkipLookupWithoutApiKey() {
        StepVerifier.create(client.lookupUrl("https://example.com/"))
                .assertNext(vote -> {
                    assertEquals(SourceVote.Status.UNKNOWN, vote.status());
                    assertEquals("not configured", vote.details().get("reason"));
                })
                .verifyComplete();
    }

    @Test
    void shouldTreatNotFoundAsUnknown() {
        config.getVirusTotal().setApiKey("test-key");
        VirusTotalClient keyed = new VirusTotalClient(config, new ObjectMapper(), WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build())));

        StepVerifier.create(keyed.lookupUrl("https://example.com/"))
                .assertNext(vote -> assertEquals(SourceVote.Status.UNKNOWN, vote.status()))
                .verifyComplete();
    }

    @Test
    void shouldSendApiKeyHeader() {
        config.getVirusTotal().setApiKey("test-key");
        VirusTotalClient keyed = new VirusTotalClient(config, new ObjectMapper(), WebClient.builder()
                .exchangeFunction(request -> {
                    assertEquals("test-key", request.headers().getFirst("x-apikey"));
                    assertTrue(request.url().getPath().endsWith("/urls/aHR0cHM6Ly9leGFtcGxlLmNvbS8"));
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header("Content-Type", "application/json")
                            .body(analysis(1, 0, 0, 0))
                            .build());
                }));

        StepVerifier.create(keyed.lookupUrl("https://example.com/"))
                .assertNext(vote -> assertEquals(SourceVote.Status.MALICIOUS, vote.status()))
                .verifyComplete();
    }

    private static String analysis(int malicious, int suspicious, int harmless, int undetected) {
        return """
                {"data": {"attributes": {"reputation": -5, "last_analysis_stats": {
                  "malicious": %d, "suspicious": %d, "harmless": %d, "undetected": %d}}}}
                """.formatted(malicious, suspicious, harmless, undetected);
    }
}
