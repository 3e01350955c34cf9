package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlguardian.scanner.config.ThreatIntelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * VirusTotal API v3 client for URL reports.
 *
 * @see <a href="https://docs.virustotal.com/reference/url-info">VirusTotal URL
 *      report</a>
 * @author URL Guardian Team
 */
@Component
public class VirusTotalClient {

    private static final Logger log = LoggerFactory.getLogger(VirusTotalClient.class);

    static final String SOURCE = "VirusTotal";

    private final WebClient webClient;
    private final ThreatIntelConfig.Provider config;
    private final ObjectMapper objectMapper;

    public VirusTotalClient(ThreatIntelConfig threatIntelConfig, ObjectMapper objectMapper,
            WebClient.Builder webClientBuilder) {
        this.config = threatIntelConfig.getVirusTotal();
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader("x-apikey", config.getApiKey())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    /**
     * Look up the last analysis of a URL.
     *
     * @param url the URL to look up
     * @return the provider vote, {@code unknown} on any failure
     */
    public Mono<SourceVote> lookupUrl(String url) {
        if (!config.hasApiKey()) {
            return Mono.just(SourceVote.unknown(SOURCE, "not configured"));
        }
        return webClient.get()
                .uri("/urls/{id}", urlId(url))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(config.getTimeoutMs()))
                .map(this::parseUrlResponse)
                .onErrorResume(WebClientResponseException.NotFound.class,
                        e -> Mono.just(SourceVote.unknown(SOURCE, "URL not previously analysed")))
                .onErrorResume(e -> {
                    log.warn("VirusTotal URL lookup failed for {}: {}", url, e.getMessage());
                    return Mono.just(SourceVote.unknown(SOURCE, e.getMessage()));
                });
    }

    /** URL identifier: unpadded URL-safe base64 of the URL. */
    static String urlId(String url) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(url.getBytes(StandardCharsets.UTF_8));
    }

    SourceVote parseUrlResponse(String body) {
        try {
            JsonNode attrs = objectMapper.readTree(body).path("data").path("attributes");
            JsonNode lastAnalysis = attrs.path("last_analysis_stats");

            int malicious = lastAnalysis.path("malicious").asInt(0);
            int suspicious = lastAnalysis.path("suspicious").asInt(0);
            int total = malicious + suspicious
                    + lastAnalysis.path("harmless").asInt(0)
                    + lastAnalysis.path("undetected").asInt(0);

            Map<String, Object> details = new HashMap<>();
            details.put("malicious_detections", malicious);
            details.put("suspicious_detections", suspicious);
            details.put("total_engines", total);
            details.put("reputation", attrs.path("reputation").asInt(0));

            if (malicious > 0) {
                return SourceVote.malicious(SOURCE, 70, details);
            }
            if (suspicious > 0) {
                return SourceVote.suspicious(SOURCE, 40, details);
            }
            return new SourceVote(SOURCE, SourceVote.Status.CLEAN, 0, details);

        } catch (Exception e) {
            log.error("Failed to parse VirusTotal URL response: {}", e.getMessage());
            return SourceVote.unknown(SOURCE, "unparseable response");
        }
    }
}
