package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlguardian.scanner.config.ThreatIntelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Google Safe Browsing v4 Lookup API client.
 *
 * @see <a href="https://developers.google.com/safe-browsing/v4/lookup-api">Safe
 *      Browsing Lookup API</a>
 * @author URL Guardian Team
 */
@Component
public class SafeBrowsingClient {

    private static final Logger log = LoggerFactory.getLogger(SafeBrowsingClient.class);

    static final String SOURCE = "Google Safe Browsing";

    private final WebClient webClient;
    private final ThreatIntelConfig.Provider config;
    private final ObjectMapper objectMapper;

    public SafeBrowsingClient(ThreatIntelConfig threatIntelConfig, ObjectMapper objectMapper,
            WebClient.Builder webClientBuilder) {
        this.config = threatIntelConfig.getSafeBrowsing();
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    public Mono<SourceVote> lookupUrl(String url) {
        if (!config.hasApiKey()) {
            return Mono.just(SourceVote.unknown(SOURCE, "not configured"));
        }
        Map<String, Object> request = Map.of(
                "client", Map.of("clientId", "url-guardian", "clientVersion", "1.0.0"),
                "threatInfo", Map.of(
                        "threatTypes", List.of("MALWARE", "SOCIAL_ENGINEERING", "UNWANTED_SOFTWARE"),
                        "platformTypes", List.of("ANY_PLATFORM"),
                        "threatEntryTypes", List.of("URL"),
                        "threatEntries", List.of(Map.of("url", url))));

        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/threatMatches:find")
                        .queryParam("key", config.getApiKey())
                        .build())
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("{}")
                .timeout(Duration.ofMillis(config.getTimeoutMs()))
                .map(this::parseResponse)
                .onErrorResume(e -> {
                    log.warn("Safe Browsing lookup failed for {}: {}", url, e.getMessage());
                    return Mono.just(SourceVote.unknown(SOURCE, e.getMessage()));
                });
    }

    SourceVote parseResponse(String body) {
        try {
            JsonNode matches = objectMapper.readTree(body).path("matches");
            if (!matches.isArray() || matches.isEmpty()) {
                return SourceVote.clean(SOURCE);
            }
            String threatType = matches.get(0).path("threatType").asText("UNKNOWN");
            return SourceVote.malicious(SOURCE, 80, Map.of(
                    "threat_type", threatType,
                    "match_count", matches.size()));
        } catch (Exception e) {
            log.error("Failed to parse Safe Browsing response: {}", e.getMessage());
            return SourceVote.unknown(SOURCE, "unparseable response");
        }
    }
}
