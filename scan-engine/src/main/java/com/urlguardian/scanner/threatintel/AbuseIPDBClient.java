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
import java.util.Optional;

/**
 * AbuseIPDB API v2 client for IP reputation lookups.
 *
 * @see <a href="https://docs.abuseipdb.com/">AbuseIPDB API v2</a>
 * @author URL Guardian Team
 */
@Component
public class AbuseIPDBClient {

    private static final Logger log = LoggerFactory.getLogger(AbuseIPDBClient.class);

    private final WebClient webClient;
    private final ThreatIntelConfig.Provider config;
    private final ObjectMapper objectMapper;

    public AbuseIPDBClient(ThreatIntelConfig threatIntelConfig, ObjectMapper objectMapper,
            WebClient.Builder webClientBuilder) {
        this.config = threatIntelConfig.getAbuseIpDb();
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader("Key", config.getApiKey())
                .defaultHeader("Accept", "application/json")
                .build();
    }

    /**
     * Check an IP address against the AbuseIPDB database.
     *
     * @param ipAddress the IP address to check
     * @return the report, empty when the client is not configured or the
     *         lookup failed
     */
    public Mono<Optional<AbuseReport>> checkIp(String ipAddress) {
        if (!config.hasApiKey()) {
            return Mono.just(Optional.empty());
        }
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/check")
                        .queryParam("ipAddress", ipAddress)
                        .queryParam("maxAgeInDays", "90")
                        .queryParam("verbose", "true")
                        .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(config.getTimeoutMs()))
                .map(this::parseResponse)
                .onErrorResume(e -> {
                    log.warn("AbuseIPDB check failed for {}: {}", ipAddress, e.getMessage());
                    return Mono.just(Optional.empty());
                });
    }

    Optional<AbuseReport> parseResponse(String body) {
        try {
            JsonNode data = objectMapper.readTree(body).path("data");
            if (data.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(new AbuseReport(
                    data.path("abuseConfidenceScore").asInt(0),
                    data.path("totalReports").asInt(0),
                    data.path("countryCode").asText("unknown"),
                    data.path("isp").asText("unknown"),
                    data.path("usageType").asText("unknown"),
                    data.path("isWhitelisted").asBoolean(false),
                    data.path("isTor").asBoolean(false)));
        } catch (Exception e) {
            log.error("Failed to parse AbuseIPDB response: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
