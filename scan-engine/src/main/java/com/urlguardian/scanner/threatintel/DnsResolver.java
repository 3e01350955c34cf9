package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlguardian.scanner.config.ThreatIntelConfig;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves A records over DNS-over-HTTPS (JSON API).
 *
 * @author URL Guardian Team
 */
@Component
public class DnsResolver {

    private static final int TYPE_A = 1;

    private final WebClient webClient;
    private final ThreatIntelConfig.Provider config;
    private final ObjectMapper objectMapper;

    public DnsResolver(ThreatIntelConfig threatIntelConfig, ObjectMapper objectMapper,
            WebClient.Builder webClientBuilder) {
        this.config = threatIntelConfig.getDns();
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader("Accept", "application/dns-json")
                .build();
    }

    /**
     * Resolve the IPv4 addresses of a host.
     *
     * @return the addresses in answer order, empty if the name has none
     */
    public Mono<List<String>> resolveA(String host) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/resolve")
                        .queryParam("name", host)
                        .queryParam("type", "A")
                        .build())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(config.getTimeoutMs()))
                .map(this::parseAnswers);
    }

    List<String> parseAnswers(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            List<String> addresses = new ArrayList<>();
            for (JsonNode answer : root.path("Answer")) {
                if (answer.path("type").asInt() == TYPE_A) {
                    addresses.add(answer.path("data").asText());
                }
            }
            return addresses;
        } catch (IOException e) {
            throw new UncheckedIOException("Unparseable DNS response", e);
        }
    }
}
