package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.config.ThreatIntelConfig;
import com.urlguardian.scanner.feature.HeuristicDictionary;
import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.signal.CollectorGuard;
import com.urlguardian.scanner.signal.SignalResult;
import com.urlguardian.scanner.signal.SignalSource;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Domain registration lookup over RDAP.
 *
 * @see <a href="https://about.rdap.org/">RDAP</a>
 * @author URL Guardian Team
 */
@Component
public class WhoisCheck {

    private static final String UNKNOWN = "Unknown";

    private final WebClient webClient;
    private final ThreatIntelConfig.Provider rdapConfig;
    private final ScannerConfig config;
    private final HeuristicDictionary dictionary;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WhoisCheck(ThreatIntelConfig threatIntelConfig, ScannerConfig config, HeuristicDictionary dictionary,
            ObjectMapper objectMapper, WebClient.Builder webClientBuilder, Clock clock) {
        this.rdapConfig = threatIntelConfig.getRdap();
        this.config = config;
        this.dictionary = dictionary;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.webClient = webClientBuilder
                .baseUrl(rdapConfig.getBaseUrl())
                .defaultHeader("Accept", "application/rdap+json, application/json")
                .build();
    }

    public Mono<SignalResult<WhoisData>> collect(UrlFeatures features) {
        if (features.isIp()) {
            return Mono.just(SignalResult.unavailable(SignalSource.WHOIS, "host is an IP literal"));
        }
        Mono<SignalResult<WhoisData>> call = webClient.get()
                .uri("/domain/{domain}", features.domain())
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(rdapConfig.getTimeoutMs()))
                .map(body -> {
                    WhoisData data = parse(features.domain(), body);
                    double confidence = data.createdDate() == null ? 0.5 : 1.0;
                    return SignalResult.available(SignalSource.WHOIS, data, confidence);
                });
        return CollectorGuard.guard(SignalSource.WHOIS, call, config.collectorTimeout());
    }

    WhoisData parse(String domain, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new UncheckedIOException("Unparseable RDAP response", e);
        }

        Instant created = eventDate(root, "registration");
        Instant updated = eventDate(root, "last changed");
        Instant expiry = eventDate(root, "expiration");
        String registrar = entityName(root, "registrar");
        String registrant = entityName(root, "registrant");

        List<String> flags = new ArrayList<>();
        int score = 0;
        long ageInDays = -1;
        ScannerConfig.Whois thresholds = config.getWhois();

        if (created != null) {
            ageInDays = Duration.between(created, clock.instant()).toDays();
            if (ageInDays < thresholds.getNewDomainDays()) {
                flags.add("newly_registered_domain");
                score += 40;
            } else if (ageInDays < thresholds.getRecentDomainDays()) {
                flags.add("recently_registered_domain");
                score += 20;
            } else if (ageInDays < thresholds.getYoungDomainDays()) {
                flags.add("domain_less_than_1_year");
                score += 10;
            }
        }

        String registrantLower = registrant.toLowerCase(Locale.ROOT);
        if (dictionary.whois().privacyMarkers().stream().anyMatch(registrantLower::contains)) {
            flags.add("privacy_protected_registrant");
            score += 15;
        }
        String registrarLower = registrar.toLowerCase(Locale.ROOT);
        if (dictionary.whois().registrarWatchlist().stream().anyMatch(registrarLower::contains)) {
            flags.add("common_phishing_registrar");
            score += 10;
        }

        return new WhoisData(domain, registrar, registrant, created, updated, expiry, ageInDays, flags,
                Math.min(score, 100));
    }

    private static Instant eventDate(JsonNode root, String action) {
        for (JsonNode event : root.path("events")) {
            if (action.equals(event.path("eventAction").asText())) {
                try {
                    return OffsetDateTime.parse(event.path("eventDate").asText()).toInstant();
                } catch (DateTimeParseException e) {
                    return null;
                }
            }
        }
        return null;
    }

    /** The vCard {@code fn} property of the first entity holding the role. */
    private static String entityName(JsonNode root, String role) {
        for (JsonNode entity : root.path("entities")) {
            for (JsonNode r : entity.path("roles")) {
                if (role.equals(r.asText())) {
                    for (JsonNode property : entity.path("vcardArray").path(1)) {
                        if ("fn".equals(property.path(0).asText())) {
                            return property.path(3).asText(UNKNOWN);
                        }
                    }
                }
            }
        }
        return UNKNOWN;
    }
}
