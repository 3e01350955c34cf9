package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.config.ThreatIntelConfig;
import com.urlguardian.scanner.signal.CollectorGuard;
import com.urlguardian.scanner.signal.SignalResult;
import com.urlguardian.scanner.signal.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * HaveIBeenPwned v3 breach lookup for an email address.
 *
 * <p>
 * HIBP answers 404 for an address with no breaches, which is reported as an
 * available, clean result.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
public class BreachCheck {

    private static final Logger log = LoggerFactory.getLogger(BreachCheck.class);

    private static final Set<String> FINANCIAL_CLASSES = Set.of(
            "credit cards", "bank account numbers", "partial credit card data", "credit card cvv",
            "financial transactions", "payment histories");

    private final WebClient webClient;
    private final ThreatIntelConfig.Provider hibpConfig;
    private final ScannerConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BreachCheck(ThreatIntelConfig threatIntelConfig, ScannerConfig config, ObjectMapper objectMapper,
            WebClient.Builder webClientBuilder, Clock clock) {
        this.hibpConfig = threatIntelConfig.getHibp();
        this.config = config;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.webClient = webClientBuilder
                .baseUrl(hibpConfig.getBaseUrl())
                .defaultHeader("hibp-api-key", hibpConfig.getApiKey())
                .defaultHeader("User-Agent", config.getUserAgent())
                .build();
    }

    /**
     * @throws InvalidEmailException before any lookup if the address is malformed
     */
    public Mono<SignalResult<BreachReport>> collect(String email) {
        String address = EmailAddresses.requireValid(email);
        String masked = EmailAddresses.mask(address);
        if (!hibpConfig.hasApiKey()) {
            return Mono.just(SignalResult.unavailable(SignalSource.BREACH, "HIBP API key not configured"));
        }
        Mono<SignalResult<BreachReport>> call = webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/breachedaccount/{account}")
                        .queryParam("truncateResponse", "false")
                        .build(address))
                .retrieve()
                .bodyToMono(String.class)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.just("[]"))
                .timeout(Duration.ofMillis(hibpConfig.getTimeoutMs()))
                .map(body -> SignalResult.available(SignalSource.BREACH, parse(masked, body), 1.0))
                .doOnNext(result -> log.info("Breach check complete for {}", masked));
        return CollectorGuard.guard(SignalSource.BREACH, call, config.collectorTimeout());
    }

    BreachReport parse(String maskedEmail, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new UncheckedIOException("Unparseable HIBP response", e);
        }

        List<BreachReport.Breach> breaches = new ArrayList<>();
        for (JsonNode node : root) {
            List<String> dataClasses = new ArrayList<>();
            node.path("DataClasses").forEach(c -> dataClasses.add(c.asText()));
            breaches.add(new BreachReport.Breach(
                    node.path("Name").asText(),
                    node.path("Title").asText(),
                    node.path("Domain").asText(),
                    parseDate(node.path("BreachDate").asText()),
                    node.path("PwnCount").asLong(0),
                    dataClasses,
                    node.path("IsVerified").asBoolean(false),
                    node.path("IsSensitive").asBoolean(false)));
        }

        List<String> flags = new ArrayList<>();
        int score = 0;
        int total = breaches.size();
        if (total > 10) {
            flags.add("high_breach_count");
            score += 60;
        } else if (total > 5) {
            flags.add("moderate_breach_count");
            score += 40;
        } else if (total > 0) {
            flags.add("low_breach_count");
            score += 20;
        }

        LocalDate oneYearAgo = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusYears(1);
        if (breaches.stream().anyMatch(b -> b.breachDate() != null && b.breachDate().isAfter(oneYearAgo))) {
            flags.add("recent_breaches");
            score += 30;
        }
        if (breaches.stream().anyMatch(BreachReport.Breach::sensitive)) {
            flags.add("sensitive_data_exposed");
            score += 25;
        }

        boolean passwords = breaches.stream()
                .flatMap(b -> b.dataClasses().stream())
                .anyMatch(c -> c.equalsIgnoreCase("passwords"));
        boolean financial = breaches.stream()
                .flatMap(b -> b.dataClasses().stream())
                .anyMatch(c -> FINANCIAL_CLASSES.contains(c.toLowerCase(Locale.ROOT)));
        if (passwords) {
            flags.add("passwords_exposed");
            score += 15;
        }
        if (financial) {
            flags.add("financial_data_exposed");
            score += 15;
        }

        long pwnCount = breaches.stream().mapToLong(BreachReport.Breach::pwnCount).sum();
        return new BreachReport(maskedEmail, breaches, total, pwnCount, passwords, financial, flags,
                Math.min(score, 100));
    }

    private static LocalDate parseDate(String text) {
        try {
            return text.isEmpty() ? null : LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
