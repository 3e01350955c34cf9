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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Profiles the IP address behind a URL: geolocation and hosting data from
 * ip-api, abuse history from AbuseIPDB when configured.
 *
 * <p>
 * Hostnames are resolved first; the first A record is profiled. A failed
 * geolocation makes the collector unavailable, a failed AbuseIPDB lookup only
 * lowers its confidence.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
public class IpRiskProfiler {

    private static final String GEO_FIELDS = "status,message,country,countryCode,city,isp,org,as,mobile,proxy,hosting,query";

    private final WebClient webClient;
    private final ThreatIntelConfig.Provider geoConfig;
    private final DnsResolver dnsResolver;
    private final AbuseIPDBClient abuseClient;
    private final HeuristicDictionary dictionary;
    private final ScannerConfig config;
    private final ObjectMapper objectMapper;

    public IpRiskProfiler(ThreatIntelConfig threatIntelConfig, DnsResolver dnsResolver, AbuseIPDBClient abuseClient,
            HeuristicDictionary dictionary, ScannerConfig config, ObjectMapper objectMapper,
            WebClient.Builder webClientBuilder) {
        this.geoConfig = threatIntelConfig.getIpApi();
        this.dnsResolver = dnsResolver;
        this.abuseClient = abuseClient;
        this.dictionary = dictionary;
        this.config = config;
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder.baseUrl(geoConfig.getBaseUrl()).build();
    }

    public Mono<SignalResult<IpRiskProfile>> collect(UrlFeatures features) {
        Mono<List<String>> addresses = features.isIp()
                ? Mono.just(List.of(features.domain()))
                : dnsResolver.resolveA(features.domain());

        Mono<SignalResult<IpRiskProfile>> call = addresses.flatMap(ips -> {
            if (ips.isEmpty()) {
                return Mono.error(new IllegalStateException("no A record for " + features.domain()));
            }
            String ip = ips.get(0);
            return Mono.zip(geolocate(ip), abuseClient.checkIp(ip))
                    .map(tuple -> {
                        IpRiskProfile profile = profile(ip, ips, tuple.getT1(), tuple.getT2().orElse(null));
                        double confidence = tuple.getT2().isPresent() ? 1.0 : 0.7;
                        return SignalResult.available(SignalSource.IP_RISK, profile, confidence);
                    });
        });
        return CollectorGuard.guard(SignalSource.IP_RISK, call, config.collectorTimeout());
    }

    private Mono<JsonNode> geolocate(String ip) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/json/{ip}")
                        .queryParam("fields", GEO_FIELDS)
                        .build(ip))
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofMillis(geoConfig.getTimeoutMs()))
                .map(this::readGeo);
    }

    JsonNode readGeo(String body) {
        JsonNode geo;
        try {
            geo = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new UncheckedIOException("Unparseable geolocation response", e);
        }
        if ("fail".equals(geo.path("status").asText())) {
            throw new IllegalStateException("IP lookup failed: " + geo.path("message").asText("unknown"));
        }
        return geo;
    }

    IpRiskProfile profile(String ip, List<String> resolvedIps, JsonNode geo, AbuseReport abuse) {
        List<String> flags = new ArrayList<>();
        int score = 0;

        String country = geo.path("country").asText("Unknown");
        String as = geo.path("as").asText("");
        int space = as.indexOf(' ');
        String asn = as.isEmpty() ? "Unknown" : space < 0 ? as : as.substring(0, space);
        String asnOrg = space < 0 ? "Unknown" : as.substring(space + 1);
        boolean proxy = geo.path("proxy").asBoolean(false);
        boolean hosting = geo.path("hosting").asBoolean(false);
        String asnOrgLower = asnOrg.toLowerCase(Locale.ROOT);

        HeuristicDictionary.IpRisk lists = dictionary.ipRisk();
        if (lists.highRiskCountries().contains(country)) {
            flags.add("high_risk_country");
            score += 25;
        }
        if (proxy) {
            flags.add("proxy_or_vpn_detected");
            score += 40;
        }
        if (hosting) {
            flags.add("datacenter_ip");
            score += 30;
        }
        if (lists.bulletproofKeywords().stream().anyMatch(asnOrgLower::contains)) {
            flags.add("bulletproof_hosting");
            score += 50;
        }
        if (lists.cloudProviders().stream().anyMatch(asnOrgLower::contains)) {
            flags.add("cloud_hosting");
            score += 15;
        }

        boolean tor = false;
        if (abuse != null && !abuse.whitelisted()) {
            if (abuse.abuseConfidenceScore() > 75) {
                flags.add("high_abuse_score");
                score += 60;
            } else if (abuse.abuseConfidenceScore() > 50) {
                flags.add("moderate_abuse_score");
                score += 40;
            } else if (abuse.abuseConfidenceScore() > 25) {
                flags.add("low_abuse_score");
                score += 20;
            }
            if (abuse.totalReports() > 50) {
                flags.add("many_abuse_reports");
                score += 30;
            } else if (abuse.totalReports() > 10) {
                flags.add("some_abuse_reports");
                score += 15;
            }
            if (abuse.tor()) {
                tor = true;
                flags.add("tor_exit_node");
                score += 45;
            }
        }

        return new IpRiskProfile(ip, resolvedIps, country, geo.path("city").asText("Unknown"), asn, asnOrg,
                geo.path("isp").asText("Unknown"), proxy, hosting, geo.path("mobile").asBoolean(false), tor,
                Optional.ofNullable(abuse).map(AbuseReport::abuseConfidenceScore).orElse(null),
                Optional.ofNullable(abuse).map(AbuseReport::totalReports).orElse(null),
                flags, Math.min(score, 100));
    }
}
