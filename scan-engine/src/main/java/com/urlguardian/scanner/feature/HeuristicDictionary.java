package com.urlguardian.scanner.feature;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Versioned word lists and thresholds driving the dictionary-based checks.
 *
 * <p>
 * Loaded from {@code heuristics/url-heuristics.json} so that list or
 * threshold changes ship as data. List order is significant: keyword hits and
 * brand matches follow it.
 * </p>
 *
 * @author URL Guardian Team
 */
public record HeuristicDictionary(
        String version,
        List<String> sensitiveKeywords,
        List<String> suspiciousTlds,
        List<String> brands,
        List<Integer> structureScoreSteps,
        int maxDomainDots,
        int maxUrlLength,
        Page page,
        Reputation reputation,
        Whois whois,
        IpRisk ipRisk) {

    public static final String DEFAULT_RESOURCE = "heuristics/url-heuristics.json";

    public HeuristicDictionary {
        sensitiveKeywords = List.copyOf(sensitiveKeywords);
        suspiciousTlds = List.copyOf(suspiciousTlds);
        brands = List.copyOf(brands);
        structureScoreSteps = List.copyOf(structureScoreSteps);
        if (structureScoreSteps.isEmpty()) {
            throw new IllegalArgumentException("structureScoreSteps must not be empty");
        }
    }

    /**
     * Map a matched-rule count onto the structural sub-score. Counts beyond
     * the table use its last step.
     */
    public int structureScore(int flagCount) {
        int index = Math.min(Math.max(flagCount, 0), structureScoreSteps.size() - 1);
        return structureScoreSteps.get(index);
    }

    public record Page(List<String> brands, int maxHiddenInputs, int maxIframes) {
    }

    public record Reputation(List<String> lowReputationTlds) {
    }

    public record Whois(List<String> privacyMarkers, List<String> registrarWatchlist) {
    }

    public record IpRisk(List<String> highRiskCountries, List<String> bulletproofKeywords,
            List<String> cloudProviders) {
    }

    public static HeuristicDictionary load(ObjectMapper objectMapper, String resource) {
        ObjectMapper reader = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try (InputStream in = HeuristicDictionary.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Heuristic dictionary not found on classpath: " + resource);
            }
            return reader.readValue(in, HeuristicDictionary.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read heuristic dictionary " + resource, e);
        }
    }

    public static HeuristicDictionary loadDefault() {
        return load(new ObjectMapper(), DEFAULT_RESOURCE);
    }
}
