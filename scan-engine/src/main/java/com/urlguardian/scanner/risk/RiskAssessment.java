package com.urlguardian.scanner.risk;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate verdict of one scan. Immutable.
 *
 * @param overallScore     0 to 100
 * @param breakdown        per-source contribution keyed by source wire name, in invocation order
 * @param redFlags         deduplicated reasons in detection order
 * @param insufficientData true when no source answered and the score is not meaningful
 * @author URL Guardian Team
 */
public record RiskAssessment(int overallScore, Verdict verdict, Map<String, SourceContribution> breakdown,
        List<String> redFlags, boolean insufficientData) {

    public RiskAssessment {
        breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
        redFlags = List.copyOf(redFlags);
    }

    /** Number of breakdown entries whose source answered. */
    @JsonIgnore
    public long availableSources() {
        return breakdown.values().stream()
                .filter(c -> SourceContribution.AVAILABLE.equals(c.status()))
                .count();
    }
}
