package com.urlguardian.scanner.incident;

import com.urlguardian.scanner.policy.Classification;
import com.urlguardian.scanner.risk.RiskAssessment;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted outcome of one scan. Immutable once generated.
 *
 * @param id        unique, time-ordered id
 * @param timestamp generation time, UTC
 * @param siemReady at least one threat-intelligence source answered
 * @author URL Guardian Team
 */
public record IncidentReport(
        String id,
        Instant timestamp,
        String url,
        RiskAssessment riskAssessment,
        Classification classification,
        Severity severity,
        List<Finding> findings,
        String recommendation,
        Map<String, String> metadata,
        boolean siemReady) {

    public IncidentReport {
        findings = List.copyOf(findings);
        metadata = Map.copyOf(metadata);
    }
}
