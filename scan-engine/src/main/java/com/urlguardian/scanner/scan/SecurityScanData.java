package com.urlguardian.scanner.scan;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.urlguardian.scanner.incident.IncidentReport;
import com.urlguardian.scanner.risk.SourceContribution;
import com.urlguardian.scanner.risk.Verdict;
import com.urlguardian.scanner.signal.RiskSignal;
import com.urlguardian.scanner.signal.SignalSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response of a comprehensive scan.
 *
 * @author URL Guardian Team
 */
public record SecurityScanData(String url, String incidentId, RiskScore riskScore, Details details,
        Instant timestamp) {

    public record RiskScore(int overallScore, Verdict verdict, Map<String, SourceContribution> breakdown,
            List<String> redFlags, String riskCategory, String severity) {
    }

    /** Payloads of the sources that answered; absent ones are omitted. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Details(RiskSignal reputation, RiskSignal whoisData, RiskSignal tlsAudit) {
    }

    static SecurityScanData of(ScanResult result, IncidentReport report) {
        RiskScore score = new RiskScore(
                result.assessment().overallScore(),
                result.assessment().verdict(),
                result.assessment().breakdown(),
                result.assessment().redFlags(),
                result.classification().riskCategory().wireName(),
                report.severity().wireName());
        Details details = new Details(
                result.payload(SignalSource.REPUTATION).orElse(null),
                result.payload(SignalSource.WHOIS).orElse(null),
                result.payload(SignalSource.TLS).orElse(null));
        return new SecurityScanData(result.features().fullUrl(), report.id(), score, details, report.timestamp());
    }
}
