package com.urlguardian.scanner.incident;

import com.urlguardian.scanner.policy.Classification;
import com.urlguardian.scanner.risk.RiskAssessment;
import com.urlguardian.scanner.risk.SourceContribution;
import com.urlguardian.scanner.risk.Verdict;
import com.urlguardian.scanner.signal.SignalSource;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link IncidentReport}s from a finished assessment. Does not persist.
 *
 * @author URL Guardian Team
 */
@Component
public class IncidentReportGenerator {

    private final IncidentIdGenerator idGenerator;
    private final Clock clock;

    public IncidentReportGenerator(IncidentIdGenerator idGenerator, Clock clock) {
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public IncidentReport generate(String url, RiskAssessment assessment, Classification classification,
            Map<String, String> metadata) {
        List<Finding> findings = new ArrayList<>();
        assessment.breakdown().forEach((source, contribution) -> {
            for (String flag : contribution.redFlags()) {
                findings.add(new Finding(source, flag, contribution.subScore() == null ? 0 : contribution.subScore()));
            }
        });

        return new IncidentReport(
                idGenerator.nextId(),
                clock.instant(),
                url,
                assessment,
                classification,
                Severity.of(assessment.overallScore()),
                findings,
                recommendation(assessment),
                metadata == null ? Map.of() : metadata,
                isSiemReady(assessment));
    }

    /** Minimum coverage for forwarding: at least one threat-intelligence source answered. */
    static boolean isSiemReady(RiskAssessment assessment) {
        return assessment.breakdown().entrySet().stream()
                .filter(e -> SourceContribution.AVAILABLE.equals(e.getValue().status()))
                .anyMatch(e -> SignalSource.find(e.getKey())
                        .map(s -> s.layer() == SignalSource.Layer.B)
                        .orElse(false));
    }

    static String recommendation(RiskAssessment assessment) {
        if (assessment.insufficientData()) {
            return "No signal source could be reached. Rescan later before trusting this URL.";
        }
        if (assessment.verdict() == Verdict.LIKELY_PHISHING) {
            return "This URL is highly suspicious and likely malicious. Do not enter passwords, seed phrases "
                    + "or any sensitive information.";
        }
        if (assessment.verdict() == Verdict.SUSPICIOUS) {
            return "This URL shows suspicious characteristics. Verify its authenticity before entering "
                    + "sensitive information.";
        }
        return "No significant security concerns detected.";
    }
}
