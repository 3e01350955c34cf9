package com.urlguardian.scanner.scan;

import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.policy.Classification;
import com.urlguardian.scanner.risk.RiskAssessment;
import com.urlguardian.scanner.signal.RiskSignal;
import com.urlguardian.scanner.signal.SignalResult;
import com.urlguardian.scanner.signal.SignalSource;

import java.util.List;
import java.util.Optional;

/**
 * Everything one multi-source assessment produced, before persistence.
 *
 * @param signals collector results in invocation order
 * @author URL Guardian Team
 */
public record ScanResult(UrlFeatures features, List<SignalResult<? extends RiskSignal>> signals,
        RiskAssessment assessment, Classification classification) {

    public ScanResult {
        signals = List.copyOf(signals);
    }

    /** The payload of a source that answered. */
    public Optional<RiskSignal> payload(SignalSource source) {
        return signals.stream()
                .filter(s -> s.source() == source)
                .findFirst()
                .flatMap(SignalResult::value)
                .map(RiskSignal.class::cast);
    }
}
