package com.urlguardian.scanner.risk;

import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.signal.RiskSignal;
import com.urlguardian.scanner.signal.SignalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Merges collector results into one {@link RiskAssessment}.
 *
 * <p>
 * Each answering source contributes {@code weight * subScore}; the sum is
 * divided by the total weight of the sources that answered, so an outage
 * neither lowers nor raises the score. If nothing answered, the result is
 * {@code no_strong_signals} with an explicit insufficient-data entry.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
public class RiskAggregator {

    private static final Logger log = LoggerFactory.getLogger(RiskAggregator.class);

    static final String INSUFFICIENT_DATA_KEY = "insufficient_data";

    private final Map<String, Integer> weights;
    private final VerdictPolicy verdictPolicy;

    public RiskAggregator(ScannerConfig config) {
        this(config.getWeights(), VerdictPolicy.scoreBands(config.getVerdicts()));
    }

    RiskAggregator(Map<String, Integer> weights, VerdictPolicy verdictPolicy) {
        this.weights = Map.copyOf(weights);
        this.verdictPolicy = verdictPolicy;
    }

    /**
     * @param results collector results in invocation order; any mix of
     *                available and unavailable
     */
    public RiskAssessment aggregate(List<? extends SignalResult<? extends RiskSignal>> results) {
        Map<String, SourceContribution> breakdown = new LinkedHashMap<>();
        Set<String> redFlags = new LinkedHashSet<>();
        long weightedSum = 0;
        int totalWeight = 0;

        for (SignalResult<? extends RiskSignal> result : results) {
            Optional<? extends RiskSignal> signal = result.value();
            if (signal.isPresent()) {
                int weight = weightOf(result);
                weightedSum += (long) weight * clamp(signal.get().riskScore());
                totalWeight += weight;
                redFlags.addAll(signal.get().redFlags());
            }
        }

        for (SignalResult<? extends RiskSignal> result : results) {
            String key = result.source().wireName();
            int weight = weightOf(result);
            if (result instanceof SignalResult.Available<?> available) {
                RiskSignal signal = (RiskSignal) available.data();
                int subScore = clamp(signal.riskScore());
                double contribution = totalWeight == 0 ? 0.0 : (double) weight * subScore / totalWeight;
                breakdown.put(key, SourceContribution.available(weight, subScore,
                        Math.round(contribution * 100.0) / 100.0, available.confidence(), signal.redFlags()));
            } else if (result instanceof SignalResult.Unavailable<?> unavailable) {
                breakdown.put(key, SourceContribution.unavailable(weight, unavailable.reason()));
            }
        }

        if (totalWeight == 0) {
            log.warn("Aggregation impossible: none of {} signal sources answered", results.size());
            breakdown.put(INSUFFICIENT_DATA_KEY, SourceContribution.insufficientData());
            return new RiskAssessment(0, Verdict.NO_STRONG_SIGNALS, breakdown, List.of(), true);
        }

        int overallScore = (int) Math.round((double) weightedSum / totalWeight);
        List<String> flags = List.copyOf(redFlags);
        Verdict verdict = verdictPolicy.decide(overallScore, flags.size());
        return new RiskAssessment(overallScore, verdict, breakdown, flags, false);
    }

    private int weightOf(SignalResult<?> result) {
        return weights.getOrDefault(result.source().wireName(), 0);
    }

    private static int clamp(int score) {
        return Math.min(100, Math.max(0, score));
    }
}
