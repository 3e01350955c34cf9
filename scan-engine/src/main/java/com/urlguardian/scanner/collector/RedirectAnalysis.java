package com.urlguardian.scanner.collector;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.urlguardian.scanner.signal.RiskSignal;

import java.util.List;

/**
 * Result of following a redirect chain.
 *
 * @param chain     every fetched hop, in order
 * @param finalUrl  where the chain ended
 * @param flags     matched rule codes
 * @param riskScore sub-score in [0, 100]
 * @author URL Guardian Team
 */
public record RedirectAnalysis(List<Hop> chain, String finalUrl, List<String> flags, int riskScore)
        implements RiskSignal {

    public RedirectAnalysis {
        chain = List.copyOf(chain);
        flags = List.copyOf(flags);
    }

    @Override
    @JsonIgnore
    public List<String> redFlags() {
        return RiskSignal.describeAll(flags);
    }

    /**
     * @param redirectType {@code http}, {@code meta} or {@code none}
     */
    public record Hop(String url, int statusCode, String redirectType, String location) {
    }
}
