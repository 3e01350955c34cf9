package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.urlguardian.scanner.signal.RiskSignal;

import java.util.List;

/**
 * Combined reputation of a URL across all configured sources.
 *
 * @param sources every source's vote, including those that did not answer
 * @param verdict consensus over the answering sources
 * @author URL Guardian Team
 */
public record ReputationCheck(String url, String domain, List<SourceVote> sources, SourceVote.Status verdict,
        List<String> flags, int riskScore) implements RiskSignal {

    public ReputationCheck {
        sources = List.copyOf(sources);
        flags = List.copyOf(flags);
    }

    @Override
    @JsonIgnore
    public List<String> redFlags() {
        return RiskSignal.describeAll(flags);
    }
}
