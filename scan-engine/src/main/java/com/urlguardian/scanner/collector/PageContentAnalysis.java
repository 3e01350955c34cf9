package com.urlguardian.scanner.collector;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.urlguardian.scanner.signal.RiskSignal;

import java.util.List;

/**
 * Phishing indicators found in a page's markup.
 *
 * @author URL Guardian Team
 */
public record PageContentAnalysis(Dom dom, List<String> flags, int riskScore, boolean truncated)
        implements RiskSignal {

    public PageContentAnalysis {
        flags = List.copyOf(flags);
    }

    @Override
    @JsonIgnore
    public List<String> redFlags() {
        return RiskSignal.describeAll(flags);
    }

    public record Dom(int forms, int scripts, int iframes, int externalLinks) {
    }
}
