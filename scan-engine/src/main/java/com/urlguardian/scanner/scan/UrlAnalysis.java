package com.urlguardian.scanner.scan;

import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.risk.Verdict;

import java.util.List;

/**
 * Result of the URL-only quick analysis.
 *
 * @param riskScore structural sub-score
 * @param verdict   from the flag-count policy
 * @author URL Guardian Team
 */
public record UrlAnalysis(String url, UrlFeatures features, List<String> redFlags, int riskScore,
        Verdict verdict) {

    public UrlAnalysis {
        redFlags = List.copyOf(redFlags);
    }
}
