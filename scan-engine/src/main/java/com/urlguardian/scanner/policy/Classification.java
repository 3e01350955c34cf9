package com.urlguardian.scanner.policy;

/**
 * Category and policy outcome for one assessed URL.
 *
 * @param compliant true unless the outcome table blocks the URL
 * @author URL Guardian Team
 */
public record Classification(String url, RiskCategory riskCategory, SiteCategory siteCategory,
        ScoreBand scoreBand, PolicyDecision outcome, boolean compliant) {
}
