package com.urlguardian.scanner.policy;

import java.util.List;

/**
 * Result of evaluating a URL against a policy profile.
 *
 * @param matchedRules rule identifiers in evaluation order
 * @param riskScore    policy-specific score in [0, 100]
 * @author URL Guardian Team
 */
public record PolicyCheck(String url, String policyProfileId, String siteCategory, PolicyDecision decision,
        String explanation, List<String> matchedRules, int riskScore) {

    public PolicyCheck {
        matchedRules = List.copyOf(matchedRules);
    }

    public boolean compliant() {
        return decision != PolicyDecision.BLOCK;
    }
}
