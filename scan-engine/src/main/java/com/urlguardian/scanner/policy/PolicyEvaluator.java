package com.urlguardian.scanner.policy;

import com.urlguardian.scanner.feature.UrlFeatures;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Evaluates a URL against a named policy profile.
 *
 * <p>
 * The profile decides on the site category. Login keywords and IP-literal
 * hosts escalate the decision; when a {@link Classification} is supplied its
 * outcome is a floor for the final decision.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
public class PolicyEvaluator {

    private final PolicyTable table;
    private final CategoryClassifier classifier;

    public PolicyEvaluator(PolicyTable table, CategoryClassifier classifier) {
        this.table = table;
        this.classifier = classifier;
    }

    public PolicyCheck checkPolicy(UrlFeatures features, String profileId) {
        return checkPolicy(features, profileId, null);
    }

    public PolicyCheck checkPolicy(UrlFeatures features, String profileId, Classification classification) {
        String profileName = table.resolveProfileName(profileId);
        PolicyTable.Profile profile = table.profile(profileName);
        String category = classification != null
                ? classification.siteCategory().category()
                : classifier.siteCategory(features).category();

        List<String> rules = new ArrayList<>();
        StringBuilder explanation = new StringBuilder();
        PolicyDecision decision = profile.decisionFor(category);
        int score;
        switch (decision) {
            case BLOCK -> {
                rules.add("block_category_" + category);
                explanation.append("Blocked: ").append(category).append(" sites are not allowed by policy");
                score = 100;
            }
            case WARN -> {
                rules.add("warn_category_" + category);
                explanation.append("Warning: ").append(category).append(" sites require caution");
                score = 50;
            }
            default -> {
                rules.add("allow_category_" + category);
                explanation.append("Allowed: ").append(category).append(" sites are permitted");
                score = 0;
            }
        }

        String url = features.fullUrl().toLowerCase(Locale.ROOT);
        if (table.loginKeywords().stream().anyMatch(url::contains)) {
            rules.add("contains_login_keyword");
            if (decision == PolicyDecision.ALLOW) {
                decision = PolicyDecision.WARN;
                explanation.append(". Contains login-related keywords, verify authenticity");
                score += 20;
            }
        }
        if (features.isIp()) {
            rules.add("ip_address_url");
            decision = decision.atLeast(PolicyDecision.WARN);
            explanation.append(". URL uses IP address instead of domain name");
            score += 30;
        }

        if (classification != null && classification.outcome().compareTo(decision) > 0) {
            rules.add(classification.outcome().wireName() + "_risk_" + classification.riskCategory().wireName()
                    + "_" + classification.scoreBand().wireName());
            decision = classification.outcome();
            explanation.append(". Risk assessment classifies this URL as ")
                    .append(classification.riskCategory().wireName());
        }

        return new PolicyCheck(features.fullUrl(), profileName, category, decision, explanation.toString(), rules,
                Math.min(score, 100));
    }
}
