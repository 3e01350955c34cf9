package com.urlguardian.scanner.policy;

import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.risk.RiskAssessment;
import com.urlguardian.scanner.risk.Verdict;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Assigns a risk category and site category to an assessed URL and looks up
 * the policy outcome for its (category, score band).
 *
 * <p>
 * Pure: the result depends only on the features, the assessment and the
 * loaded {@link PolicyTable}.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
public class CategoryClassifier {

    private static final List<String> MALWARE_MARKERS = List.of("malware", "unwanted software");

    private final PolicyTable table;

    public CategoryClassifier(PolicyTable table) {
        this.table = table;
    }

    public Classification classify(UrlFeatures features, RiskAssessment assessment) {
        RiskCategory riskCategory = riskCategory(assessment);
        ScoreBand band = table.bandOf(assessment.overallScore());
        PolicyDecision outcome = table.outcome(riskCategory, band);
        return new Classification(features.fullUrl(), riskCategory, siteCategory(features), band, outcome,
                outcome != PolicyDecision.BLOCK);
    }

    static RiskCategory riskCategory(RiskAssessment assessment) {
        if (assessment.insufficientData()) {
            return RiskCategory.UNKNOWN;
        }
        boolean malware = assessment.redFlags().stream()
                .map(flag -> flag.toLowerCase(Locale.ROOT))
                .anyMatch(flag -> MALWARE_MARKERS.stream().anyMatch(flag::contains));
        if (malware) {
            return RiskCategory.MALWARE;
        }
        return assessment.verdict() == Verdict.NO_STRONG_SIGNALS ? RiskCategory.BENIGN : RiskCategory.PHISHING;
    }

    /** First matching keyword rule, or {@code unknown}. */
    public SiteCategory siteCategory(UrlFeatures features) {
        String url = features.fullUrl().toLowerCase(Locale.ROOT);
        String host = features.domain();
        for (PolicyTable.SiteCategoryRule rule : table.siteCategories()) {
            boolean hit = rule.keywords().stream()
                    .anyMatch(k -> host.contains(k) || (rule.matchPath() && url.contains(k)));
            if (hit) {
                return new SiteCategory(rule.category(), rule.confidence(), rule.subcategories());
            }
        }
        return SiteCategory.unknown();
    }
}
