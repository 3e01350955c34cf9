package com.urlguardian.scanner.policy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Versioned policy data: the (risk category, score band) outcome table keyed
 * by wire names, the site-category keyword lists and the named policy
 * profiles.
 *
 * <p>
 * Loaded from {@code policy/policy-table.json}. Site categories are matched
 * in list order, first match wins.
 * </p>
 *
 * @author URL Guardian Team
 */
public record PolicyTable(
        String version,
        int mediumBandFrom,
        int highBandFrom,
        Map<String, Map<String, PolicyDecision>> outcomes,
        List<SiteCategoryRule> siteCategories,
        Map<String, Profile> profiles,
        String defaultProfile,
        List<String> loginKeywords) {

    public static final String DEFAULT_RESOURCE = "policy/policy-table.json";

    public PolicyTable {
        outcomes = Map.copyOf(outcomes);
        siteCategories = List.copyOf(siteCategories);
        profiles = Map.copyOf(profiles);
        loginKeywords = List.copyOf(loginKeywords);
        if (!profiles.containsKey(defaultProfile)) {
            throw new IllegalArgumentException("default profile '" + defaultProfile + "' is not defined");
        }
        for (RiskCategory category : RiskCategory.values()) {
            Map<String, PolicyDecision> row = outcomes.get(category.wireName());
            for (ScoreBand band : ScoreBand.values()) {
                if (row == null || row.get(band.wireName()) == null) {
                    throw new IllegalArgumentException(
                            "missing outcome for " + category.wireName() + "/" + band.wireName());
                }
            }
        }
    }

    /**
     * A site category and the keywords that select it.
     *
     * @param matchPath whether keywords are also matched against the full URL, not only the host
     */
    public record SiteCategoryRule(String category, double confidence, List<String> subcategories,
            List<String> keywords, boolean matchPath) {
    }

    /** Site categories a profile blocks or warns on; anything else is allowed. */
    public record Profile(List<String> block, List<String> warn) {

        public PolicyDecision decisionFor(String siteCategory) {
            if (block.contains(siteCategory)) {
                return PolicyDecision.BLOCK;
            }
            if (warn.contains(siteCategory)) {
                return PolicyDecision.WARN;
            }
            return PolicyDecision.ALLOW;
        }
    }

    public ScoreBand bandOf(int score) {
        if (score >= highBandFrom) {
            return ScoreBand.HIGH;
        }
        if (score >= mediumBandFrom) {
            return ScoreBand.MEDIUM;
        }
        return ScoreBand.LOW;
    }

    public PolicyDecision outcome(RiskCategory category, ScoreBand band) {
        return outcomes.get(category.wireName()).get(band.wireName());
    }

    /** The named profile, or the default profile for an unknown name. */
    public Profile profile(String name) {
        return name == null ? profiles.get(defaultProfile) : profiles.getOrDefault(name, profiles.get(defaultProfile));
    }

    public String resolveProfileName(String name) {
        return name != null && profiles.containsKey(name) ? name : defaultProfile;
    }

    public static PolicyTable load(ObjectMapper objectMapper, String resource) {
        ObjectMapper reader = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try (InputStream in = PolicyTable.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Policy table not found on classpath: " + resource);
            }
            return reader.readValue(in, PolicyTable.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read policy table " + resource, e);
        }
    }

    public static PolicyTable loadDefault() {
        return load(new ObjectMapper(), DEFAULT_RESOURCE);
    }
}
