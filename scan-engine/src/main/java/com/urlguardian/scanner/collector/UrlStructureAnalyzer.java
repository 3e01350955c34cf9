package com.urlguardian.scanner.collector;

import com.urlguardian.scanner.feature.HeuristicDictionary;
import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.signal.SignalResult;
import com.urlguardian.scanner.signal.SignalSource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Computed signal source over the extracted URL features.
 *
 * <p>
 * Each matched rule emits one red flag; the rule count maps onto the
 * sub-score through the dictionary's step function (0, 40, 70, 90 by
 * default). Never unavailable.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
public class UrlStructureAnalyzer {

    private final HeuristicDictionary dictionary;

    public UrlStructureAnalyzer(HeuristicDictionary dictionary) {
        this.dictionary = dictionary;
    }

    public SignalResult<StructureAnalysis> analyze(UrlFeatures features) {
        List<String> flags = new ArrayList<>();

        if (features.isIp()) {
            flags.add("Uses raw IP instead of normal domain name.");
        }
        if (features.hasAt()) {
            flags.add("Contains @ which can hide the real destination.");
        }
        if (features.numDots() >= dictionary.maxDomainDots()) {
            flags.add("Many dots in domain, often used to hide real site.");
        }
        if (features.urlLength() > dictionary.maxUrlLength()) {
            flags.add("Very long URL, common in phishing links.");
        }
        if (!features.keywordHits().isEmpty()) {
            flags.add("Contains sensitive words: " + String.join(", ", features.keywordHits()));
        }
        if (features.tldSuspicious()) {
            flags.add("Uses uncommon TLD: ." + features.tld() + ".");
        }
        if (features.brandImpersonation() != null) {
            String brand = features.brandImpersonation();
            flags.add("Domain contains brand name \"" + brand + "\" but is not official " + brand + ".com.");
        }

        return SignalResult.available(SignalSource.URL_STRUCTURE,
                new StructureAnalysis(flags, dictionary.structureScore(flags.size())), 1.0);
    }
}
