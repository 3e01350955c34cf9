package com.urlguardian.scanner.scan;

import com.urlguardian.scanner.collector.StructureAnalysis;
import com.urlguardian.scanner.collector.UrlStructureAnalyzer;
import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.feature.UrlFeatureExtractor;
import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.risk.Verdict;
import com.urlguardian.scanner.risk.VerdictPolicy;
import org.springframework.stereotype.Service;

/**
 * URL-only analysis: structural red flags and the flag-count verdict, no
 * network access.
 *
 * @author URL Guardian Team
 */
@Service
public class UrlAnalysisService {

    private final UrlFeatureExtractor extractor;
    private final UrlStructureAnalyzer structureAnalyzer;
    private final VerdictPolicy verdictPolicy;

    public UrlAnalysisService(UrlFeatureExtractor extractor, UrlStructureAnalyzer structureAnalyzer,
            ScannerConfig config) {
        this.extractor = extractor;
        this.structureAnalyzer = structureAnalyzer;
        this.verdictPolicy = VerdictPolicy.flagCount(config.getVerdicts());
    }

    public UrlAnalysis analyze(String rawUrl) {
        UrlFeatures features = extractor.extract(rawUrl);
        StructureAnalysis structure = structureAnalyzer.analyze(features).value()
                .orElseThrow(() -> new IllegalStateException("structure analysis is always available"));
        Verdict verdict = verdictPolicy.decide(structure.riskScore(), structure.redFlags().size());
        return new UrlAnalysis(features.fullUrl(), features, structure.redFlags(), structure.riskScore(), verdict);
    }
}
