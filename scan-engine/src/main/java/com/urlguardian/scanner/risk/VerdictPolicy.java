package com.urlguardian.scanner.risk;

import com.urlguardian.scanner.config.ScannerConfig;

/**
 * Maps an aggregate onto a {@link Verdict}. Thresholds are inclusive, so a
 * value sitting exactly on a boundary gets the more severe label.
 *
 * @author URL Guardian Team
 */
public interface VerdictPolicy {

    Verdict decide(int overallScore, int redFlagCount);

    /** Bands on the overall score; used by the multi-source scan. */
    static VerdictPolicy scoreBands(ScannerConfig.Verdicts thresholds) {
        return (score, flags) -> {
            if (score >= thresholds.getLikelyPhishingScore()) {
                return Verdict.LIKELY_PHISHING;
            }
            if (score >= thresholds.getSuspiciousScore()) {
                return Verdict.SUSPICIOUS;
            }
            return Verdict.NO_STRONG_SIGNALS;
        };
    }

    /** Bands on the number of red flags; used by the URL-only analysis. */
    static VerdictPolicy flagCount(ScannerConfig.Verdicts thresholds) {
        return (score, flags) -> {
            if (flags >= thresholds.getLikelyPhishingFlags()) {
                return Verdict.LIKELY_PHISHING;
            }
            if (flags >= thresholds.getSuspiciousFlags()) {
                return Verdict.SUSPICIOUS;
            }
            return Verdict.NO_STRONG_SIGNALS;
        };
    }
}
