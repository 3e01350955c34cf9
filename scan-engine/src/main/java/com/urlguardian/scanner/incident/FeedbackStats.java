package com.urlguardian.scanner.incident;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Aggregate over all feedback.
 *
 * @param accuracy        {@code correct / total}, null when there is no feedback
 * @param accuracyDisplay accuracy as a percentage, or {@code "no data"}
 * @param rollingAccuracy accuracy over the last {@code rollingWindow} records, null when there is no feedback
 * @author URL Guardian Team
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record FeedbackStats(long total, long correct, long falsePositives, long falseNegatives, Double accuracy,
        String accuracyDisplay, Double rollingAccuracy, int rollingWindow) {

    public static final String NO_DATA = "no data";
}
