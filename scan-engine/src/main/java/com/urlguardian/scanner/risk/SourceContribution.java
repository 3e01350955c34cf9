package com.urlguardian.scanner.risk;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One breakdown entry of a {@link RiskAssessment}.
 *
 * @param status           {@code available}, {@code unavailable} or {@code insufficient_data}
 * @param configuredWeight weight from the weight table
 * @param weight           weight actually applied; zero when the source did not answer
 * @param subScore         the source's own score, null when unavailable
 * @param contribution     points this source added to the overall score
 * @param confidence       the source's reported confidence, null when unavailable
 * @param reason           why the source did not answer
 * @param redFlags         reasons raised by this source, empty when unavailable
 * @author URL Guardian Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceContribution(String status, int configuredWeight, int weight, Integer subScore,
        double contribution, Double confidence, String reason, List<String> redFlags) {

    public static final String AVAILABLE = "available";
    public static final String UNAVAILABLE = "unavailable";
    public static final String INSUFFICIENT_DATA = "insufficient_data";

    public SourceContribution {
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
    }

    static SourceContribution available(int weight, int subScore, double contribution, double confidence,
            List<String> redFlags) {
        return new SourceContribution(AVAILABLE, weight, weight, subScore, contribution, confidence, null, redFlags);
    }

    static SourceContribution unavailable(int configuredWeight, String reason) {
        return new SourceContribution(UNAVAILABLE, configuredWeight, 0, null, 0.0, null, reason, List.of());
    }

    static SourceContribution insufficientData() {
        return new SourceContribution(INSUFFICIENT_DATA, 0, 0, null, 0.0, null,
                "insufficient data: no signal source answered", List.of());
    }
}
