package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * One reputation provider's verdict, normalized.
 *
 * @param source  the provider name (e.g., "OpenPhish", "VirusTotal")
 * @param status  normalized verdict
 * @param score   the provider's sub-score in [0, 100]
 * @param details provider-specific response details
 * @author URL Guardian Team
 */
public record SourceVote(String source, Status status, int score, Map<String, Object> details) {

    public enum Status {
        CLEAN, SUSPICIOUS, MALICIOUS, UNKNOWN;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Status fromWireName(String name) {
            return valueOf(name.toUpperCase(Locale.ROOT));
        }
    }

    public SourceVote {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /** Factory for a clean (non-malicious) result. */
    public static SourceVote clean(String source) {
        return new SourceVote(source, Status.CLEAN, 0, Map.of());
    }

    public static SourceVote suspicious(String source, int score, Map<String, Object> details) {
        return new SourceVote(source, Status.SUSPICIOUS, clamp(score), details);
    }

    public static SourceVote malicious(String source, int score, Map<String, Object> details) {
        return new SourceVote(source, Status.MALICIOUS, clamp(score), details);
    }

    /** Factory for a provider that did not answer or is not configured. */
    public static SourceVote unknown(String source, String reason) {
        return new SourceVote(source, Status.UNKNOWN, 0, Map.of("reason", reason));
    }

    private static int clamp(int score) {
        return Math.min(100, Math.max(0, score));
    }
}
