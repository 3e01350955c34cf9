package com.urlguardian.scanner.risk;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse risk classification derived from a score or a red-flag count,
 * ordered from least to most severe.
 *
 * @author URL Guardian Team
 */
public enum Verdict {
    NO_STRONG_SIGNALS,
    SUSPICIOUS,
    LIKELY_PHISHING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Verdict fromWireName(String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
