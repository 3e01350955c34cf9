package com.urlguardian.scanner.incident;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Incident severity derived from the overall score.
 *
 * @author URL Guardian Team
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** low below 30, medium below 60, high below 85, critical otherwise. */
    public static Severity of(int overallScore) {
        if (overallScore < 30) {
            return LOW;
        }
        if (overallScore < 60) {
            return MEDIUM;
        }
        if (overallScore < 85) {
            return HIGH;
        }
        return CRITICAL;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromWireName(String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
