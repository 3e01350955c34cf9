package com.urlguardian.scanner.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Policy outcome, ordered from least to most restrictive.
 *
 * @author URL Guardian Team
 */
public enum PolicyDecision {
    ALLOW,
    WARN,
    BLOCK;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PolicyDecision fromWireName(String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }

    public PolicyDecision atLeast(PolicyDecision other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
