package com.urlguardian.scanner.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse band of the overall risk score.
 *
 * @author URL Guardian Team
 */
public enum ScoreBand {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ScoreBand fromWireName(String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
