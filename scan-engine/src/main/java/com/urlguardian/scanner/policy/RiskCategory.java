package com.urlguardian.scanner.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Threat category assigned from a risk assessment.
 *
 * @author URL Guardian Team
 */
public enum RiskCategory {
    PHISHING,
    MALWARE,
    BENIGN,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RiskCategory fromWireName(String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
