package com.urlguardian.scanner.incident;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Human judgment of an incident's verdict.
 *
 * @author URL Guardian Team
 */
public enum Judgment {
    CORRECT,
    FALSE_POSITIVE,
    FALSE_NEGATIVE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Judgment fromWireName(String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
