package com.urlguardian.scanner.signal;

import java.util.List;

/**
 * Common view over every collector payload that the aggregator scores.
 *
 * @author URL Guardian Team
 */
public interface RiskSignal {

    /** Source-specific sub-score in [0, 100]. */
    int riskScore();

    /** Human-readable reasons, in detection order. */
    List<String> redFlags();

    /** Turns a snake_case flag code into display text. */
    static String describe(String flagCode) {
        return flagCode.replace('_', ' ');
    }

    static List<String> describeAll(List<String> flagCodes) {
        return flagCodes.stream().map(RiskSignal::describe).toList();
    }
}
