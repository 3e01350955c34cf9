package com.urlguardian.scanner.collector;

import com.urlguardian.scanner.signal.RiskSignal;

import java.util.List;

/**
 * Red flags matched by the structural URL rules.
 *
 * @author URL Guardian Team
 */
public record StructureAnalysis(List<String> redFlags, int riskScore) implements RiskSignal {

    public StructureAnalysis {
        redFlags = List.copyOf(redFlags);
    }
}
