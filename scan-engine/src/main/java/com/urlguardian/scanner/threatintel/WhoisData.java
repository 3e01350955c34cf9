package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.urlguardian.scanner.signal.RiskSignal;

import java.time.Instant;
import java.util.List;

/**
 * Registration data for a domain, taken from RDAP.
 *
 * @param createdDate registration event, null when the registry does not publish it
 * @param ageInDays   whole days since registration, -1 when unknown
 * @author URL Guardian Team
 */
public record WhoisData(String domain, String registrar, String registrant, Instant createdDate,
        Instant updatedDate, Instant expiryDate, long ageInDays, List<String> flags, int riskScore)
        implements RiskSignal {

    public WhoisData {
        flags = List.copyOf(flags);
    }

    @Override
    @JsonIgnore
    public List<String> redFlags() {
        return RiskSignal.describeAll(flags);
    }
}
