package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.urlguardian.scanner.signal.RiskSignal;

import java.util.List;

/**
 * Geolocation, hosting and abuse profile of the address a host resolves to.
 *
 * @param ip          the profiled address
 * @param resolvedIps every A record found for the host
 * @param abuseScore  AbuseIPDB confidence score, null when not checked
 * @author URL Guardian Team
 */
public record IpRiskProfile(String ip, List<String> resolvedIps, String country, String city, String asn,
        String asnOrg, String hostingProvider, boolean proxy, boolean hosting, boolean mobile, boolean tor,
        Integer abuseScore, Integer totalReports, List<String> flags, int riskScore) implements RiskSignal {

    public IpRiskProfile {
        resolvedIps = List.copyOf(resolvedIps);
        flags = List.copyOf(flags);
    }

    @Override
    @JsonIgnore
    public List<String> redFlags() {
        return RiskSignal.describeAll(flags);
    }
}
