package com.urlguardian.scanner.threatintel;

/**
 * AbuseIPDB check result for one address.
 *
 * @author URL Guardian Team
 */
public record AbuseReport(int abuseConfidenceScore, int totalReports, String countryCode, String isp,
        String usageType, boolean whitelisted, boolean tor) {
}
