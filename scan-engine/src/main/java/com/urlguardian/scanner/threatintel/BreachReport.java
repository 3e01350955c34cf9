package com.urlguardian.scanner.threatintel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.urlguardian.scanner.signal.RiskSignal;

import java.time.LocalDate;
import java.util.List;

/**
 * Breach history of an email address.
 *
 * @param email         the masked address
 * @param totalPwnCount total exposed records across all breaches
 * @author URL Guardian Team
 */
public record BreachReport(String email, List<Breach> breaches, int totalBreaches, long totalPwnCount,
        boolean passwordsExposed, boolean financialDataExposed, List<String> flags, int riskScore)
        implements RiskSignal {

    public BreachReport {
        breaches = List.copyOf(breaches);
        flags = List.copyOf(flags);
    }

    @Override
    @JsonIgnore
    public List<String> redFlags() {
        return RiskSignal.describeAll(flags);
    }

    public record Breach(String name, String title, String domain, LocalDate breachDate, long pwnCount,
            List<String> dataClasses, boolean verified, boolean sensitive) {

        public Breach {
            dataClasses = List.copyOf(dataClasses);
        }
    }
}
