package com.urlguardian.scanner.incident;

/**
 * Thrown when feedback references an incident that is not stored.
 *
 * @author URL Guardian Team
 */
public class UnknownIncidentException extends RuntimeException {

    private final String incidentId;

    public UnknownIncidentException(String incidentId) {
        super("No incident with id " + incidentId);
        this.incidentId = incidentId;
    }

    public String getIncidentId() {
        return incidentId;
    }
}
