package com.urlguardian.scanner.incident;

/**
 * Thrown when an incident id is already taken in the store. Stored incidents
 * are never overwritten.
 *
 * @author URL Guardian Team
 */
public class DuplicateIncidentException extends RuntimeException {

    private final String incidentId;

    public DuplicateIncidentException(String incidentId) {
        super("Incident " + incidentId + " already exists");
        this.incidentId = incidentId;
    }

    public DuplicateIncidentException(String incidentId, Throwable cause) {
        super("Incident " + incidentId + " already exists", cause);
        this.incidentId = incidentId;
    }

    public String getIncidentId() {
        return incidentId;
    }
}
