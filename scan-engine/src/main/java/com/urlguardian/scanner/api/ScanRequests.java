package com.urlguardian.scanner.api;

import com.urlguardian.scanner.incident.Judgment;

import java.util.Map;

/**
 * Request bodies of the {@code /security} endpoints.
 *
 * @author URL Guardian Team
 */
public final class ScanRequests {

    private ScanRequests() {
    }

    public record UrlRequest(String url) {
    }

    public record EmailRequest(String email) {
    }

    /** @param email optional, enables the breach check */
    public record ScanRequest(String url, String email) {
    }

    /** @param policyProfileId {@code enterprise}, {@code strict} or {@code permissive}; default profile when absent */
    public record PolicyRequest(String url, String policyProfileId) {
    }

    public record IncidentRequest(String url, Map<String, String> metadata) {
    }

    public record FeedbackRequest(String incidentId, Judgment judgment, String comment) {
    }
}
