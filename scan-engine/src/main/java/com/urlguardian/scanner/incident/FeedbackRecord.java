package com.urlguardian.scanner.incident;

import java.time.Instant;

/**
 * A human correction tied to a stored incident. Append-only.
 *
 * @param comment free text, may be null
 * @author URL Guardian Team
 */
public record FeedbackRecord(String id, String incidentId, Judgment judgment, String comment, Instant timestamp) {
}
