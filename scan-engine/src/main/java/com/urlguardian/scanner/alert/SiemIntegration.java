package com.urlguardian.scanner.alert;

import com.urlguardian.scanner.incident.IncidentReport;
import reactor.core.publisher.Mono;

/**
 * Pluggable SIEM integration.
 *
 * @author URL Guardian Team
 */
public interface SiemIntegration {

    /** Deliver one incident; completes when the SIEM accepted it. */
    Mono<Void> send(IncidentReport report);

    default String name() {
        return getClass().getSimpleName();
    }
}
