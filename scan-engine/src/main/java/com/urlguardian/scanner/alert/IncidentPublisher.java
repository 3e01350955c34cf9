package com.urlguardian.scanner.alert;

import com.urlguardian.scanner.incident.IncidentReport;
import com.urlguardian.scanner.metrics.ScannerMetrics;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Forwards stored incidents to all configured SIEM integrations.
 *
 * <p>
 * Best effort: delivery runs on a background scheduler, each integration is
 * isolated from the others, and {@link #publish} never throws or blocks the
 * caller. Only SIEM-ready incidents are forwarded.
 * </p>
 *
 * @author URL Guardian Team
 */
@Service
public class IncidentPublisher {

    private static final Logger log = LoggerFactory.getLogger(IncidentPublisher.class);

    private final List<SiemIntegration> integrations;
    private final ScannerMetrics metrics;

    public IncidentPublisher(List<SiemIntegration> integrations, ScannerMetrics metrics) {
        this.integrations = integrations;
        this.metrics = metrics;
    }

    @PostConstruct
    public void init() {
        log.info("Incident publisher initialized with {} integrations: {}",
                integrations.size(),
                integrations.stream().map(SiemIntegration::name).toList());
    }

    public void publish(IncidentReport report) {
        if (!report.siemReady()) {
            log.debug("Incident {} not SIEM-ready, not forwarded", report.id());
            return;
        }
        for (SiemIntegration integration : integrations) {
            try {
                Mono.defer(() -> integration.send(report))
                        .subscribeOn(Schedulers.boundedElastic())
                        .subscribe(
                                ignored -> {
                                },
                                e -> {
                                    metrics.siemFailed();
                                    log.error("Incident delivery failed for {}: {}", integration.name(),
                                            e.getMessage());
                                },
                                metrics::siemSent);
            } catch (RuntimeException e) {
                metrics.siemFailed();
                log.error("Incident delivery failed for {}: {}", integration.name(), e.getMessage());
            }
        }
    }
}
