package com.urlguardian.scanner.incident;

import com.urlguardian.scanner.alert.IncidentPublisher;
import com.urlguardian.scanner.config.IncidentConfig;
import com.urlguardian.scanner.metrics.ScannerMetrics;
import com.urlguardian.scanner.policy.Classification;
import com.urlguardian.scanner.risk.RiskAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generates, persists and forwards incident reports.
 *
 * @author URL Guardian Team
 */
@Service
public class IncidentService {

    private static final Logger log = LoggerFactory.getLogger(IncidentService.class);

    private final IncidentReportGenerator generator;
    private final IncidentStore store;
    private final IncidentPublisher publisher;
    private final IncidentConfig config;
    private final ScannerMetrics metrics;

    public IncidentService(IncidentReportGenerator generator, IncidentStore store, IncidentPublisher publisher,
            IncidentConfig config, ScannerMetrics metrics) {
        this.generator = generator;
        this.store = store;
        this.publisher = publisher;
        this.config = config;
        this.metrics = metrics;
    }

    /**
     * Generate and persist a report, then hand it to the SIEM sink.
     *
     * @throws DuplicateIncidentException if the generated id is already stored
     */
    public IncidentReport record(String url, RiskAssessment assessment, Classification classification,
            Map<String, String> metadata) {
        IncidentReport report = generator.generate(url, assessment, classification, metadata);
        store.save(report);
        metrics.incidentStored();
        log.info("Incident report generated: {} (severity: {}, verdict: {})",
                report.id(), report.severity().wireName(), assessment.verdict().wireName());
        publisher.publish(report);
        return report;
    }

    public Optional<IncidentReport> find(String id) {
        return store.findById(id);
    }

    /** Newest first, at most the configured maximum. */
    public List<IncidentReport> recent(int limit) {
        return store.recent(Math.min(Math.max(limit, 1), config.getMaxRecent()));
    }
}
