package com.urlguardian.scanner.metrics;

import com.urlguardian.scanner.risk.Verdict;
import com.urlguardian.scanner.signal.SignalSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Scanner metrics exposed via Micrometer/Prometheus.
 *
 * <ul>
 * <li>{@code guardian.scan.completed} - completed scans, tagged by verdict</li>
 * <li>{@code guardian.scan.latency} - end-to-end scan duration</li>
 * <li>{@code guardian.collector.unavailable} - degraded collectors, tagged by source</li>
 * <li>{@code guardian.incident.stored} / {@code guardian.feedback.recorded}</li>
 * <li>{@code guardian.siem.sent} / {@code guardian.siem.failed}</li>
 * </ul>
 *
 * @author URL Guardian Team
 */
@Component
public class ScannerMetrics {

    private static final Logger log = LoggerFactory.getLogger(ScannerMetrics.class);

    private final MeterRegistry meterRegistry;

    private Timer scanLatency;
    private Counter incidentsStored;
    private Counter feedbackRecorded;
    private Counter siemSent;
    private Counter siemFailed;

    public ScannerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        scanLatency = Timer.builder("guardian.scan.latency")
                .description("End-to-end comprehensive scan duration")
                .register(meterRegistry);
        incidentsStored = Counter.builder("guardian.incident.stored")
                .description("Incident reports persisted")
                .register(meterRegistry);
        feedbackRecorded = Counter.builder("guardian.feedback.recorded")
                .description("Feedback records accepted")
                .register(meterRegistry);
        siemSent = Counter.builder("guardian.siem.sent")
                .description("Incidents forwarded to SIEM integrations")
                .register(meterRegistry);
        siemFailed = Counter.builder("guardian.siem.failed")
                .description("SIEM delivery failures")
                .register(meterRegistry);

        log.info("Scanner metrics registered");
    }

    public void scanCompleted(Verdict verdict, Duration elapsed) {
        Counter.builder("guardian.scan.completed")
                .description("Completed scans by verdict")
                .tag("verdict", verdict.wireName())
                .register(meterRegistry)
                .increment();
        scanLatency.record(elapsed);
    }

    public void collectorUnavailable(SignalSource source) {
        Counter.builder("guardian.collector.unavailable")
                .description("Collector invocations that degraded to unavailable")
                .tag("source", source.wireName())
                .register(meterRegistry)
                .increment();
    }

    public void incidentStored() {
        incidentsStored.increment();
    }

    public void feedbackRecorded() {
        feedbackRecorded.increment();
    }

    public void siemSent() {
        siemSent.increment();
    }

    public void siemFailed() {
        siemFailed.increment();
    }
}
