package com.urlguardian.scanner.alert;

import com.urlguardian.scanner.incident.IncidentReport;
import com.urlguardian.scanner.metrics.ScannerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IncidentPublisherTest {

    private SimpleMeterRegistry registry;
    private ScannerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ScannerMetrics(registry);
        metrics.init();
    }

    @Test
    void shouldDeliverToEveryIntegrationDespiteFailures() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(3);
        List<String> delivered = new CopyOnWriteArrayList<>();
        SiemIntegration failing = report -> Mono.<Void>error(new IllegalStateException("HEC rejected"))
                .doFinally(signal -> done.countDown());
        SiemIntegration throwing = report -> {
            done.countDown();
            throw new IllegalStateException("misconfigured");
        };
        SiemIntegration working = report -> Mono.<Void>fromRunnable(() -> delivered.add(report.id()))
                .doFinally(signal -> done.countDown());

        IncidentPublisher publisher = new IncidentPublisher(List.of(failing, throwing, working), metrics);
        assertDoesNotThrow(() -> publisher.publish(report(true)));

        assertTrue(done.await(5, TimeUnit.SECONDS));
        awaitCount("guardian.siem.failed", 2.0);
        assertEquals(List.of("INC-1"), delivered);
        awaitCount("guardian.siem.sent", 1.0);
    }

    @Test
    void shouldSkipReportsWithoutThreatIntelligence() {
        List<String> delivered = new CopyOnWriteArrayList<>();
        SiemIntegration recording = report -> Mono.fromRunnable(() -> delivered.add(report.id()));

        new IncidentPublisher(List.of(recording), metrics).publish(report(false));

        assertTrue(delivered.isEmpty());
        assertEquals(0.0, registry.get("guardian.siem.sent").counter().count());
    }

    @Test
    void shouldAcceptNoIntegrations() {
        IncidentPublisher publisher = new IncidentPublisher(List.of(), metrics);
        publisher.init();

        assertDoesNotThrow(() -> publisher.publish(report(true)));
    }

    private void awaitCount(String counter, double expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (registry.get(counter).counter().count() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(expected, registry.get(counter).counter().count());
    }

    private static IncidentReport report(boolean siemReady) {
        return new IncidentReport("INC-1", Instant.EPOCH, "https://example.com/", null, null, null, List.of(),
                "none", Map.of(), siemReady);
    }
}
