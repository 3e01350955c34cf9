package com.urlguardian.scanner.incident;

import com.urlguardian.scanner.risk.RiskAssessment;
import com.urlguardian.scanner.risk.Verdict;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IncidentReportGeneratorTest {

    @Test
    void shouldBuildReportFromAssessment() {
        IncidentReport report = IncidentFixtures.report();

        assertTrue(IncidentIdGenerator.isWellFormed(report.id()));
        assertEquals(IncidentFixtures.NOW, report.timestamp());
        assertEquals(IncidentFixtures.URL, report.url());
        assertEquals(Severity.CRITICAL, report.severity());
        assertEquals(Map.of("source", "test"), report.metadata());
        assertTrue(report.siemReady());
        assertTrue(report.recommendation().startsWith("This URL is highly suspicious"));
    }

    @Test
    void shouldAttributeFindingsToTheirSource() {
        List<Finding> findings = IncidentFixtures.report().findings();

        assertEquals(2, findings.size());
        assertEquals(new Finding("url_structure", "Uses uncommon TLD: .tk.", 90), findings.get(0));
        assertEquals(new Finding("reputation", "openphish phishing", 90), findings.get(1));
    }

    @Test
    void shouldNotBeSiemReadyWithoutThreatIntelligence() {
        RiskAssessment assessment = IncidentFixtures.structureOnlyAssessment();

        assertFalse(IncidentReportGenerator.isSiemReady(assessment));
        IncidentReport report = IncidentFixtures.generator().generate("https://example.com/", assessment, null, null);
        assertFalse(report.siemReady());
        assertTrue(report.metadata().isEmpty());
        assertEquals("No significant security concerns detected.", report.recommendation());
    }

    @Test
    void shouldRecommendRescanWhenDataInsufficient() {
        RiskAssessment empty = new RiskAssessment(0, Verdict.NO_STRONG_SIGNALS, Map.of(), List.of(), true);

        assertTrue(IncidentReportGenerator.recommendation(empty).contains("Rescan later"));
    }

    @Test
    void shouldMapScoresToSeverity() {
        assertEquals(Severity.LOW, Severity.of(29));
        assertEquals(Severity.MEDIUM, Severity.of(30));
        assertEquals(Severity.HIGH, Severity.of(60));
        assertEquals(Severity.HIGH, Severity.of(84));
        assertEquals(Severity.CRITICAL, Severity.of(85));
    }
}
