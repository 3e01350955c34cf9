package com.urlguardian.scanner.incident;

import com.urlguardian.scanner.config.IncidentConfig;
import com.urlguardian.scanner.metrics.ScannerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Records human feedback on incidents and computes accuracy statistics.
 *
 * @author URL Guardian Team
 */
@Service
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    private final FeedbackStore feedbackStore;
    private final IncidentStore incidentStore;
    private final IncidentConfig config;
    private final ScannerMetrics metrics;
    private final Clock clock;

    public FeedbackService(FeedbackStore feedbackStore, IncidentStore incidentStore, IncidentConfig config,
            ScannerMetrics metrics, Clock clock) {
        this.feedbackStore = feedbackStore;
        this.incidentStore = incidentStore;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @throws UnknownIncidentException if no stored incident has this id
     * @throws IllegalArgumentException  if the judgment is missing
     */
    public FeedbackRecord recordFeedback(String incidentId, Judgment judgment, String comment) {
        if (judgment == null) {
            throw new IllegalArgumentException("judgment is required");
        }
        if (!incidentStore.exists(incidentId)) {
            throw new UnknownIncidentException(incidentId);
        }
        FeedbackRecord record = new FeedbackRecord(
                "FB-" + UUID.randomUUID(), incidentId, judgment, comment, clock.instant());
        feedbackStore.append(record);
        metrics.feedbackRecorded();
        log.info("Feedback {} recorded for incident {}: {}", record.id(), incidentId, judgment.wireName());
        return record;
    }

    public FeedbackStats computeStats() {
        List<FeedbackRecord> records = feedbackStore.all();
        long total = records.size();
        long correct = count(records, Judgment.CORRECT);
        long falsePositives = count(records, Judgment.FALSE_POSITIVE);
        long falseNegatives = count(records, Judgment.FALSE_NEGATIVE);

        if (total == 0) {
            return new FeedbackStats(0, 0, 0, 0, null, FeedbackStats.NO_DATA, null, config.getRollingWindow());
        }

        double accuracy = (double) correct / total;
        List<FeedbackRecord> window = records.subList(
                Math.max(0, records.size() - config.getRollingWindow()), records.size());
        double rolling = (double) count(window, Judgment.CORRECT) / window.size();

        return new FeedbackStats(total, correct, falsePositives, falseNegatives, accuracy,
                String.format(Locale.ROOT, "%.1f%%", accuracy * 100), rolling, config.getRollingWindow());
    }

    private static long count(List<FeedbackRecord> records, Judgment judgment) {
        return records.stream().filter(r -> r.judgment() == judgment).count();
    }
}
