package com.urlguardian.scanner.config;

import com.urlguardian.scanner.signal.SignalSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scan pipeline configuration: time budgets, collector limits, aggregation
 * weights and verdict thresholds.
 *
 * <p>
 * Bound once at start-up and handed to each collector by constructor
 * injection.
 * </p>
 *
 * @author URL Guardian Team
 */
@Validated
@ConfigurationProperties(prefix = "guardian.scanner")
public class ScannerConfig {

    /** Deadline for a whole comprehensive scan, after which in-flight collectors are cancelled. */
    @Min(1000)
    private int scanDeadlineMs = 20_000;

    /** Default per-collector time budget. */
    @Min(100)
    private int collectorTimeoutMs = 8_000;

    @NotBlank
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 URLGuardian/1.0";

    @Min(1024)
    private int maxPageBytes = 1_048_576;

    @Valid
    private Redirects redirects = new Redirects();
    @Valid
    private Whois whois = new Whois();
    @Valid
    private Tls tls = new Tls();
    @Valid
    private Verdicts verdicts = new Verdicts();

    /** Aggregation weight per signal source, keyed by wire name. */
    private Map<String, Integer> weights = defaultWeights();

    private static Map<String, Integer> defaultWeights() {
        Map<String, Integer> weights = new LinkedHashMap<>();
        weights.put(SignalSource.URL_STRUCTURE.wireName(), 25);
        weights.put(SignalSource.REDIRECTS.wireName(), 10);
        weights.put(SignalSource.PAGE_CONTENT.wireName(), 15);
        weights.put(SignalSource.FORMS.wireName(), 10);
        weights.put(SignalSource.TLS.wireName(), 10);
        weights.put(SignalSource.REPUTATION.wireName(), 30);
        weights.put(SignalSource.WHOIS.wireName(), 15);
        weights.put(SignalSource.IP_RISK.wireName(), 10);
        weights.put(SignalSource.BREACH.wireName(), 10);
        return weights;
    }

    public Duration scanDeadline() {
        return Duration.ofMillis(scanDeadlineMs);
    }

    public Duration collectorTimeout() {
        return Duration.ofMillis(collectorTimeoutMs);
    }

    public int getScanDeadlineMs() {
        return scanDeadlineMs;
    }

    public void setScanDeadlineMs(int scanDeadlineMs) {
        this.scanDeadlineMs = scanDeadlineMs;
    }

    public int getCollectorTimeoutMs() {
        return collectorTimeoutMs;
    }

    public void setCollectorTimeoutMs(int collectorTimeoutMs) {
        this.collectorTimeoutMs = collectorTimeoutMs;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public int getMaxPageBytes() {
        return maxPageBytes;
    }

    public void setMaxPageBytes(int maxPageBytes) {
        this.maxPageBytes = maxPageBytes;
    }

    public Redirects getRedirects() {
        return redirects;
    }

    public void setRedirects(Redirects redirects) {
        this.redirects = redirects;
    }

    public Whois getWhois() {
        return whois;
    }

    public void setWhois(Whois whois) {
        this.whois = whois;
    }

    public Tls getTls() {
        return tls;
    }

    public void setTls(Tls tls) {
        this.tls = tls;
    }

    public Verdicts getVerdicts() {
        return verdicts;
    }

    public void setVerdicts(Verdicts verdicts) {
        this.verdicts = verdicts;
    }

    public Map<String, Integer> getWeights() {
        return weights;
    }

    public void setWeights(Map<String, Integer> weights) {
        this.weights = weights;
    }

    public static class Redirects {
        @Min(1)
        private int maxHops = 10;
        /** Chains longer than this are flagged as excessive. */
        @Min(1)
        private int excessiveAfter = 5;

        public int getMaxHops() {
            return maxHops;
        }

        public void setMaxHops(int maxHops) {
            this.maxHops = maxHops;
        }

        public int getExcessiveAfter() {
            return excessiveAfter;
        }

        public void setExcessiveAfter(int excessiveAfter) {
            this.excessiveAfter = excessiveAfter;
        }
    }

    public static class Whois {
        @Min(1)
        private int newDomainDays = 30;
        @Min(1)
        private int recentDomainDays = 90;
        @Min(1)
        private int youngDomainDays = 365;

        public int getNewDomainDays() {
            return newDomainDays;
        }

        public void setNewDomainDays(int newDomainDays) {
            this.newDomainDays = newDomainDays;
        }

        public int getRecentDomainDays() {
            return recentDomainDays;
        }

        public void setRecentDomainDays(int recentDomainDays) {
            this.recentDomainDays = recentDomainDays;
        }

        public int getYoungDomainDays() {
            return youngDomainDays;
        }

        public void setYoungDomainDays(int youngDomainDays) {
            this.youngDomainDays = youngDomainDays;
        }
    }

    public static class Tls {
        @Min(1)
        private int port = 443;
        @Min(1)
        private int expiryWarningDays = 30;
        @Min(1)
        private int newCertificateDays = 7;

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getExpiryWarningDays() {
            return expiryWarningDays;
        }

        public void setExpiryWarningDays(int expiryWarningDays) {
            this.expiryWarningDays = expiryWarningDays;
        }

        public int getNewCertificateDays() {
            return newCertificateDays;
        }

        public void setNewCertificateDays(int newCertificateDays) {
            this.newCertificateDays = newCertificateDays;
        }
    }

    /**
     * The two verdict policies. The score-band policy is used by the
     * multi-source scan, the flag-count policy by the URL-only analysis.
     */
    public static class Verdicts {
        @Min(0)
        private int suspiciousScore = 30;
        @Min(0)
        private int likelyPhishingScore = 60;
        @Min(1)
        private int suspiciousFlags = 1;
        @Min(1)
        private int likelyPhishingFlags = 2;

        public int getSuspiciousScore() {
            return suspiciousScore;
        }

        public void setSuspiciousScore(int suspiciousScore) {
            this.suspiciousScore = suspiciousScore;
        }

        public int getLikelyPhishingScore() {
            return likelyPhishingScore;
        }

        public void setLikelyPhishingScore(int likelyPhishingScore) {
            this.likelyPhishingScore = likelyPhishingScore;
        }

        public int getSuspiciousFlags() {
            return suspiciousFlags;
        }

        public void setSuspiciousFlags(int suspiciousFlags) {
            this.suspiciousFlags = suspiciousFlags;
        }

        public int getLikelyPhishingFlags() {
            return likelyPhishingFlags;
        }

        public void setLikelyPhishingFlags(int likelyPhishingFlags) {
            this.likelyPhishingFlags = likelyPhishingFlags;
        }
    }
}
