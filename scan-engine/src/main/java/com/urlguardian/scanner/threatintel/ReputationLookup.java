package com.urlguardian.scanner.threatintel;

import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.feature.HeuristicDictionary;
import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.signal.CollectorGuard;
import com.urlguardian.scanner.signal.SignalResult;
import com.urlguardian.scanner.signal.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Aggregates reputation votes from OpenPhish, Google Safe Browsing and
 * VirusTotal into one consensus.
 *
 * <p>
 * Any malicious vote dominates; otherwise any suspicious vote raises the
 * floor. Sources that did not answer are left out of the consensus, and the
 * collector itself is unavailable only when none of them answered.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
public class ReputationLookup {

    private static final Logger log = LoggerFactory.getLogger(ReputationLookup.class);

    /** Score floor applied when the strongest vote is {@code suspicious}. */
    static final int SUSPICIOUS_FLOOR = 50;

    private final OpenPhishFeedClient openPhish;
    private final SafeBrowsingClient safeBrowsing;
    private final VirusTotalClient virusTotal;
    private final HeuristicDictionary dictionary;
    private final ScannerConfig config;

    public ReputationLookup(OpenPhishFeedClient openPhish, SafeBrowsingClient safeBrowsing,
            VirusTotalClient virusTotal, HeuristicDictionary dictionary, ScannerConfig config) {
        this.openPhish = openPhish;
        this.safeBrowsing = safeBrowsing;
        this.virusTotal = virusTotal;
        this.dictionary = dictionary;
        this.config = config;
    }

    public Mono<SignalResult<ReputationCheck>> collect(UrlFeatures features) {
        String url = features.fullUrl();
        Mono<SignalResult<ReputationCheck>> call = Mono.zip(
                        openPhish.lookupUrl(url, features.domain()),
                        safeBrowsing.lookupUrl(url),
                        virusTotal.lookupUrl(url))
                .map(votes -> combine(features, List.of(votes.getT1(), votes.getT2(), votes.getT3())));
        return CollectorGuard.guard(SignalSource.REPUTATION, call, config.collectorTimeout());
    }

    SignalResult<ReputationCheck> combine(UrlFeatures features, List<SourceVote> votes) {
        long answered = votes.stream().filter(v -> v.status() != SourceVote.Status.UNKNOWN).count();
        if (answered == 0) {
            return SignalResult.unavailable(SignalSource.REPUTATION, "no reputation source answered");
        }

        SourceVote.Status verdict = consensus(votes);
        List<String> flags = new ArrayList<>();
        int score = 0;

        for (SourceVote vote : votes) {
            if (vote.status() == SourceVote.Status.MALICIOUS || vote.status() == SourceVote.Status.SUSPICIOUS) {
                flags.add(flagFor(vote));
            }
        }
        if (verdict == SourceVote.Status.MALICIOUS) {
            score = votes.stream()
                    .filter(v -> v.status() == SourceVote.Status.MALICIOUS)
                    .mapToInt(SourceVote::score)
                    .max()
                    .orElse(0);
        } else if (verdict == SourceVote.Status.SUSPICIOUS) {
            score = SUSPICIOUS_FLOOR;
        }

        if (dictionary.reputation().lowReputationTlds().contains(features.tld())) {
            flags.add("suspicious_tld");
            score += 20;
        }

        log.debug("Reputation consensus for {}: {} ({} of {} sources answered)",
                features.fullUrl(), verdict.wireName(), answered, votes.size());
        ReputationCheck check = new ReputationCheck(features.fullUrl(), features.domain(), votes, verdict, flags,
                Math.min(score, 100));
        return SignalResult.available(SignalSource.REPUTATION, check, (double) answered / votes.size());
    }

    /**
     * Consensus over the answering sources: malicious dominates, then
     * suspicious, then clean. Returns {@code unknown} when nobody answered.
     */
    static SourceVote.Status consensus(List<SourceVote> votes) {
        SourceVote.Status result = SourceVote.Status.UNKNOWN;
        for (SourceVote vote : votes) {
            switch (vote.status()) {
                case MALICIOUS -> {
                    return SourceVote.Status.MALICIOUS;
                }
                case SUSPICIOUS -> result = SourceVote.Status.SUSPICIOUS;
                case CLEAN -> {
                    if (result == SourceVote.Status.UNKNOWN) {
                        result = SourceVote.Status.CLEAN;
                    }
                }
                default -> {
                }
            }
        }
        return result;
    }

    private static String flagFor(SourceVote vote) {
        String source = vote.source().toLowerCase(Locale.ROOT).replace(' ', '_');
        Object threatType = vote.details().get("threat_type");
        if (threatType != null) {
            return source + "_" + threatType.toString().toLowerCase(Locale.ROOT);
        }
        return source + "_" + vote.status().wireName();
    }
}
