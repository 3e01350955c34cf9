package com.urlguardian.scanner.threatintel;

import com.urlguardian.scanner.config.ThreatIntelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * OpenPhish community feed client.
 *
 * <p>
 * The feed is a plain-text list of phishing URLs. It is downloaded at most
 * once per refresh interval and replaced atomically; lookups read an
 * immutable snapshot and never mutate it.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
public class OpenPhishFeedClient {

    private static final Logger log = LoggerFactory.getLogger(OpenPhishFeedClient.class);

    static final String SOURCE = "OpenPhish";

    private final WebClient webClient;
    private final ThreatIntelConfig.OpenPhish config;
    private final AtomicReference<FeedSnapshot> snapshot = new AtomicReference<>();

    public OpenPhishFeedClient(ThreatIntelConfig threatIntelConfig, WebClient.Builder webClientBuilder) {
        this.config = threatIntelConfig.getOpenPhish();
        this.webClient = webClientBuilder.baseUrl(config.getBaseUrl()).build();
    }

    /**
     * Immutable view of one feed download.
     *
     * @param urls  lower-cased feed entries
     * @param hosts lower-cased hosts of the feed entries
     */
    record FeedSnapshot(Set<String> urls, Set<String> hosts, Instant loadedAt) {

        static FeedSnapshot parse(String body, Instant loadedAt) {
            Set<String> urls = new HashSet<>();
            Set<String> hosts = new HashSet<>();
            for (String line : body.split("\\R")) {
                String entry = line.trim().toLowerCase(Locale.ROOT);
                if (entry.isEmpty()) {
                    continue;
                }
                urls.add(entry);
                try {
                    String host = URI.create(entry).getHost();
                    if (host != null) {
                        hosts.add(host);
                    }
                } catch (IllegalArgumentException e) {
                    log.debug("Skipping unparseable OpenPhish entry host: {}", entry);
                }
            }
            return new FeedSnapshot(Set.copyOf(urls), Set.copyOf(hosts), loadedAt);
        }

        boolean contains(String url, String domain) {
            return urls.contains(url.toLowerCase(Locale.ROOT)) || hosts.contains(domain.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Check a URL against the feed. The exact URL or any feed entry on the
     * same host counts as a hit.
     */
    public Mono<SourceVote> lookupUrl(String url, String domain) {
        return currentSnapshot()
                .map(feed -> feed.contains(url, domain)
                        ? SourceVote.malicious(SOURCE, 90,
                                Map.of("threat_type", "PHISHING", "feed_size", feed.urls().size()))
                        : SourceVote.clean(SOURCE))
                .onErrorResume(e -> {
                    log.warn("OpenPhish check failed for {}: {}", url, e.getMessage());
                    return Mono.just(SourceVote.unknown(SOURCE, e.getMessage()));
                });
    }

    private Mono<FeedSnapshot> currentSnapshot() {
        FeedSnapshot current = snapshot.get();
        if (current != null) {
            return Mono.just(current);
        }
        return download();
    }

    @Scheduled(fixedDelayString = "${guardian.threat-intel.open-phish.refresh-interval-ms:3600000}",
            initialDelayString = "${guardian.threat-intel.open-phish.refresh-interval-ms:3600000}")
    public void refresh() {
        download().subscribe(
                feed -> log.info("OpenPhish feed refreshed: {} entries", feed.urls().size()),
                e -> log.warn("OpenPhish feed refresh failed: {}", e.getMessage()));
    }

    Mono<FeedSnapshot> download() {
        return webClient.get()
                .uri("/feed.txt")
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .timeout(Duration.ofMillis(config.getTimeoutMs()))
                .map(body -> FeedSnapshot.parse(body, Instant.now()))
                .doOnNext(snapshot::set);
    }
}
