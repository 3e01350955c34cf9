package com.urlguardian.scanner.collector;

import com.urlguardian.scanner.config.ScannerConfig;
import com.urlguardian.scanner.feature.HeuristicDictionary;
import com.urlguardian.scanner.feature.UrlFeatures;
import com.urlguardian.scanner.signal.CollectorGuard;
import com.urlguardian.scanner.signal.SignalResult;
import com.urlguardian.scanner.signal.SignalSource;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Follows a URL's redirect chain hop by hop, up to a bounded hop count.
 *
 * <p>
 * Detection heuristics:
 * </p>
 * <ul>
 * <li>Redirect loops and chains longer than the excessive threshold</li>
 * <li>HTTPS to HTTP downgrades</li>
 * <li>Redirects to raw IP addresses</li>
 * <li>Geo-targeted redirect headers</li>
 * <li>{@code <meta http-equiv="refresh">} redirects</li>
 * <li>Cross-domain redirects, and redirects that land on a host not owned by
 * the brand in either end of the chain</li>
 * </ul>
 *
 * @author URL Guardian Team
 */
@Component
public class RedirectAnalyzer {

    private static final Pattern IP_LITERAL = Pattern.compile("\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}");
    private static final Pattern META_REFRESH_TARGET =
            Pattern.compile("^\\s*\\d+\\s*;\\s*url\\s*=\\s*['\"]?([^'\"]+)['\"]?", Pattern.CASE_INSENSITIVE);

    /** Only the head of a non-redirect page is inspected for meta refresh. */
    private static final int META_SCAN_BYTES = 64 * 1024;

    private final WebClient webClient;
    private final ScannerConfig config;
    private final HeuristicDictionary dictionary;

    public RedirectAnalyzer(WebClient.Builder webClientBuilder, ScannerConfig config,
            HeuristicDictionary dictionary) {
        this.config = config;
        this.dictionary = dictionary;
        // WebClient does not follow redirects unless told to; every hop is observed here.
        this.webClient = webClientBuilder
                .defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent())
                .build();
    }

    public Mono<SignalResult<RedirectAnalysis>> collect(UrlFeatures features) {
        Mono<SignalResult<RedirectAnalysis>> call = Mono.defer(() -> {
            Chain chain = new Chain(features.fullUrl());
            return step(chain, features.fullUrl())
                    .then(Mono.fromSupplier(() -> SignalResult.available(
                            SignalSource.REDIRECTS, finish(chain, features), 1.0)));
        });
        return CollectorGuard.guard(SignalSource.REDIRECTS, call, config.collectorTimeout());
    }

    private Mono<Void> step(Chain chain, String url) {
        if (chain.hops.size() >= config.getRedirects().getMaxHops()) {
            chain.flag("max_redirects_reached", 20);
            return Mono.empty();
        }
        if (!chain.seen.add(url)) {
            chain.flag("redirect_loop_detected", 30);
            return Mono.empty();
        }

        return webClient.get()
                .uri(URI.create(url))
                .exchangeToMono(response -> {
                    int status = response.statusCode().value();
                    HttpHeaders headers = response.headers().asHttpHeaders();
                    String location = headers.getFirst(HttpHeaders.LOCATION);
                    boolean isRedirect = status >= 300 && status < 400 && location != null;

                    chain.hops.add(new RedirectAnalysis.Hop(url, status, isRedirect ? "http" : "none", location));
                    inspectHeaders(chain, url, location, headers);

                    if (isRedirect) {
                        return Mono.just(Optional.of(resolve(url, location)));
                    }
                    return PageFetcher.readBounded(response, META_SCAN_BYTES)
                            .map(body -> {
                                Optional<String> target = metaRefreshTarget(body.text(), url);
                                target.ifPresent(chain::markMetaRefresh);
                                return target;
                            });
                })
                .flatMap(next -> next.map(target -> step(chain, target)).orElseGet(Mono::empty));
    }

    private void inspectHeaders(Chain chain, String url, String location, HttpHeaders headers) {
        if (location != null) {
            if (url.startsWith("https://") && location.startsWith("http://")) {
                chain.flag("https_to_http_downgrade", 40);
            }
            if (IP_LITERAL.matcher(location).find()) {
                chain.flag("ip_based_redirect", 25);
            }
        }
        if (headers.containsKey("x-geo-redirect") || headers.containsKey("cf-geo-redirect")) {
            chain.flag("geo_based_redirect", 10);
        }
    }

    private Optional<String> metaRefreshTarget(String html, String pageUrl) {
        if (html.isEmpty()) {
            return Optional.empty();
        }
        Element meta = Jsoup.parse(html, pageUrl).selectFirst("meta[http-equiv=refresh]");
        if (meta == null) {
            return Optional.empty();
        }
        Matcher matcher = META_REFRESH_TARGET.matcher(meta.attr("content"));
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(resolve(pageUrl, matcher.group(1).trim()));
    }

    private RedirectAnalysis finish(Chain chain, UrlFeatures features) {
        if (chain.hops.size() > config.getRedirects().getExcessiveAfter()) {
            chain.flag("excessive_redirects", 20);
        }

        String finalUrl = chain.hops.isEmpty() ? chain.start : chain.hops.get(chain.hops.size() - 1).url();
        String startHost = features.domain();
        String finalHost = hostOf(finalUrl);

        if (finalHost != null && !baseDomain(startHost).equals(baseDomain(finalHost))) {
            chain.flag("cross_domain_redirect", 15);
            for (String brand : dictionary.brands()) {
                boolean branded = startHost.contains(brand) || finalHost.contains(brand);
                if (branded && !finalHost.endsWith(brand + ".com")) {
                    chain.flag("redirect_to_mismatched_brand", 35);
                    break;
                }
            }
        }

        return new RedirectAnalysis(chain.hops, finalUrl, new ArrayList<>(chain.flags),
                Math.min(chain.score, 100));
    }

    static String resolve(String base, String location) {
        return URI.create(base).resolve(location.trim().replace(" ", "%20")).toString();
    }

    static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** Last two labels of a host name; IP literals are returned as-is. */
    static String baseDomain(String host) {
        if (IP_LITERAL.matcher(host).matches()) {
            return host;
        }
        String[] labels = host.split("\\.");
        if (labels.length <= 2) {
            return host;
        }
        return labels[labels.length - 2] + "." + labels[labels.length - 1];
    }

    /** Mutable state of one chain walk; confined to a single collect() call. */
    private static final class Chain {
        private final String start;
        private final List<RedirectAnalysis.Hop> hops = new ArrayList<>();
        private final Set<String> seen = new HashSet<>();
        private final Set<String> flags = new LinkedHashSet<>();
        private int score;

        private Chain(String start) {
            this.start = start;
        }

        private void markMetaRefresh(String target) {
            RedirectAnalysis.Hop last = hops.remove(hops.size() - 1);
            hops.add(new RedirectAnalysis.Hop(last.url(), last.statusCode(), "meta", target));
            flag("meta_refresh_redirect", 15);
        }

        private void flag(String code, int weight) {
            if (flags.add(code)) {
                score += weight;
            }
        }
    }
}
