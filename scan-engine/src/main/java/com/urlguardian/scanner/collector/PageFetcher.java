package com.urlguardian.scanner.collector;

import com.urlguardian.scanner.config.ScannerConfig;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Downloads a page body with a hard size cap. Redirects are followed hop by
 * hop, up to the configured limit, so the snapshot carries the URL the page
 * was finally served from.
 *
 * @author URL Guardian Team
 */
@Component
public class PageFetcher {

    private final WebClient webClient;
    private final int maxBytes;
    private final int maxRedirects;

    public PageFetcher(WebClient.Builder webClientBuilder, ScannerConfig config) {
        this.maxBytes = config.getMaxPageBytes();
        this.maxRedirects = config.getRedirects().getMaxHops();
        this.webClient = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(false)))
                .defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent())
                .build();
    }

    /**
     * Fetch the page. Bodies larger than the limit are cut off and the
     * connection released early.
     */
    public Mono<PageSnapshot> fetch(String url) {
        return fetch(URI.create(url), maxRedirects);
    }

    private Mono<PageSnapshot> fetch(URI uri, int redirectsLeft) {
        return webClient.get()
                .uri(uri)
                .exchangeToMono(response -> {
                    String location = response.headers().asHttpHeaders().getFirst(HttpHeaders.LOCATION);
                    if (response.statusCode().is3xxRedirection() && location != null && redirectsLeft > 0) {
                        return response.releaseBody().thenReturn(Hop.redirect(uri.resolve(location.trim())));
                    }
                    return readBounded(response, maxBytes)
                            .map(body -> Hop.page(new PageSnapshot(uri.toString(), response.statusCode().value(),
                                    headersOf(response), body.text(), body.truncated())));
                })
                .flatMap(hop -> hop.page() != null
                        ? Mono.just(hop.page())
                        : fetch(hop.next(), redirectsLeft - 1));
    }

    static Mono<Body> readBounded(ClientResponse response, int maxBytes) {
        return DataBufferUtils.join(
                        DataBufferUtils.takeUntilByteCount(response.bodyToFlux(DataBuffer.class), maxBytes))
                .map(buffer -> {
                    try {
                        boolean truncated = buffer.readableByteCount() >= maxBytes;
                        return new Body(buffer.toString(StandardCharsets.UTF_8), truncated);
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .defaultIfEmpty(new Body("", false));
    }

    static Map<String, String> headersOf(ClientResponse response) {
        Map<String, String> headers = new HashMap<>();
        response.headers().asHttpHeaders().forEach((name, values) -> {
            if (!values.isEmpty()) {
                headers.put(name.toLowerCase(Locale.ROOT), values.get(0));
            }
        });
        return headers;
    }

    record Body(String text, boolean truncated) {
    }

    private record Hop(URI next, PageSnapshot page) {

        static Hop redirect(URI next) {
            return new Hop(next, null);
        }

        static Hop page(PageSnapshot page) {
            return new Hop(null, page);
        }
    }
}
