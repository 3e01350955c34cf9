package com.urlguardian.scanner.signal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Error boundary shared by every network-backed collector.
 *
 * <p>
 * Applies the collector's time budget and converts any error into
 * {@link SignalResult.Unavailable}. Nothing emitted by a guarded publisher
 * can fail the subscriber.
 * </p>
 *
 * @author URL Guardian Team
 */
public final class CollectorGuard {

    private static final Logger log = LoggerFactory.getLogger(CollectorGuard.class);

    private CollectorGuard() {
    }

    public static <T> Mono<SignalResult<T>> guard(SignalSource source, Mono<SignalResult<T>> call, Duration timeout) {
        return Mono.defer(() -> call)
                .timeout(timeout)
                .switchIfEmpty(Mono.fromSupplier(() -> SignalResult.unavailable(source, "no response")))
                .onErrorResume(e -> {
                    String reason = describe(e, timeout);
                    log.warn("Collector {} unavailable: {}", source.wireName(), reason);
                    return Mono.just(SignalResult.unavailable(source, reason));
                });
    }

    static String describe(Throwable e, Duration timeout) {
        if (e instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + "ms";
        }
        if (e instanceof WebClientResponseException wcre) {
            return "upstream returned HTTP " + wcre.getStatusCode().value();
        }
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : message;
    }
}
