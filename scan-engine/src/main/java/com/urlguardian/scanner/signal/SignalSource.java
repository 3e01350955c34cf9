package com.urlguardian.scanner.signal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Identity of one independent signal source.
 *
 * <p>
 * Declaration order is the collector invocation order, which fixes the order
 * of red flags in an aggregated assessment.
 * </p>
 *
 * @author URL Guardian Team
 */
public enum SignalSource {

    URL_STRUCTURE("url_structure", Layer.A),
    REDIRECTS("redirects", Layer.A),
    PAGE_CONTENT("page_content", Layer.A),
    FORMS("forms", Layer.A),
    TLS("tls", Layer.A),
    REPUTATION("reputation", Layer.B),
    WHOIS("whois", Layer.B),
    IP_RISK("ip_risk", Layer.B),
    BREACH("breach", Layer.B);

    /** Pipeline layer a source belongs to: A is URL/page structure, B is threat intelligence. */
    public enum Layer {
        A, B
    }

    private final String wireName;
    private final Layer layer;

    SignalSource(String wireName, Layer layer) {
        this.wireName = wireName;
        this.layer = layer;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Layer layer() {
        return layer;
    }

    @JsonCreator
    public static SignalSource fromWireName(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown signal source: " + name));
    }

    public static Optional<SignalSource> find(String name) {
        for (SignalSource source : values()) {
            if (source.wireName.equals(name)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }
}
