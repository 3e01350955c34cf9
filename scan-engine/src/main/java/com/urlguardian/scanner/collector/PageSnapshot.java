package com.urlguardian.scanner.collector;

import java.util.Locale;
import java.util.Map;

/**
 * One fetched page, shared by the content scanner, form inspector and TLS
 * header audit so that a scan downloads the page only once.
 *
 * @param url        the URL the page was served from, after redirects
 * @param statusCode final HTTP status
 * @param headers    response headers, lower-cased names, first value only
 * @param html       body text, possibly truncated
 * @param truncated  the body exceeded the configured size limit
 * @author URL Guardian Team
 */
public record PageSnapshot(String url, int statusCode, Map<String, String> headers, String html,
        boolean truncated) {

    public PageSnapshot {
        headers = Map.copyOf(headers);
    }

    public boolean hasHeader(String name) {
        return headers.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }
}
