package com.urlguardian.scanner.feature;

import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses and normalizes a raw URL and derives its {@link UrlFeatures}.
 *
 * <p>
 * Pure and synchronous: no network access, and the same input always yields
 * equal features. IP-literal detection runs on the host actually used for the
 * connection, so {@code http://1.2.3.4@evil.tk/} is not an IP URL; the
 * {@code @} is reported through {@link UrlFeatures#hasAt()} instead.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
public class UrlFeatureExtractor {

    private static final Pattern DOTTED_QUAD = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private final HeuristicDictionary dictionary;

    public UrlFeatureExtractor(HeuristicDictionary dictionary) {
        this.dictionary = dictionary;
    }

    /**
     * Extract structural features.
     *
     * @param rawUrl user-supplied URL, scheme optional
     * @return the derived features
     * @throws InvalidUrlException if the input cannot be parsed or has no host
     */
    public UrlFeatures extract(String rawUrl) {
        URI uri = normalize(rawUrl);

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = resolveHost(uri, rawUrl);
        String rawPath = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        String path = uri.getRawQuery() == null ? rawPath : rawPath + "?" + uri.getRawQuery();

        StringBuilder full = new StringBuilder(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            full.append(uri.getRawUserInfo()).append('@');
        }
        full.append(host);
        if (uri.getPort() != -1) {
            full.append(':').append(uri.getPort());
        }
        full.append(path);
        if (uri.getRawFragment() != null) {
            full.append('#').append(uri.getRawFragment());
        }
        String fullUrl = full.toString();

        String pathLower = path.toLowerCase(Locale.ROOT);
        List<String> keywordHits = new ArrayList<>();
        for (String keyword : dictionary.sensitiveKeywords()) {
            if (pathLower.contains(keyword) || host.contains(keyword)) {
                keywordHits.add(keyword);
            }
        }

        int lastDot = host.lastIndexOf('.');
        String tld = lastDot >= 0 ? host.substring(lastDot + 1) : host;

        String brand = null;
        for (String candidate : dictionary.brands()) {
            if (host.contains(candidate) && !host.endsWith(candidate + ".com")) {
                brand = candidate;
                break;
            }
        }

        return new UrlFeatures(
                fullUrl,
                host,
                path,
                DOTTED_QUAD.matcher(host).matches(),
                fullUrl.indexOf('@') >= 0,
                (int) host.chars().filter(c -> c == '.').count(),
                fullUrl.length(),
                keywordHits,
                tld,
                dictionary.suspiciousTlds().contains(tld),
                brand);
    }

    /** Trim and default the scheme to https, then parse. */
    static URI normalize(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new InvalidUrlException(String.valueOf(rawUrl), "empty input");
        }
        String input = rawUrl.trim();
        String lower = input.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            input = "https://" + input;
        }
        try {
            return new URI(input);
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(rawUrl, e.getReason(), e);
        }
    }

    /**
     * {@link URI#getHost()} is null for registry-based authorities (for
     * example hosts with underscores); fall back to the raw authority with the
     * user-info and port stripped.
     */
    private static String resolveHost(URI uri, String rawUrl) {
        String host = uri.getHost();
        if (host == null && uri.getRawAuthority() != null) {
            String authority = uri.getRawAuthority();
            int at = authority.lastIndexOf('@');
            if (at >= 0) {
                authority = authority.substring(at + 1);
            }
            int colon = authority.lastIndexOf(':');
            if (colon >= 0 && !authority.endsWith("]")) {
                authority = authority.substring(0, colon);
            }
            host = authority;
        }
        if (host == null || host.isBlank()) {
            throw new InvalidUrlException(rawUrl, "no host");
        }
        return host.toLowerCase(Locale.ROOT);
    }
}
