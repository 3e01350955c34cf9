package com.urlguardian.scanner.feature;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structural features derived once per scan from a normalized URL.
 *
 * @param fullUrl            normalized URL (scheme defaulted to https, host lower-cased)
 * @param domain             host used for the connection, after any user-info
 * @param path               path plus query string
 * @param isIp               host is a dotted-quad literal
 * @param hasAt              the URL contains {@code @}
 * @param numDots            dots in the host
 * @param urlLength          length of {@code fullUrl}
 * @param keywordHits        matched sensitive terms, in dictionary order
 * @param tld                last dot-segment of the host
 * @param tldSuspicious      the TLD is in the suspicious set
 * @param brandImpersonation first brand contained in the host whose official
 *                           {@code <brand>.com} it is not, or null
 * @author URL Guardian Team
 */
public record UrlFeatures(
        String fullUrl,
        String domain,
        String path,
        @JsonProperty("isIp") boolean isIp,
        @JsonProperty("hasAt") boolean hasAt,
        int numDots,
        int urlLength,
        List<String> keywordHits,
        String tld,
        boolean tldSuspicious,
        String brandImpersonation) {

    public UrlFeatures {
        keywordHits = List.copyOf(keywordHits);
    }

    @JsonIgnore
    public boolean isHttps() {
        return fullUrl.startsWith("https://");
    }
}
