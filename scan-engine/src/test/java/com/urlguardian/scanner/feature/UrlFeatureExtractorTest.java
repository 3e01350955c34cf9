package com.urlguardian.scanner.feature;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UrlFeatureExtractorTest {

    private UrlFeatureExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new UrlFeatureExtractor(HeuristicDictionary.loadDefault());
    }

    @Test
    void shouldDefaultSchemeToHttps() {
        UrlFeatures features = extractor.extract("  Example.com  ");

        assertEquals("https://example.com/", features.fullUrl());
        assertEquals("example.com", features.domain());
        assertEquals("/", features.path());
        assertTrue(features.isHttps());
    }

    @Test
    void shouldReportCleanDomainWithoutHits() {
        UrlFeatures features = extractor.extract("https://example.com");

        assertFalse(features.isIp());
        assertFalse(features.hasAt());
        assertEquals(1, features.numDots());
        assertTrue(features.keywordHits().isEmpty());
        assertEquals("com", features.tld());
        assertFalse(features.tldSuspicious());
        assertNull(features.brandImpersonation());
    }

    @Test
    void shouldDetectUserInfoTrickWithoutTreatingItAsIpUrl() {
        UrlFeatures features = extractor.extract("http://192.168.1.1@paypal-login.tk/verify");

        assertEquals("paypal-login.tk", features.domain());
        assertTrue(features.hasAt());
        assertFalse(features.isIp());
        assertEquals(List.of("login", "verify"), features.keywordHits());
        assertEquals("tk", features.tld());
        assertTrue(features.tldSuspicious());
        assertEquals("paypal", features.brandImpersonation());
    }

    @Test
    void shouldDetectIpHost() {
        UrlFeatures features = extractor.extract("http://10.0.0.1/admin");

        assertTrue(features.isIp());
        assertEquals(3, features.numDots());
    }

    @Test
    void shouldNotFlagOfficialBrandDomain() {
        UrlFeatures features = extractor.extract("https://www.paypal.com/signin");

        assertNull(features.brandImpersonation());
        assertEquals(List.of("signin"), features.keywordHits());
    }

    @Test
    void shouldKeepQueryStringInPath() {
        UrlFeatures features = extractor.extract("https://shop.example.org/cart?item=42");

        assertEquals("/cart?item=42", features.path());
        assertEquals(features.fullUrl().length(), features.urlLength());
    }

    @Test
    void shouldBeIdempotent() {
        String raw = "HTTP://Secure-Update.Example.co.uk/account?id=7";

        assertEquals(extractor.extract(raw), extractor.extract(raw));
    }

    @Test
    void shouldRejectBlankInput() {
        assertThrows(InvalidUrlException.class, () -> extractor.extract("   "));
        assertThrows(InvalidUrlException.class, () -> extractor.extract(null));
    }

    @Test
    void shouldRejectUnparseableInput() {
        assertThrows(InvalidUrlException.class, () -> extractor.extract("http://exa mple.com/"));
    }
}
