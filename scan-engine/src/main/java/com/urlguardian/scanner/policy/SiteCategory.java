package com.urlguardian.scanner.policy;

import java.util.List;

/**
 * Kind of site a URL points at, independent of its risk.
 *
 * @param category      e.g. {@code banking}, {@code social}, {@code unknown}
 * @param confidence    keyword-match confidence
 * @param subcategories finer labels of the matched rule
 * @author URL Guardian Team
 */
public record SiteCategory(String category, double confidence, List<String> subcategories) {

    public static final String UNKNOWN = "unknown";

    public SiteCategory {
        subcategories = List.copyOf(subcategories);
    }

    static SiteCategory unknown() {
        return new SiteCategory(UNKNOWN, 0.5, List.of());
    }
}
