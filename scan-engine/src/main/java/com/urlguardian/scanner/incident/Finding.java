package com.urlguardian.scanner.incident;

/**
 * One red flag attributed to the source that raised it.
 *
 * @param riskScore the source's sub-score
 * @author URL Guardian Team
 */
public record Finding(String source, String description, int riskScore) {
}
