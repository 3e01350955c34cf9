package com.urlguardian.scanner.threatintel;

import java.util.regex.Pattern;

/**
 * Email validation and masking for log output.
 *
 * @author URL Guardian Team
 */
public final class EmailAddresses {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private EmailAddresses() {
    }

    /**
     * @return the trimmed address
     * @throws InvalidEmailException if the input is blank or malformed
     */
    public static String requireValid(String email) {
        if (email == null || email.isBlank()) {
            throw new InvalidEmailException("email is required");
        }
        String trimmed = email.trim();
        if (!EMAIL.matcher(trimmed).matches()) {
            throw new InvalidEmailException("not a valid email address: " + mask(trimmed));
        }
        return trimmed;
    }

    /** {@code alice@example.com} becomes {@code a***@example.com}. */
    public static String mask(String email) {
        int at = email.indexOf('@');
        if (at <= 0) {
            return "***";
        }
        return email.charAt(0) + "***" + email.substring(at);
    }
}
