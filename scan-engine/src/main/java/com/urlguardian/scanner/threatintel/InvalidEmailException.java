package com.urlguardian.scanner.threatintel;

/**
 * Thrown when a breach check is requested for something that is not an email
 * address.
 *
 * @author URL Guardian Team
 */
public class InvalidEmailException extends RuntimeException {

    public InvalidEmailException(String message) {
        super(message);
    }
}
