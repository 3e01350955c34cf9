package com.urlguardian.scanner.feature;

/**
 * Input could not be parsed as a URL, even after defaulting the scheme.
 *
 * @author URL Guardian Team
 */
public class InvalidUrlException extends RuntimeException {

    private final String input;

    public InvalidUrlException(String input, String reason) {
        super("Invalid URL '" + input + "': " + reason);
        this.input = input;
    }

    public InvalidUrlException(String input, String reason, Throwable cause) {
        super("Invalid URL '" + input + "': " + reason, cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
