package com.urlguardian.scanner.scan;

import java.time.Duration;

/**
 * Thrown when a scan does not settle within the global deadline. In-flight
 * collector calls have been cancelled by then.
 *
 * @author URL Guardian Team
 */
public class ScanDeadlineExceededException extends RuntimeException {

    public ScanDeadlineExceededException(String url, Duration deadline, Throwable cause) {
        super("Scan of " + url + " exceeded the " + deadline.toMillis() + "ms deadline", cause);
    }
}
