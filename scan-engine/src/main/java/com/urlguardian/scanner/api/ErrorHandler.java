package com.urlguardian.scanner.api;

import com.urlguardian.scanner.feature.InvalidUrlException;
import com.urlguardian.scanner.incident.DuplicateIncidentException;
import com.urlguardian.scanner.incident.UnknownIncidentException;
import com.urlguardian.scanner.scan.ScanDeadlineExceededException;
import com.urlguardian.scanner.threatintel.InvalidEmailException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps pipeline exceptions to {@code {code, message}} error bodies.
 *
 * @author URL Guardian Team
 */
@RestControllerAdvice
public class ErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ErrorHandler.class);

    @ExceptionHandler(InvalidUrlException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidUrl(InvalidUrlException ex) {
        return Map.of(
                "code", "INVALID_URL",
                "message", ex.getMessage());
    }

    @ExceptionHandler(InvalidEmailException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidEmail(InvalidEmailException ex) {
        return Map.of(
                "code", "INVALID_EMAIL",
                "message", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException ex) {
        return Map.of(
                "code", "INVALID_REQUEST",
                "message", String.valueOf(ex.getMessage()));
    }

    @ExceptionHandler(UnknownIncidentException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleUnknownIncident(UnknownIncidentException ex) {
        return Map.of(
                "code", "UNKNOWN_INCIDENT",
                "message", ex.getMessage());
    }

    @ExceptionHandler(DuplicateIncidentException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleDuplicateIncident(DuplicateIncidentException ex) {
        log.error("Incident store integrity failure: {}", ex.getMessage());
        return Map.of(
                "code", "DUPLICATE_INCIDENT",
                "message", ex.getMessage());
    }

    @ExceptionHandler(ScanDeadlineExceededException.class)
    @ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
    public Map<String, Object> handleDeadline(ScanDeadlineExceededException ex) {
        return Map.of(
                "code", "SCAN_DEADLINE_EXCEEDED",
                "message", ex.getMessage());
    }
}
