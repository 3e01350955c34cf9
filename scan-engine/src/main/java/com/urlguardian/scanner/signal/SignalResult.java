package com.urlguardian.scanner.signal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Optional;

/**
 * Outcome of one collector invocation: either a value with a confidence, or a
 * typed soft failure.
 *
 * @param <T> collector-specific payload
 * @author URL Guardian Team
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "status")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SignalResult.Available.class, name = "available"),
        @JsonSubTypes.Type(value = SignalResult.Unavailable.class, name = "unavailable")
})
public interface SignalResult<T> {

    SignalSource source();

    @JsonIgnore
    default boolean isAvailable() {
        return this instanceof Available;
    }

    /** The payload when the source answered. */
    @JsonIgnore
    default Optional<T> value() {
        if (this instanceof Available<T> available) {
            return Optional.of(available.data());
        }
        return Optional.empty();
    }

    static <T> SignalResult<T> available(SignalSource source, T data, double confidence) {
        return new Available<>(source, data, Math.min(1.0, Math.max(0.0, confidence)));
    }

    static <T> SignalResult<T> unavailable(SignalSource source, String reason) {
        return new Unavailable<>(source, reason == null || reason.isBlank() ? "unknown error" : reason);
    }

    /**
     * The source answered.
     *
     * @param confidence how much of the source's data was actually obtained, in [0.0, 1.0]
     */
    record Available<T>(SignalSource source, T data, double confidence) implements SignalResult<T> {
    }

    /** The source failed, timed out or was not applicable. */
    record Unavailable<T>(SignalSource source, String reason) implements SignalResult<T> {
    }
}
