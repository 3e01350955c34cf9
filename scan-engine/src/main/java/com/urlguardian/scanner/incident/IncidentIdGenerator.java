package com.urlguardian.scanner.incident;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates incident ids of the form
 * {@code INC-<epoch millis, 13 digits>-<sequence, 6 digits>-<random suffix>}.
 *
 * <p>
 * Ids sort lexicographically in generation order within a process; the random
 * suffix separates ids generated by different processes in the same
 * millisecond.
 * </p>
 *
 * @author URL Guardian Team
 */
@Component
public class IncidentIdGenerator {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 6;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final AtomicLong sequence = new AtomicLong();

    public IncidentIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextId() {
        long seq = sequence.getAndIncrement() % 1_000_000;
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return String.format("INC-%013d-%06d-%s", clock.millis(), seq, suffix);
    }

    static boolean isWellFormed(String id) {
        return id != null && id.matches("INC-\\d{13}-\\d{6}-[0-9a-z]{" + SUFFIX_LENGTH + "}");
    }
}
