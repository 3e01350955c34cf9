package com.urlguardian.scanner.incident;

import java.util.List;
import java.util.Optional;

/**
 * Append-only incident persistence, keyed by incident id.
 *
 * <p>
 * Implementations must be safe under concurrent saves and must never replace
 * an existing record.
 * </p>
 *
 * @author URL Guardian Team
 */
public interface IncidentStore {

    /**
     * Atomically store a report if its id is free.
     *
     * @throws DuplicateIncidentException if the id is already stored
     */
    void save(IncidentReport report);

    Optional<IncidentReport> findById(String id);

    default boolean exists(String id) {
        return findById(id).isPresent();
    }

    /** Newest first. */
    List<IncidentReport> recent(int limit);
}
