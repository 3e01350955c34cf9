package com.urlguardian.scanner.incident;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * {@link IncidentStore} kept in process memory, ordered by id.
 *
 * @author URL Guardian Team
 */
@Repository
@ConditionalOnProperty(prefix = "guardian.incidents", name = "store", havingValue = "memory")
public class InMemoryIncidentStore implements IncidentStore {

    // ids sort in generation order
    private final ConcurrentNavigableMap<String, IncidentReport> reports = new ConcurrentSkipListMap<>();

    @Override
    public void save(IncidentReport report) {
        if (reports.putIfAbsent(report.id(), report) != null) {
            throw new DuplicateIncidentException(report.id());
        }
    }

    @Override
    public Optional<IncidentReport> findById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(reports.get(id));
    }

    @Override
    public boolean exists(String id) {
        return id != null && reports.containsKey(id);
    }

    @Override
    public List<IncidentReport> recent(int limit) {
        return reports.descendingMap().values().stream().limit(Math.max(limit, 0)).toList();
    }
}
