package com.urlguardian.scanner.incident;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link FeedbackStore} kept in process memory.
 *
 * @author URL Guardian Team
 */
@Repository
@ConditionalOnProperty(prefix = "guardian.incidents", name = "store", havingValue = "memory")
public class InMemoryFeedbackStore implements FeedbackStore {

    private final List<FeedbackRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(FeedbackRecord record) {
        records.add(record);
    }

    @Override
    public List<FeedbackRecord> all() {
        return List.copyOf(records);
    }
}
