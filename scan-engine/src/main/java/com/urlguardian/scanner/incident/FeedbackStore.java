package com.urlguardian.scanner.incident;

import java.util.List;

/**
 * Append-only feedback log.
 *
 * @author URL Guardian Team
 */
public interface FeedbackStore {

    void append(FeedbackRecord record);

    /** All records, oldest first. */
    List<FeedbackRecord> all();
}
