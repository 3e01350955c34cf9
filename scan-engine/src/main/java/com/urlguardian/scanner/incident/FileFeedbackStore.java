package com.urlguardian.scanner.incident;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlguardian.scanner.config.IncidentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Feedback as JSON lines appended to {@code <directory>/feedback.jsonl}.
 *
 * @author URL Guardian Team
 */
@Repository
@ConditionalOnProperty(prefix = "guardian.incidents", name = "store", havingValue = "file", matchIfMissing = true)
public class FileFeedbackStore implements FeedbackStore {

    private static final Logger log = LoggerFactory.getLogger(FileFeedbackStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Object lock = new Object();

    public FileFeedbackStore(IncidentConfig config, ObjectMapper objectMapper) {
        this(Path.of(config.getDirectory(), "feedback.jsonl"), objectMapper);
    }

    FileFeedbackStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create feedback directory for " + file, e);
        }
    }

    @Override
    public void append(FeedbackRecord record) {
        try {
            String line = objectMapper.writeValueAsString(record) + System.lineSeparator();
            synchronized (lock) {
                Files.writeString(file, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            }
        } catch (IOException e) {
            log.error("Failed to append feedback {}: {}", record.id(), e.getMessage());
            throw new UncheckedIOException("Failed to append feedback " + record.id(), e);
        }
    }

    @Override
    public List<FeedbackRecord> all() {
        List<String> lines;
        synchronized (lock) {
            if (!Files.exists(file)) {
                return List.of();
            }
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read feedback log " + file, e);
            }
        }
        List<FeedbackRecord> records = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, FeedbackRecord.class));
            } catch (IOException e) {
                throw new UncheckedIOException("Corrupt feedback line in " + file, e);
            }
        }
        return records;
    }
}
