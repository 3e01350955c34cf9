package com.urlguardian.scanner.incident;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlguardian.scanner.config.IncidentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One JSON file per incident under {@code <directory>/incidents}.
 *
 * <p>
 * A report is written to a temporary file first and then hard-linked under
 * its final name. The link either appears complete or fails because the id
 * is taken, so readers never see a partial report and an existing report is
 * never replaced.
 * </p>
 *
 * @author URL Guardian Team
 */
@Repository
@ConditionalOnProperty(prefix = "guardian.incidents", name = "store", havingValue = "file", matchIfMissing = true)
public class FileIncidentStore implements IncidentStore {

    private static final Logger log = LoggerFactory.getLogger(FileIncidentStore.class);

    private static final String SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileIncidentStore(IncidentConfig config, ObjectMapper objectMapper) {
        this(Path.of(config.getDirectory(), "incidents"), objectMapper);
    }

    FileIncidentStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create incident directory " + directory, e);
        }
    }

    @Override
    public void save(IncidentReport report) {
        Path file = fileFor(report.id());
        Path temp = null;
        try {
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
            temp = Files.createTempFile(directory, "incident-", TEMP_SUFFIX);
            Files.write(temp, json, StandardOpenOption.WRITE, StandardOpenOption.SYNC);
            Files.createLink(file, temp);
            log.info("Incident report stored: {}", file);
        } catch (FileAlreadyExistsException e) {
            throw new DuplicateIncidentException(report.id(), e);
        } catch (IOException e) {
            log.error("Failed to store incident {}: {}", report.id(), e.getMessage());
            throw new UncheckedIOException("Failed to store incident " + report.id(), e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    @Override
    public Optional<IncidentReport> findById(String id) {
        if (!IncidentIdGenerator.isWellFormed(id)) {
            return Optional.empty();
        }
        Path file = fileFor(id);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public boolean exists(String id) {
        return IncidentIdGenerator.isWellFormed(id) && Files.exists(fileFor(id));
    }

    @Override
    public List<IncidentReport> recent(int limit) {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list incident directory " + directory, e);
        }
        List<IncidentReport> reports = new ArrayList<>();
        for (Path file : files) {
            if (reports.size() >= limit) {
                break;
            }
            try {
                reports.add(read(file));
            } catch (UncheckedIOException e) {
                log.warn("Skipping unreadable incident file {}: {}", file, e.getCause().getMessage());
            }
        }
        return reports;
    }

    private IncidentReport read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), IncidentReport.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read incident " + file, e);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary incident file {}: {}", temp, e.getMessage());
        }
    }

    private Path fileFor(String id) {
        return directory.resolve(id + SUFFIX);
    }
}
