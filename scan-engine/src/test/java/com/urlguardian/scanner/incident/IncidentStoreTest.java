package com.urlguardian.scanner.incident;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class IncidentStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldStoreAndFindInMemory() {
        assertStoreContract(new InMemoryIncidentStore());
    }

    @Test
    void shouldStoreAndFindOnDisk() {
        assertStoreContract(new FileIncidentStore(tempDir.resolve("incidents"), IncidentFixtures.objectMapper()));
    }

    @Test
    void shouldRoundTripReportThroughJson() {
        FileIncidentStore store = new FileIncidentStore(tempDir, IncidentFixtures.objectMapper());
        IncidentReport report = IncidentFixtures.report();

        store.save(report);

        assertTrue(Files.exists(tempDir.resolve(report.id() + ".json")));
        assertEquals(report, store.findById(report.id()).orElseThrow());
    }

    @Test
    void shouldSurviveReopen() {
        IncidentReport report = IncidentFixtures.report();
        new FileIncidentStore(tempDir, IncidentFixtures.objectMapper()).save(report);

        FileIncidentStore reopened = new FileIncidentStore(tempDir, IncidentFixtures.objectMapper());

        assertTrue(reopened.exists(report.id()));
        assertEquals(List.of(report.id()), reopened.recent(10).stream().map(IncidentReport::id).toList());
    }

    @Test
    void shouldIgnorePathLikeIdsOnDisk() {
        FileIncidentStore store = new FileIncidentStore(tempDir, IncidentFixtures.objectMapper());

        assertTrue(store.findById("../secrets").isEmpty());
        assertFalse(store.exists("../secrets"));
    }

    @Test
    void shouldServeReadsDuringConcurrentSavesInMemory() throws InterruptedException {
        assertConcurrentSavesAndReads(new InMemoryIncidentStore());
    }

    @Test
    void shouldServeReadsDuringConcurrentSavesOnDisk() throws InterruptedException {
        assertConcurrentSavesAndReads(new FileIncidentStore(tempDir, IncidentFixtures.objectMapper()));
    }

    @Test
    void shouldSkipUnreadableFilesWhenListing() throws Exception {
        FileIncidentStore store = new FileIncidentStore(tempDir, IncidentFixtures.objectMapper());
        IncidentReport report = IncidentFixtures.report();
        store.save(report);
        Files.createFile(tempDir.resolve("INC-9999999999999-000000-aaaaaa.json"));

        assertEquals(List.of(report.id()), store.recent(10).stream().map(IncidentReport::id).toList());
        assertEquals(List.of(report.id()), store.recent(1).stream().map(IncidentReport::id).toList());
    }

    @Test
    void shouldLeaveOnlyReportFilesBehind() throws Exception {
        FileIncidentStore store = new FileIncidentStore(tempDir, IncidentFixtures.objectMapper());
        IncidentReport report = IncidentFixtures.report();
        store.save(report);
        assertThrows(DuplicateIncidentException.class, () -> store.save(report));

        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(report.id() + ".json"),
                    files.map(file -> file.getFileName().toString()).toList());
        }
    }

    private static void assertConcurrentSavesAndReads(IncidentStore store) throws InterruptedException {
        IncidentReportGenerator generator = IncidentFixtures.generator();
        List<IncidentReport> reports = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            reports.add(generator.generate(IncidentFixtures.URL, IncidentFixtures.phishingAssessment(),
                    IncidentFixtures.classification(), Map.of("n", String.valueOf(i))));
        }

        AtomicReference<Throwable> writerFailure = new AtomicReference<>();
        Thread writer = new Thread(() -> {
            try {
                reports.forEach(store::save);
            } catch (Throwable t) {
                writerFailure.set(t);
            }
        });
        writer.start();

        int reads = 0;
        while (writer.isAlive() || reads == 0) {
            for (IncidentReport seen : store.recent(5)) {
                assertEquals(IncidentFixtures.URL, seen.url());
            }
            store.findById(reports.get(reads % reports.size()).id())
                    .ifPresent(found -> assertEquals(IncidentFixtures.URL, found.url()));
            reads++;
        }
        writer.join();

        assertNull(writerFailure.get());
        assertEquals(300, store.recent(1000).size());
        assertEquals(reports.get(299).id(), store.recent(1).get(0).id());
    }

    private static void assertStoreContract(IncidentStore store) {
        IncidentReportGenerator generator = IncidentFixtures.generator();
        IncidentReport first = generator.generate(IncidentFixtures.URL, IncidentFixtures.phishingAssessment(),
                IncidentFixtures.classification(), null);
        IncidentReport second = generator.generate("https://example.com/",
                IncidentFixtures.structureOnlyAssessment(), null, null);

        store.save(first);
        store.save(second);

        assertEquals(first.id(), store.findById(first.id()).orElseThrow().id());
        assertTrue(store.exists(second.id()));
        assertTrue(store.findById("INC-0000000000000-000000-zzzzzz").isEmpty());
        assertFalse(store.exists(null));

        DuplicateIncidentException duplicate = assertThrows(DuplicateIncidentException.class,
                () -> store.save(first));
        assertEquals(first.id(), duplicate.getIncidentId());

        assertEquals(List.of(second.id(), first.id()), store.recent(10).stream().map(IncidentReport::id).toList());
        assertEquals(List.of(second.id()), store.recent(1).stream().map(IncidentReport::id).toList());
    }
}
