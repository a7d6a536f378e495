package com.clawcron.cron;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CronStoreTest {

    @TempDir
    Path tempDir;
    private Path storePath;

    @BeforeEach
    void setUp() {
        storePath = tempDir.resolve("cron").resolve("jobs.json");
    }

    private static CronJob job(String id, String name) {
        return CronJob.builder()
                .id(id)
                .name(name)
                .schedule(CronTypes.CronSchedule.every(60_000))
                .sessionTarget(CronTypes.SessionTarget.MAIN)
                .wakeMode(CronTypes.WakeMode.NEXT_HEARTBEAT)
                .payload(CronTypes.CronPayload.systemEvent("hello"))
                .state(CronTypes.JobState.IDLE)
                .nextRunAt(Instant.parse("2024-01-01T00:01:00Z"))
                .build();
    }

    @Test
    void load_missingFile_isEmpty() {
        CronStore store = new CronStore(storePath);
        store.load();
        assertTrue(store.isLoaded());
        assertEquals(0, store.size());
        assertNull(store.getFileMtime());
    }

    @Test
    void saveThenLoad_preservesJobsAndOrder() throws IOException {
        CronStore store = new CronStore(storePath);
        store.load();
        store.upsert(job("b", "second"));
        store.upsert(job("a", "first"));
        CronJob withDelivery = job("c", "third");
        withDelivery.setDelivery(CronTypes.CronDelivery.webhook("https://example.invalid/hook"));
        withDelivery.setLastStatus(CronTypes.RunStatus.ERROR);
        withDelivery.setLastError("boom");
        store.upsert(withDelivery);
        store.save();

        CronStore reloaded = new CronStore(storePath);
        reloaded.load();
        List<String> ids = reloaded.list().stream().map(CronJob::getId).collect(Collectors.toList());
        assertEquals(List.of("b", "a", "c"), ids);

        CronJob c = reloaded.get("c");
        assertEquals(CronTypes.DeliveryMode.WEBHOOK, c.getDelivery().getMode());
        assertEquals("https://example.invalid/hook", c.getDelivery().getTo());
        assertEquals(CronTypes.RunStatus.ERROR, c.getLastStatus());
        assertEquals(Instant.parse("2024-01-01T00:01:00Z"), c.getNextRunAt());
        assertNotNull(reloaded.getFileMtime());
    }

    @Test
    void save_writesVersionedDocumentWithWireKeys() throws IOException {
        CronStore store = new CronStore(storePath);
        store.load();
        store.upsert(job("a", "first"));
        store.save();

        String json = Files.readString(storePath);
        assertTrue(json.contains("\"version\" : 1"));
        assertTrue(json.contains("\"kind\" : \"every\""));
        assertTrue(json.contains("\"wakeMode\" : \"next-heartbeat\""));
        assertTrue(json.contains("\"state\" : \"idle\""));
        assertTrue(json.contains("\"nextRunAt\" : \"2024-01-01T00:01:00Z\""));
    }

    @Test
    void save_leavesNoTempFiles() throws IOException {
        CronStore store = new CronStore(storePath);
        store.load();
        store.upsert(job("a", "first"));
        store.save();
        store.save();

        try (Stream<Path> files = Files.list(storePath.getParent())) {
            assertEquals(List.of(storePath.getFileName().toString()),
                    files.map(p -> p.getFileName().toString()).collect(Collectors.toList()));
        }
    }

    @Test
    void load_idKeyedLayout() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, """
                { "jobs": { "j1": { "name": "legacy", "schedule": { "kind": "every", "everyMs": 1000 } } } }
                """);
        CronStore store = new CronStore(storePath);
        store.load();
        assertEquals("legacy", store.get("j1").getName());
    }

    @Test
    void load_bareArray() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, "[ { \"id\": \"x\", \"name\": \"bare\", \"enabled\": false } ]");
        CronStore store = new CronStore(storePath);
        store.load();
        assertFalse(store.get("x").isEnabled());
    }

    @Test
    void load_metadataOnly_isEmpty() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, "{ \"version\": 1 }");
        CronStore store = new CronStore(storePath);
        store.load();
        assertEquals(0, store.size());
    }

    @Test
    void load_malformedJson_failsAndKeepsFile() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, "{ \"jobs\": [ {");
        CronStore store = new CronStore(storePath);

        CronErrors.CorruptStoreError err = assertThrows(CronErrors.CorruptStoreError.class, store::load);
        assertEquals(storePath.toString(), err.getStorePath());
        assertFalse(store.isLoaded());
        assertEquals("{ \"jobs\": [ {", Files.readString(storePath));
    }

    @Test
    void load_duplicateIds_corrupt() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, "{ \"jobs\": [ { \"id\": \"a\" }, { \"id\": \"a\" } ] }");
        CronErrors.CorruptStoreError err = assertThrows(CronErrors.CorruptStoreError.class,
                () -> new CronStore(storePath).load());
        assertTrue(err.getMessage().contains("duplicate"));
    }

    @Test
    void load_entryWithoutId_corrupt() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, "{ \"jobs\": [ { \"name\": \"anonymous\" } ] }");
        assertThrows(CronErrors.CorruptStoreError.class, () -> new CronStore(storePath).load());
    }

    @Test
    void load_unexpectedShape_corrupt() throws IOException {
        Files.createDirectories(storePath.getParent());
        Files.writeString(storePath, "{ \"tasks\": [] }");
        assertThrows(CronErrors.CorruptStoreError.class, () -> new CronStore(storePath).load());
    }

    @Test
    void upsertAndDelete_inMemory() {
        CronStore store = new CronStore(storePath);
        store.load();
        store.upsert(job("a", "first"));
        store.upsert(job("a", "renamed"));
        assertEquals(1, store.size());
        assertEquals("renamed", store.get("a").getName());
        assertNotNull(store.delete("a"));
        assertNull(store.delete("a"));
        assertNull(store.get(null));
        assertFalse(Files.exists(storePath));
    }
}
