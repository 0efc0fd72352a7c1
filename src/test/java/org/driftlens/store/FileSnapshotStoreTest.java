package org.driftlens.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.driftlens.error.CorruptSnapshotException;
import org.driftlens.error.NotFoundException;
import org.driftlens.snapshot.Snapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSnapshotStoreTest {
    @TempDir
    Path tempDir;

    @Test
    void savedSnapshotLoadsBackById() throws IOException {
        FileSnapshotStore store = new FileSnapshotStore(tempDir.resolve("snapshots"));
        Snapshot snapshot = StoreFixtures.medianSnapshot("snap-b", "2024-03-02T00:00:00Z", 21.0);

        store.save(snapshot);

        assertTrue(store.contains("snap-b"));
        assertFalse(store.contains("snap-a"));
        Snapshot loaded = store.load("snap-b");
        assertEquals(snapshot.timestamp(), loaded.timestamp());
        assertEquals(snapshot.units().get(0).result(), loaded.units().get(0).result());
        try (Stream<Path> files = Files.list(store.directory())) {
            assertEquals(List.of("snap-b.json"), files.map(path -> path.getFileName().toString()).toList());
        }
    }

    @Test
    void overwriteReplacesTheFile() {
        FileSnapshotStore store = new FileSnapshotStore(tempDir);
        store.save(StoreFixtures.medianSnapshot("snap-a", "2024-03-01T00:00:00Z", 20.0));
        store.save(StoreFixtures.medianSnapshot("snap-a", "2024-03-01T00:00:00Z", 30.0));

        assertEquals(List.of("snap-a"), store.ids());
        assertEquals(30.0, store.load("snap-a").units().get(0).result().field("current.value").asDouble().getValue());
    }

    @Test
    void idsAndLoadAllFollowFileNameOrder() {
        FileSnapshotStore store = new FileSnapshotStore(tempDir);
        store.save(StoreFixtures.medianSnapshot("snap-c", "2024-03-01T00:00:00Z", 20.0));
        store.save(StoreFixtures.medianSnapshot("snap-a", "2024-03-03T00:00:00Z", 22.0));
        store.save(StoreFixtures.emptyTestSuite("snap-b", "2024-03-02T00:00:00Z"));

        assertEquals(List.of("snap-a", "snap-b", "snap-c"), store.ids());
        assertEquals(List.of("snap-a", "snap-b", "snap-c"), store.loadAll().stream().map(Snapshot::id).toList());
    }

    @Test
    void missingDirectoryIsEmpty() {
        FileSnapshotStore store = new FileSnapshotStore(tempDir.resolve("absent"));

        assertTrue(store.ids().isEmpty());
        assertTrue(store.loadAll().isEmpty());
    }

    @Test
    void unknownIdIsNotFound() {
        FileSnapshotStore store = new FileSnapshotStore(tempDir);

        NotFoundException error = assertThrows(NotFoundException.class, () -> store.load("nope"));
        assertEquals("snapshot", error.entity());
    }

    @Test
    void idsWithPathCharactersAreRejected() {
        FileSnapshotStore store = new FileSnapshotStore(tempDir);

        assertThrows(IllegalArgumentException.class, () -> store.load("../escape"));
    }

    @Test
    void corruptFileFailsTheWholeLoadWithItsName() throws IOException {
        FileSnapshotStore store = new FileSnapshotStore(tempDir);
        store.save(StoreFixtures.medianSnapshot("snap-a", "2024-03-01T00:00:00Z", 20.0));
        Files.writeString(tempDir.resolve("snap-b.json"), "{\"id\": \"snap-b\"", StandardCharsets.UTF_8);

        CorruptSnapshotException error = assertThrows(CorruptSnapshotException.class, store::loadAll);

        assertTrue(error.problems().get(0).startsWith("snap-b.json: unparseable JSON"));
    }
}
