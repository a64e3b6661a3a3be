package com.movie.night.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.OptionalInt;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class KeyValueCheckpointStoreTest {

    private InMemoryKeyValueStore keyValueStore;
    private KeyValueCheckpointStore checkpoints;

    @BeforeEach
    void setUp() {
        keyValueStore = new InMemoryKeyValueStore();
        checkpoints = new KeyValueCheckpointStore(keyValueStore);
    }

    @Test
    @DisplayName("No checkpoint before the first save")
    void testEmpty() {
        assertEquals(OptionalLong.empty(), checkpoints.lastProcessed(BatchJob.METADATA_REFRESH));
    }

    @Test
    @DisplayName("Saved ids are stored under each job's key")
    void testSave() {
        checkpoints.save(BatchJob.METADATA_REFRESH, 41);
        checkpoints.save(BatchJob.TRAILER_REPAIR, 7);

        assertEquals(OptionalLong.of(41), checkpoints.lastProcessed(BatchJob.METADATA_REFRESH));
        assertEquals("41", keyValueStore.get("meta_resume").orElseThrow());
        assertEquals("7", keyValueStore.get("url_resume").orElseThrow());
    }

    @Test
    @DisplayName("Cleared checkpoints are written as 0 and read back as empty")
    void testClear() {
        checkpoints.save(BatchJob.TRAILER_REPAIR, 7);
        checkpoints.clear(BatchJob.TRAILER_REPAIR);

        assertEquals("0", keyValueStore.get("url_resume").orElseThrow());
        assertTrue(checkpoints.lastProcessed(BatchJob.TRAILER_REPAIR).isEmpty());
    }

    @Test
    @DisplayName("Unreadable values are ignored")
    void testUnreadable() {
        keyValueStore.put("meta_resume", "garbage");
        assertTrue(checkpoints.lastProcessed(BatchJob.METADATA_REFRESH).isEmpty());
    }

    @Test
    @DisplayName("Trend cache entries are scoped to one day")
    void testTrendCache() {
        InMemoryTrendCache cache = new InMemoryTrendCache();
        LocalDate today = LocalDate.of(2024, 3, 1);

        cache.put("Up", today, 64);

        assertEquals(OptionalInt.of(64), cache.get("Up", today));
        assertTrue(cache.get("Up", today.plusDays(1)).isEmpty());
    }
}
