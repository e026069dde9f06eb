package com.chatmirror.pull;

import com.chatmirror.store.InMemoryIndexStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class PullStatusRepositoryTest {
    private final InMemoryIndexStore store = new InMemoryIndexStore();
    private final PullStatusRepository repository = new PullStatusRepository(store,
            Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC));

    @Test
    void write_storesHashFields() {
        repository.write("sub-1", PullStatus.FAILED, PullStatus.FAILED.defaultMessage("sub-1", "queue gone"));

        assertEquals("failed", store.getHash("pull_status:sub-1").get("task_status"));
        PullStatusResponse read = repository.read("sub-1").orElseThrow();
        assertEquals(PullStatus.FAILED, read.status());
        assertEquals("Pulling failed for sub-1: queue gone.", read.message());
        assertEquals("2024-06-01T12:00:00.000000Z", read.timestamp());
        assertEquals("failed", read.toJson().getString("task_status"));
    }

    @Test
    void delete_removesRecord() {
        repository.write("sub-1", PullStatus.RUNNING, "running");
        repository.delete("sub-1");

        assertTrue(repository.read("sub-1").isEmpty());
    }
}
