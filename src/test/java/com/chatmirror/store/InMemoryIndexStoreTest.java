package com.chatmirror.store;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryIndexStoreTest {
    private final InMemoryIndexStore store = new InMemoryIndexStore();

    @Test
    void pipeline_appliesCommandsInOrder() {
        store.execute(new StorePipeline()
                .set("k", "v1")
                .set("k", "v2")
                .zadd("z", "a", 2.0)
                .zadd("z", "b", 1.0)
                .zrem("z", "a")
                .hset("h", Map.of("f", "x")));

        assertEquals("v2", store.get("k"));
        assertNull(store.score("z", "a"));
        assertEquals(1.0, store.score("z", "b"));
        assertEquals(Map.of("f", "x"), store.getHash("h"));
    }

    @Test
    void rangeByScore_ordersByScoreThenMember() {
        store.execute(new StorePipeline()
                .zadd("z", "c", 5.0)
                .zadd("z", "b", 1.5)
                .zadd("z", "a", 1.5)
                .zadd("z", "d", 9.0));

        assertEquals(List.of(new ScoredMember("a", 1.5), new ScoredMember("b", 1.5), new ScoredMember("c", 5.0)),
                store.rangeByScore("z", 1.5, 5.0));
        assertTrue(store.rangeByScore("missing", 0, 10).isEmpty());
    }

    @Test
    void getAll_omitsMissingKeys() {
        store.execute(new StorePipeline().set("a", "1").set("c", "3"));
        assertEquals(Map.of("a", "1", "c", "3"), store.getAll(List.of("a", "b", "c")));
    }

    @Test
    void del_removesAnyKeyType() {
        store.execute(new StorePipeline().set("k", "v").hset("h", Map.of("f", "x")));
        store.execute(new StorePipeline().del("k").del("h"));

        assertNull(store.get("k"));
        assertTrue(store.getHash("h").isEmpty());
    }
}
