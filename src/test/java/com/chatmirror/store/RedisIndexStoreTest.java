package com.chatmirror.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RedisIndexStoreTest {

    @Test
    void formatScore_keepsFractionWithoutExponent() {
        assertEquals("1709287200.123456", RedisIndexStore.formatScore(1709287200.123456));
        assertFalse(RedisIndexStore.formatScore(1e-7).contains("E"));
    }

    @Test
    void formatBound_mapsInfinity() {
        assertEquals("-inf", RedisIndexStore.formatBound(Double.NEGATIVE_INFINITY));
        assertEquals("+inf", RedisIndexStore.formatBound(Double.POSITIVE_INFINITY));
        assertEquals("12.5", RedisIndexStore.formatBound(12.5));
    }
}
