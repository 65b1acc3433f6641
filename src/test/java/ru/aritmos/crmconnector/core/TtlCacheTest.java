package ru.aritmos.crmconnector.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TtlCacheTest {

    @Test
    void shouldExpireEntriesAfterTtl() {
        ManualClock clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
        TtlCache<String, String> cache = new TtlCache<>(clock, 10, Duration.ofMinutes(5));

        cache.put("/people", "CURSOR");
        assertEquals("CURSOR", cache.get("/people").orElseThrow());

        clock.advance(Duration.ofMinutes(5));
        assertTrue(cache.get("/people").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldClearWhenFull() {
        ManualClock clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
        TtlCache<String, Integer> cache = new TtlCache<>(clock, 2, Duration.ofMinutes(5));

        cache.put("a", 1);
        cache.put("b", 2);
        cache.put("c", 3);

        assertTrue(cache.size() <= 2);
        assertEquals(3, cache.get("c").orElseThrow());
    }
}
