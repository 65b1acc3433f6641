package ru.aritmos.crmconnector.core;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Простой in-memory TTL-кэш для редко меняющихся сведений о сервере CRM.
 * <p>
 * Чтение без блокировок ({@link ConcurrentHashMap}); запись редкая.
 * При переполнении кэш очищается целиком: записи дешево восстанавливаются повторным
 * определением на следующем запросе.
 */
public final class TtlCache<K, V> {

    private final ConcurrentHashMap<K, Entry<V>> map = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEntries;
    private final Duration ttl;

    public TtlCache(Clock clock, int maxEntries, Duration ttl) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.maxEntries = Math.max(1, maxEntries);
        this.ttl = ttl == null || ttl.isNegative() ? Duration.ZERO : ttl;
    }

    /**
     * Значение по ключу, если оно не истекло.
     */
    public Optional<V> get(K key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry<V> e = map.get(key);
        if (e == null) {
            return Optional.empty();
        }
        if (e.expiresAtMs <= clock.millis()) {
            map.remove(key, e);
            return Optional.empty();
        }
        return Optional.ofNullable(e.value);
    }

    public void put(K key, V value) {
        if (key == null) {
            return;
        }
        if (map.size() >= maxEntries && !map.containsKey(key)) {
            map.clear();
        }
        map.put(key, new Entry<>(value, clock.millis() + ttl.toMillis()));
    }

    public void remove(K key) {
        if (key != null) {
            map.remove(key);
        }
    }

    public void clear() {
        map.clear();
    }

    public int size() {
        return map.size();
    }

    private record Entry<V>(V value, long expiresAtMs) {
    }
}
