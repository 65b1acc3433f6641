package ru.aritmos.crmconnector.pagination;

import ru.aritmos.crmconnector.core.EndpointKeys;
import ru.aritmos.crmconnector.core.TtlCache;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Запомненная стратегия пагинации по endpoint.
 * <p>
 * Ключ нормализуется: query отбрасывается, числовые сегменты пути заменяются на {@code {id}},
 * поэтому {@code /people/12/notes} и {@code /people/40/notes} разделяют одну запись.
 * {@link PaginationStrategy#UNKNOWN} не запоминается.
 */
public class StrategyCache {

    private final TtlCache<String, PaginationStrategy> cache;

    public StrategyCache(Clock clock, int maxEntries, Duration ttl) {
        this.cache = new TtlCache<>(clock, maxEntries, ttl);
    }

    public Optional<PaginationStrategy> get(String endpointPath) {
        String key = endpointKey(endpointPath);
        return key == null ? Optional.empty() : cache.get(key);
    }

    public void remember(String endpointPath, PaginationStrategy strategy) {
        String key = endpointKey(endpointPath);
        if (key == null || strategy == null || strategy == PaginationStrategy.UNKNOWN) {
            return;
        }
        cache.put(key, strategy);
    }

    public void forget(String endpointPath) {
        String key = endpointKey(endpointPath);
        if (key != null) {
            cache.remove(key);
        }
    }

    static String endpointKey(String path) {
        return EndpointKeys.normalize(path);
    }
}
