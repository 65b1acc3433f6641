package ru.aritmos.crmconnector.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import ru.aritmos.crmconnector.core.Outcome;

import java.util.Iterator;

/**
 * Ленивый обход коллекции с диагностикой остановки.
 */
public interface Listing extends Iterator<JsonNode> {

    /**
     * Причина остановки или {@code null}, если обход ещё идёт.
     */
    ListingCompletion completion();

    /**
     * Ошибка страницы при {@link ListingCompletion#FAILED}, иначе {@code null}.
     */
    Outcome.Failure failure();

    ListingPosition resumePosition();

    long itemsSeen();

    int pagesFetched();

    PaginationStrategy strategy();
}
