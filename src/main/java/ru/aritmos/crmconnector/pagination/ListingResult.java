package ru.aritmos.crmconnector.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import ru.aritmos.crmconnector.core.CrmApiException;
import ru.aritmos.crmconnector.core.Outcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Итог собранного листинга.
 *
 * @param items          собранные элементы (при FAILED без allowPartialResults список пуст)
 * @param completion     причина остановки
 * @param failure        ошибка страницы, если {@code completion == FAILED}
 * @param itemsSeen      сколько элементов вернул сервер за операцию
 * @param pagesFetched   сколько страниц запрошено успешно
 * @param strategy       использованная стратегия пагинации
 * @param resumePosition позиция, с которой листинг можно продолжить
 */
public record ListingResult(
        List<JsonNode> items,
        ListingCompletion completion,
        Outcome.Failure failure,
        long itemsSeen,
        int pagesFetched,
        PaginationStrategy strategy,
        ListingPosition resumePosition
) {

    public ListingResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * Дочитать обход до конца и собрать итог.
     * <p>
     * Если обход завершился ошибкой и {@code allowPartialResults = false}, элементы отбрасываются,
     * а {@link #failure()} содержит исходную ошибку.
     */
    public static ListingResult drain(Listing listing, boolean allowPartialResults) {
        List<JsonNode> items = new ArrayList<>();
        while (listing.hasNext()) {
            items.add(listing.next());
        }
        ListingCompletion completion = listing.completion();
        List<JsonNode> out = completion == ListingCompletion.FAILED && !allowPartialResults ? List.of() : items;
        return new ListingResult(out, completion, listing.failure(), listing.itemsSeen(), listing.pagesFetched(),
                listing.strategy(), listing.resumePosition());
    }

    public boolean exhausted() {
        return completion == ListingCompletion.EXHAUSTED;
    }

    /**
     * Элементы, если листинг завершён полностью.
     *
     * @throws CrmApiException            если страница завершилась ошибкой
     * @throws ListingIncompleteException если листинг остановлен раньше конца коллекции
     */
    public List<JsonNode> requireComplete() {
        if (completion == ListingCompletion.FAILED && failure != null) {
            throw new CrmApiException(failure);
        }
        if (completion != ListingCompletion.EXHAUSTED) {
            throw new ListingIncompleteException(completion, resumePosition);
        }
        return items;
    }
}
