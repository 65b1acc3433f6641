package ru.aritmos.crmconnector.pagination;

import java.time.Instant;

/**
 * Параметры одной операции листинга. Нулевые значения означают "взять из конфигурации".
 *
 * @param pageSize            размер страницы
 * @param deadline            момент, после которого новые страницы не запрашиваются (null - без дедлайна)
 * @param allowPartialResults вернуть накопленные элементы при ошибке страницы
 * @param startAt             позиция продолжения (null - с начала)
 * @param maxPages            предел числа страниц
 * @param offsetLimit         предел глубины offset-пагинации
 * @param dateWindows         обход последовательными окнами по дате (null - одним листингом)
 */
public record ListingOptions(
        int pageSize,
        Instant deadline,
        boolean allowPartialResults,
        ListingPosition startAt,
        int maxPages,
        long offsetLimit,
        DateWindows dateWindows
) {

    public ListingOptions {
        if (pageSize < 0 || maxPages < 0 || offsetLimit < 0) {
            throw new IllegalArgumentException("Параметры листинга не могут быть отрицательными");
        }
    }

    public static ListingOptions defaults() {
        return new ListingOptions(0, null, false, null, 0, 0, null);
    }

    public ListingOptions withPageSize(int size) {
        return new ListingOptions(size, deadline, allowPartialResults, startAt, maxPages, offsetLimit, dateWindows);
    }

    public ListingOptions withDeadline(Instant at) {
        return new ListingOptions(pageSize, at, allowPartialResults, startAt, maxPages, offsetLimit, dateWindows);
    }

    public ListingOptions withPartialResults(boolean allow) {
        return new ListingOptions(pageSize, deadline, allow, startAt, maxPages, offsetLimit, dateWindows);
    }

    public ListingOptions startingAt(ListingPosition position) {
        return new ListingOptions(pageSize, deadline, allowPartialResults, position, maxPages, offsetLimit, dateWindows);
    }

    public ListingOptions withMaxPages(int pages) {
        return new ListingOptions(pageSize, deadline, allowPartialResults, startAt, pages, offsetLimit, dateWindows);
    }

    public ListingOptions withOffsetLimit(long limit) {
        return new ListingOptions(pageSize, deadline, allowPartialResults, startAt, maxPages, limit, dateWindows);
    }

    public ListingOptions withDateWindows(DateWindows windows) {
        return new ListingOptions(pageSize, deadline, allowPartialResults, startAt, maxPages, offsetLimit, windows);
    }
}
