package ru.aritmos.crmconnector.pagination;

/**
 * Как завершилась операция листинга.
 */
public enum ListingCompletion {
    /** Сервер сообщил, что данных больше нет. */
    EXHAUSTED,
    /** Истёк дедлайн вызывающей стороны. */
    DEADLINE_REACHED,
    /** Достигнут предел числа страниц или глубины offset. */
    PAGE_CEILING_REACHED,
    /** Локальная фильтрация остановилась до конца коллекции: совпадения могут быть пропущены. */
    FILTER_COVERAGE_INCOMPLETE,
    /** Запрос страницы завершился ошибкой. */
    FAILED;

    public boolean isComplete() {
        return this == EXHAUSTED;
    }
}
