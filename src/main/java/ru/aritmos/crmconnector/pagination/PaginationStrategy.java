package ru.aritmos.crmconnector.pagination;

/**
 * Соглашение о пагинации, которое сервер применяет для конкретного endpoint.
 */
public enum PaginationStrategy {
    /** Числовой offset + limit, метаданные с total. */
    OFFSET,
    /** Непрозрачный токен следующей страницы. */
    CURSOR,
    /** Готовая ссылка на следующую страницу (в теле или в заголовке {@code Link}). */
    LINK_HEADER,
    /** Метаданных нет: обрабатывается как OFFSET с осторожным размером страницы. */
    UNKNOWN
}
