package ru.aritmos.crmconnector.pagination;

/**
 * Значения по умолчанию для листинга.
 *
 * @param pageSize             размер страницы
 * @param conservativePageSize размер страницы для endpoint без метаданных пагинации
 * @param maxPages             предел числа страниц на операцию
 * @param offsetLimit          предел глубины offset (сервер отклоняет более глубокие запросы)
 */
public record PaginationDefaults(int pageSize, int conservativePageSize, int maxPages, long offsetLimit) {

    public PaginationDefaults {
        if (pageSize <= 0 || conservativePageSize <= 0 || maxPages <= 0 || offsetLimit < 0) {
            throw new IllegalArgumentException("Некорректные параметры пагинации по умолчанию");
        }
    }

    public static PaginationDefaults standard() {
        return new PaginationDefaults(100, 25, 1000, 2000);
    }
}
