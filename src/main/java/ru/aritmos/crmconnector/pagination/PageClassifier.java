package ru.aritmos.crmconnector.pagination;

import jakarta.inject.Singleton;

/**
 * Определение стратегии пагинации по первой странице ответа.
 * <p>
 * Порядок проверок фиксирован: токен курсора, затем ссылка на следующую страницу,
 * затем total + offset. Если ничего не найдено, результат {@link PaginationStrategy#UNKNOWN}.
 */
@Singleton
public class PageClassifier {

    public PaginationStrategy classify(PageEnvelope page) {
        if (page == null) {
            return PaginationStrategy.UNKNOWN;
        }
        PageMetadata m = page.metadata();
        if (m.hasCursor()) {
            return PaginationStrategy.CURSOR;
        }
        if (m.hasLink()) {
            return PaginationStrategy.LINK_HEADER;
        }
        if (m.total() != null && (m.offset() != null || m.limit() != null)) {
            return PaginationStrategy.OFFSET;
        }
        return PaginationStrategy.UNKNOWN;
    }
}
