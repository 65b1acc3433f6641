package ru.aritmos.crmconnector.pagination;

import java.net.URI;

/**
 * Метаданные пагинации одной страницы. Любое поле может отсутствовать.
 */
public record PageMetadata(Long offset, Integer limit, Long total, String nextCursor, URI nextLink) {

    public static PageMetadata empty() {
        return new PageMetadata(null, null, null, null, null);
    }

    public boolean hasCursor() {
        return nextCursor != null && !nextCursor.isBlank();
    }

    public boolean hasLink() {
        return nextLink != null;
    }
}
