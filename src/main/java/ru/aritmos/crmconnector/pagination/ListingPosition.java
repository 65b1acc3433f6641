package ru.aritmos.crmconnector.pagination;

import java.net.URI;

/**
 * Неизменяемый снимок позиции листинга, с которой его можно перезапустить.
 * <p>
 * Для CURSOR токен хранится как есть и никогда не разбирается.
 */
public record ListingPosition(PaginationStrategy strategy, long offset, String cursor, URI link) {

    public ListingPosition {
        strategy = strategy == null ? PaginationStrategy.UNKNOWN : strategy;
        if (offset < 0) {
            throw new IllegalArgumentException("offset не может быть отрицательным: " + offset);
        }
    }

    public static ListingPosition start() {
        return new ListingPosition(PaginationStrategy.UNKNOWN, 0, null, null);
    }

    public static ListingPosition offset(long offset) {
        return new ListingPosition(PaginationStrategy.OFFSET, offset, null, null);
    }

    public static ListingPosition cursor(String token) {
        return new ListingPosition(PaginationStrategy.CURSOR, 0, token, null);
    }

    public static ListingPosition link(URI link) {
        return new ListingPosition(PaginationStrategy.LINK_HEADER, 0, null, link);
    }
}
