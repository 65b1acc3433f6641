package ru.aritmos.crmconnector.pagination;

import java.net.URI;

/**
 * Состояние одной операции листинга.
 * <p>
 * Меняется только движком пагинации; один экземпляр на операцию, между операциями не разделяется.
 * Инварианты:
 * <ul>
 *   <li>{@code itemsSeen} не уменьшается;</li>
 *   <li>после {@code exhausted = true} запросы больше не выполняются;</li>
 *   <li>offset сдвигается ровно на число фактически полученных элементов.</li>
 * </ul>
 */
public final class PaginationState {

    private PaginationStrategy strategy;
    private long offset;
    private String cursor;
    private URI link;
    private int pageSize;
    private long itemsSeen;
    private int pagesFetched;
    private boolean exhausted;

    PaginationState(ListingPosition start, int pageSize) {
        ListingPosition p = start == null ? ListingPosition.start() : start;
        this.strategy = p.strategy();
        this.offset = p.offset();
        this.cursor = p.cursor();
        this.link = p.link();
        this.pageSize = pageSize;
    }

    void strategy(PaginationStrategy strategy) {
        this.strategy = strategy;
    }

    void pageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    void recordPage(int returned) {
        if (exhausted) {
            throw new IllegalStateException("Листинг уже исчерпан, новые страницы не ожидаются");
        }
        if (returned < 0) {
            throw new IllegalArgumentException("Число элементов страницы не может быть отрицательным");
        }
        itemsSeen += returned;
        pagesFetched++;
    }

    void advanceOffset(int returned) {
        offset += returned;
        cursor = null;
        link = null;
    }

    void advanceCursor(String token) {
        cursor = token;
        link = null;
    }

    void advanceLink(URI next) {
        link = next;
        cursor = null;
    }

    void markExhausted() {
        exhausted = true;
    }

    public ListingPosition position() {
        return new ListingPosition(strategy, offset, cursor, link);
    }

    public PaginationStrategy strategy() {
        return strategy;
    }

    public long offset() {
        return offset;
    }

    public String cursor() {
        return cursor;
    }

    public URI link() {
        return link;
    }

    public int pageSize() {
        return pageSize;
    }

    public long itemsSeen() {
        return itemsSeen;
    }

    public int pagesFetched() {
        return pagesFetched;
    }

    public boolean exhausted() {
        return exhausted;
    }
}
