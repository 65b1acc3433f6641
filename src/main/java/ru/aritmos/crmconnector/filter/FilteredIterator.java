package ru.aritmos.crmconnector.filter;

import com.fasterxml.jackson.databind.JsonNode;
import ru.aritmos.crmconnector.core.Outcome;
import ru.aritmos.crmconnector.pagination.Listing;
import ru.aritmos.crmconnector.pagination.ListingCompletion;
import ru.aritmos.crmconnector.pagination.ListingPosition;
import ru.aritmos.crmconnector.pagination.PaginationStrategy;

import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * Обход нефильтрованного листинга с локальным отбором элементов.
 * <p>
 * Остановка источника по пределу страниц превращается в
 * {@link ListingCompletion#FILTER_COVERAGE_INCOMPLETE}: часть коллекции не просмотрена,
 * совпадения могли быть пропущены.
 */
public class FilteredIterator implements Listing {

    private final Listing source;
    private final FilterSpec filter;
    private final Predicate<JsonNode> predicate;

    private JsonNode lookahead;
    private long scanned;
    private long matched;

    FilteredIterator(Listing source, FilterSpec filter) {
        this.source = source;
        this.filter = filter;
        this.predicate = new FilterPredicate(filter);
    }

    public FilterSpec filter() {
        return filter;
    }

    @Override
    public boolean hasNext() {
        while (lookahead == null && source.hasNext()) {
            JsonNode candidate = source.next();
            scanned++;
            if (predicate.test(candidate)) {
                matched++;
                lookahead = candidate;
            }
        }
        return lookahead != null;
    }

    @Override
    public JsonNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        JsonNode out = lookahead;
        lookahead = null;
        return out;
    }

    @Override
    public ListingCompletion completion() {
        if (lookahead != null) {
            return null;
        }
        ListingCompletion c = source.completion();
        return c == ListingCompletion.PAGE_CEILING_REACHED ? ListingCompletion.FILTER_COVERAGE_INCOMPLETE : c;
    }

    @Override
    public Outcome.Failure failure() {
        return source.failure();
    }

    @Override
    public ListingPosition resumePosition() {
        return source.resumePosition();
    }

    /**
     * Сколько элементов просмотрено до фильтрации.
     */
    @Override
    public long itemsSeen() {
        return source.itemsSeen();
    }

    @Override
    public int pagesFetched() {
        return source.pagesFetched();
    }

    @Override
    public PaginationStrategy strategy() {
        return source.strategy();
    }

    public long scanned() {
        return scanned;
    }

    public long matched() {
        return matched;
    }
}
