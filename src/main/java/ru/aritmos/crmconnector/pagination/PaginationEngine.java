package ru.aritmos.crmconnector.pagination;

import com.fasterxml.jackson.databind.ObjectMapper;
import ru.aritmos.crmconnector.core.ApiRequest;
import ru.aritmos.crmconnector.core.RequestExecutor;

import java.time.Clock;
import java.util.List;

/**
 * Обход постраничных коллекций CRM.
 * <p>
 * Стратегия определяется по первой странице (или берётся из {@link StrategyCache}) и дальше
 * не меняется в пределах операции. Каждая страница запрашивается через {@link RequestExecutor},
 * поэтому ретраи работают для каждой страницы отдельно.
 */
public class PaginationEngine {

    private final RequestExecutor executor;
    private final ObjectMapper mapper;
    private final StrategyCache strategyCache;
    private final PageClassifier classifier;
    private final Clock clock;
    private final PaginationDefaults defaults;

    public PaginationEngine(RequestExecutor executor,
                            ObjectMapper mapper,
                            StrategyCache strategyCache,
                            PageClassifier classifier,
                            Clock clock,
                            PaginationDefaults defaults) {
        this.executor = executor;
        this.mapper = mapper;
        this.strategyCache = strategyCache;
        this.classifier = classifier;
        this.clock = clock;
        this.defaults = defaults == null ? PaginationDefaults.standard() : defaults;
    }

    /**
     * Ленивый обход коллекции.
     *
     * @param path    путь endpoint, например {@code /people}
     * @param query   фильтры и прочие параметры запроса (limit/offset/next задаёт движок)
     * @param options параметры операции
     * @return итератор элементов
     */
    public ListingIterator iterate(String path, List<ApiRequest.QueryParam> query, ListingOptions options) {
        ListingOptions o = options == null ? ListingOptions.defaults() : options;
        ApiRequest base = ApiRequest.get(path).withQuery(query == null ? List.of() : query);
        int pageSize = o.pageSize() > 0 ? o.pageSize() : defaults.pageSize();
        int maxPages = o.maxPages() > 0 ? o.maxPages() : defaults.maxPages();
        long offsetLimit = o.offsetLimit() > 0 ? o.offsetLimit() : defaults.offsetLimit();
        return new ListingIterator(this, base, path, o, pageSize, maxPages, offsetLimit);
    }

    /**
     * Обход коллекции с учётом {@link ListingOptions#dateWindows()}: без окон это {@link #iterate}.
     */
    public Listing listing(String path, List<ApiRequest.QueryParam> query, ListingOptions options) {
        ListingOptions o = options == null ? ListingOptions.defaults() : options;
        if (o.dateWindows() == null) {
            return iterate(path, query, o);
        }
        int maxPages = o.maxPages() > 0 ? o.maxPages() : defaults.maxPages();
        return new DateWindowListing(this, path, query == null ? List.of() : query, o, maxPages);
    }

    /**
     * Собрать коллекцию целиком (или до остановки) в список.
     * <p>
     * Если страница завершилась ошибкой и {@code allowPartialResults = false}, элементы не возвращаются,
     * а {@link ListingResult#failure()} содержит исходную ошибку.
     */
    public ListingResult collect(String path, List<ApiRequest.QueryParam> query, ListingOptions options) {
        ListingOptions o = options == null ? ListingOptions.defaults() : options;
        return ListingResult.drain(listing(path, query, o), o.allowPartialResults());
    }

    RequestExecutor executor() {
        return executor;
    }

    ObjectMapper mapper() {
        return mapper;
    }

    StrategyCache strategyCache() {
        return strategyCache;
    }

    PageClassifier classifier() {
        return classifier;
    }

    Clock clock() {
        return clock;
    }

    PaginationDefaults defaults() {
        return defaults;
    }
}
