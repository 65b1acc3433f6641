package ru.aritmos.crmconnector.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmconnector.core.ApiRequest;
import ru.aritmos.crmconnector.core.FailureKind;
import ru.aritmos.crmconnector.core.Outcome;
import ru.aritmos.crmconnector.pagination.Listing;
import ru.aritmos.crmconnector.pagination.ListingCompletion;
import ru.aritmos.crmconnector.pagination.ListingOptions;
import ru.aritmos.crmconnector.pagination.ListingResult;
import ru.aritmos.crmconnector.pagination.PaginationEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Листинг с фильтром: выбор между серверным фильтром и локальной фильтрацией.
 * <p>
 * Маршрут:
 * <ol>
 *   <li>поля, про которые известно, что сервер фильтрует неверно, проверяются локально;</li>
 *   <li>неизвестные поля при включённой пробе проверяются одним пробным запросом;</li>
 *   <li>остальное уходит на сервер как query-параметры;</li>
 *   <li>если первая страница серверного фильтра получила 400, поля помечаются как отклонённые
 *       и листинг повторяется с локальной фильтрацией.</li>
 * </ol>
 */
public class FilteredListingService {

    private static final Logger log = LoggerFactory.getLogger(FilteredListingService.class);

    private final PaginationEngine engine;
    private final EmergencyFilter emergencyFilter;
    private final FilterSupportTable supportTable;
    private final FilterProbe probe;

    /**
     * @param probe проба неизвестных фильтров; {@code null} отключает пробу
     */
    public FilteredListingService(PaginationEngine engine,
                                  EmergencyFilter emergencyFilter,
                                  FilterSupportTable supportTable,
                                  FilterProbe probe) {
        this.engine = engine;
        this.emergencyFilter = emergencyFilter;
        this.supportTable = supportTable;
        this.probe = probe;
    }

    public ListingResult collect(String path, List<ApiRequest.QueryParam> query, FilterSpec filter, ListingOptions options) {
        ListingOptions o = options == null ? ListingOptions.defaults() : options;
        Listing listing = iterate(path, query, filter, o);
        if (listing instanceof FilteredIterator filtered) {
            return emergencyFilter.collect(filtered, o.allowPartialResults());
        }
        return ListingResult.drain(listing, o.allowPartialResults());
    }

    public Listing iterate(String path, List<ApiRequest.QueryParam> query, FilterSpec filter, ListingOptions options) {
        List<ApiRequest.QueryParam> baseQuery = query == null ? List.of() : query;
        if (filter == null || filter.isEmpty()) {
            return engine.listing(path, baseQuery, options);
        }
        FilterSpec resolved = filter.withItemPaths(field -> supportTable.itemPath(path, field));

        List<FilterCondition> server = new ArrayList<>();
        List<FilterCondition> local = new ArrayList<>();
        List<FilterCondition> unknown = new ArrayList<>();
        for (FilterCondition c : resolved.conditions()) {
            FilterSupport s = supportTable.status(path, c.field());
            if (s.requiresLocalFiltering()) {
                local.add(c);
            } else if (s == FilterSupport.UNKNOWN) {
                unknown.add(c);
            } else {
                server.add(c);
            }
        }

        if (!unknown.isEmpty() && probe != null) {
            ProbeResult verdict = probe.probe(path, baseQuery, new FilterSpec(unknown));
            for (FilterCondition c : unknown) {
                supportTable.record(path, c.field(), verdict.verdict());
            }
            if (verdict.verdict().requiresLocalFiltering()) {
                local.addAll(unknown);
                unknown.clear();
            }
        }
        server.addAll(unknown);

        if (local.isEmpty()) {
            Listing direct = serverFiltered(path, baseQuery, new FilterSpec(server), options);
            if (!rejectedOnFirstPage(direct)) {
                return direct;
            }
            for (FilterCondition c : server) {
                if (supportTable.status(path, c.field()) != FilterSupport.SUPPORTED) {
                    supportTable.record(path, c.field(), FilterSupport.REJECTED);
                }
            }
            log.warn("[CRM][FILTER] сервер отклонил фильтр, переход на локальную фильтрацию endpoint={} fields={}",
                    path, resolved.fields());
            return emergency(path, baseQuery, new FilterSpec(List.of()), resolved, options);
        }
        log.debug("[CRM][FILTER] локальная фильтрация endpoint={} local={} server={}",
                path, new FilterSpec(local).fields(), new FilterSpec(server).fields());
        return emergency(path, baseQuery, new FilterSpec(server), new FilterSpec(local), options);
    }

    private Listing serverFiltered(String path, List<ApiRequest.QueryParam> query, FilterSpec server, ListingOptions options) {
        List<ApiRequest.QueryParam> q = new ArrayList<>(query);
        q.addAll(server.toQuery());
        Listing listing = engine.listing(path, q, options);
        // первая страница запрашивается сразу: по ней видно, принял ли сервер фильтр
        listing.hasNext();
        return listing;
    }

    private FilteredIterator emergency(String path,
                                       List<ApiRequest.QueryParam> query,
                                       FilterSpec server,
                                       FilterSpec local,
                                       ListingOptions options) {
        List<ApiRequest.QueryParam> q = new ArrayList<>(query);
        q.addAll(server.toQuery());
        Listing source = engine.listing(path, q, emergencyFilter.scanOptions(options));
        return emergencyFilter.apply(local, source);
    }

    private static boolean rejectedOnFirstPage(Listing listing) {
        if (listing.completion() != ListingCompletion.FAILED || listing.pagesFetched() > 0) {
            return false;
        }
        Outcome.Failure f = listing.failure();
        return f != null && f.kind() == FailureKind.CLIENT_ERROR && Integer.valueOf(400).equals(f.httpStatus());
    }
}
