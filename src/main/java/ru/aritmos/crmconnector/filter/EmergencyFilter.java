package ru.aritmos.crmconnector.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmconnector.pagination.Listing;
import ru.aritmos.crmconnector.pagination.ListingCompletion;
import ru.aritmos.crmconnector.pagination.ListingOptions;
import ru.aritmos.crmconnector.pagination.ListingResult;

/**
 * Локальная фильтрация поверх нефильтрованного листинга для endpoint, где серверный фильтр
 * отклоняется или игнорируется.
 * <p>
 * Просмотр ограничен {@code pageCeiling} страницами; если коллекция длиннее, итог помечается
 * {@link ListingCompletion#FILTER_COVERAGE_INCOMPLETE}, а не выдаётся за полный.
 */
public class EmergencyFilter {

    private static final Logger log = LoggerFactory.getLogger(EmergencyFilter.class);

    private final int pageCeiling;

    public EmergencyFilter(int pageCeiling) {
        if (pageCeiling <= 0) {
            throw new IllegalArgumentException("pageCeiling должен быть > 0");
        }
        this.pageCeiling = pageCeiling;
    }

    /**
     * Параметры листинга-источника: предел страниц не выше {@code pageCeiling}.
     */
    public ListingOptions scanOptions(ListingOptions requested) {
        ListingOptions o = requested == null ? ListingOptions.defaults() : requested;
        int pages = o.maxPages() > 0 ? Math.min(o.maxPages(), pageCeiling) : pageCeiling;
        return o.withMaxPages(pages);
    }

    public FilteredIterator apply(FilterSpec filter, Listing source) {
        return new FilteredIterator(source, filter);
    }

    public ListingResult collect(FilterSpec filter, Listing source, boolean allowPartialResults) {
        return collect(apply(filter, source), allowPartialResults);
    }

    /**
     * Дочитать уже начатый локально фильтруемый обход.
     */
    public ListingResult collect(FilteredIterator it, boolean allowPartialResults) {
        FilterSpec filter = it.filter();
        ListingResult result = ListingResult.drain(it, allowPartialResults);
        if (result.completion() == ListingCompletion.FILTER_COVERAGE_INCOMPLETE) {
            log.warn("[CRM][FILTER] локальная фильтрация остановлена на пределе страниц fields={} scanned={} matched={} pages={}",
                    filter.fields(), it.scanned(), it.matched(), it.pagesFetched());
        } else {
            log.info("[CRM][FILTER] локальная фильтрация fields={} scanned={} matched={} completion={}",
                    filter.fields(), it.scanned(), it.matched(), result.completion());
        }
        return result;
    }

    public int pageCeiling() {
        return pageCeiling;
    }
}
