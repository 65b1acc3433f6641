package ru.aritmos.crmconnector.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmconnector.core.ApiRequest;
import ru.aritmos.crmconnector.core.Outcome;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Листинг, разбитый на окна по дате: окна обходятся по очереди, каждое своим {@link ListingIterator}
 * с offset от нуля.
 * <p>
 * Предел числа страниц общий на все окна, предел глубины offset действует внутри окна.
 * Если окно упёрлось в предел, листинг останавливается с {@link ListingCompletion#PAGE_CEILING_REACHED}:
 * продолжить можно с {@link #currentWindow()} и {@link #resumePosition()}.
 * Позиция {@link ListingOptions#startAt()} применяется только к первому окну.
 */
public class DateWindowListing implements Listing {

    private static final Logger log = LoggerFactory.getLogger(DateWindowListing.class);

    private final PaginationEngine engine;
    private final String path;
    private final List<ApiRequest.QueryParam> query;
    private final ListingOptions options;
    private final DateWindows dateWindows;
    private final List<DateWindows.Window> windows;
    private final int maxPages;

    private int windowIndex = -1;
    private ListingIterator current;
    private ListingCompletion completion;
    private long itemsBefore;
    private int pagesBefore;
    private PaginationStrategy lastStrategy = PaginationStrategy.UNKNOWN;

    DateWindowListing(PaginationEngine engine,
                      String path,
                      List<ApiRequest.QueryParam> query,
                      ListingOptions options,
                      int maxPages) {
        this.engine = engine;
        this.path = path;
        this.query = query;
        this.options = options;
        this.dateWindows = options.dateWindows();
        this.windows = dateWindows.windows();
        this.maxPages = maxPages;
    }

    @Override
    public boolean hasNext() {
        while (completion == null) {
            if (current != null && current.hasNext()) {
                return true;
            }
            if (current != null && current.completion() != ListingCompletion.EXHAUSTED) {
                finish(current.completion());
                return false;
            }
            openNextWindow();
        }
        return false;
    }

    @Override
    public JsonNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return current.next();
    }

    private void openNextWindow() {
        if (windowIndex + 1 >= windows.size()) {
            closeCurrent();
            finish(ListingCompletion.EXHAUSTED);
            return;
        }
        closeCurrent();
        windowIndex++;
        if (pagesBefore >= maxPages) {
            // следующее окно ещё не начато: продолжать с него и с начала
            finish(ListingCompletion.PAGE_CEILING_REACHED);
            return;
        }
        DateWindows.Window w = windows.get(windowIndex);
        List<ApiRequest.QueryParam> q = new ArrayList<>(query);
        q.addAll(dateWindows.query(w));
        ListingOptions sub = options
                .withDateWindows(null)
                .withMaxPages(maxPages - pagesBefore)
                .startingAt(windowIndex == 0 ? options.startAt() : null);
        log.debug("[CRM][PAGE] окно {}/{} endpoint={} {}={} {}={}", windowIndex + 1, windows.size(), path,
                dateWindows.startParam(), w.start(), dateWindows.endParam(), w.end());
        current = engine.iterate(path, q, sub);
    }

    private void closeCurrent() {
        if (current != null) {
            itemsBefore += current.itemsSeen();
            pagesBefore += current.pagesFetched();
            lastStrategy = current.strategy();
            current = null;
        }
    }

    private void finish(ListingCompletion reason) {
        completion = reason;
        if (reason != ListingCompletion.EXHAUSTED) {
            log.info("[CRM][PAGE] листинг по окнам остановлен endpoint={} reason={} window={} items={}",
                    path, reason, currentWindow(), itemsSeen());
        }
    }

    /**
     * Окно, обход которого идёт или с которого листинг нужно продолжить; {@code null}, если все окна пройдены.
     */
    public DateWindows.Window currentWindow() {
        if (completion == ListingCompletion.EXHAUSTED || windowIndex < 0) {
            return null;
        }
        return windows.get(windowIndex);
    }

    @Override
    public ListingCompletion completion() {
        return completion;
    }

    @Override
    public Outcome.Failure failure() {
        return current == null ? null : current.failure();
    }

    @Override
    public ListingPosition resumePosition() {
        return current == null ? ListingPosition.start() : current.resumePosition();
    }

    @Override
    public long itemsSeen() {
        return itemsBefore + (current == null ? 0 : current.itemsSeen());
    }

    @Override
    public int pagesFetched() {
        return pagesBefore + (current == null ? 0 : current.pagesFetched());
    }

    @Override
    public PaginationStrategy strategy() {
        return current == null ? lastStrategy : current.strategy();
    }
}
