package ru.aritmos.crmconnector.pagination;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmconnector.core.ApiRequest;
import ru.aritmos.crmconnector.core.FailureKind;
import ru.aritmos.crmconnector.core.Outcome;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;

/**
 * Ленивый обход коллекции: следующая страница запрашивается, когда буфер текущей исчерпан.
 * <p>
 * После остановки {@link #completion()} сообщает причину, а {@link #resumePosition()} позицию
 * продолжения. Ошибка страницы не бросается из {@link #hasNext()}: обход просто заканчивается
 * с {@link ListingCompletion#FAILED}.
 * <p>
 * Экземпляр не потокобезопасен.
 */
public class ListingIterator implements Listing {

    private static final Logger log = LoggerFactory.getLogger(ListingIterator.class);

    private final PaginationEngine engine;
    private final ApiRequest baseRequest;
    private final String endpointPath;
    private final Instant deadline;
    private final int maxPages;
    private final long offsetLimit;
    private final PaginationState state;
    private final Deque<JsonNode> buffer = new ArrayDeque<>();

    private boolean strategyResolved;
    private ListingCompletion completion;
    private Outcome.Failure failure;

    ListingIterator(PaginationEngine engine,
                    ApiRequest baseRequest,
                    String endpointPath,
                    ListingOptions options,
                    int pageSize,
                    int maxPages,
                    long offsetLimit) {
        this.engine = engine;
        this.baseRequest = baseRequest;
        this.endpointPath = endpointPath;
        this.deadline = options.deadline();
        this.maxPages = maxPages;
        this.offsetLimit = offsetLimit;
        this.state = new PaginationState(options.startAt(), pageSize);
        this.strategyResolved = state.strategy() != PaginationStrategy.UNKNOWN;
    }

    @Override
    public boolean hasNext() {
        while (buffer.isEmpty()) {
            if (completion != null) {
                return false;
            }
            fetchNextPage();
        }
        return true;
    }

    @Override
    public JsonNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return buffer.pollFirst();
    }

    private void fetchNextPage() {
        if (state.exhausted()) {
            finish(ListingCompletion.EXHAUSTED);
            return;
        }
        if (deadline != null && !engine.clock().instant().isBefore(deadline)) {
            finish(ListingCompletion.DEADLINE_REACHED);
            return;
        }
        if (state.pagesFetched() >= maxPages) {
            finish(ListingCompletion.PAGE_CEILING_REACHED);
            return;
        }
        if (offsetBased() && offsetLimit > 0 && state.offset() >= offsetLimit) {
            log.warn("[CRM][PAGE] достигнут предел глубины offset endpoint={} offset={} limit={}",
                    endpointPath, state.offset(), offsetLimit);
            finish(ListingCompletion.PAGE_CEILING_REACHED);
            return;
        }

        int requested = state.pageSize();
        ApiRequest request = requestForCurrentPosition(requested);
        Outcome outcome = engine.executor().execute(request);
        if (!outcome.success()) {
            failure = (Outcome.Failure) outcome;
            finish(ListingCompletion.FAILED);
            return;
        }

        PageEnvelope page;
        try {
            page = PageEnvelope.decode(engine.mapper(), (Outcome.Success) outcome, endpointPath);
        } catch (JsonProcessingException e) {
            failure = new Outcome.Failure(FailureKind.SERVER_ERROR, outcome.status().orElse(null), null,
                    "Некорректный ответ листинга: " + e.getOriginalMessage(), ((Outcome.Success) outcome).body());
            finish(ListingCompletion.FAILED);
            return;
        }

        boolean firstPage = state.pagesFetched() == 0;
        if (!strategyResolved) {
            resolveStrategy(page);
        }

        int returned = page.items().size();
        state.recordPage(returned);
        buffer.addAll(page.items());
        advance(page, returned, requested);

        // одностраничный offset-ответ не доказывает стратегию endpoint
        if (firstPage && (state.strategy() != PaginationStrategy.OFFSET || !state.exhausted())) {
            engine.strategyCache().remember(endpointPath, state.strategy());
        }
    }

    private void resolveStrategy(PageEnvelope page) {
        PaginationStrategy cached = engine.strategyCache().get(endpointPath).orElse(null);
        PaginationStrategy strategy = cached != null ? cached : engine.classifier().classify(page);
        if (strategy == PaginationStrategy.UNKNOWN) {
            state.pageSize(Math.min(state.pageSize(), engine.defaults().conservativePageSize()));
        }
        state.strategy(strategy);
        strategyResolved = true;
        log.debug("[CRM][PAGE] endpoint={} strategy={} cached={}", endpointPath, strategy, cached != null);
    }

    private void advance(PageEnvelope page, int returned, int requested) {
        PageMetadata m = page.metadata();
        switch (state.strategy()) {
            case CURSOR -> {
                if (m.hasCursor()) {
                    state.advanceCursor(m.nextCursor());
                } else {
                    state.markExhausted();
                }
            }
            case LINK_HEADER -> {
                if (m.hasLink()) {
                    state.advanceLink(m.nextLink());
                } else {
                    state.markExhausted();
                }
            }
            default -> {
                state.advanceOffset(returned);
                if (returned == 0 || returned < requested || (m.total() != null && m.total() <= state.offset())) {
                    state.markExhausted();
                }
            }
        }
    }

    private ApiRequest requestForCurrentPosition(int pageSize) {
        String limit = String.valueOf(pageSize);
        if (state.strategy() == PaginationStrategy.LINK_HEADER && state.link() != null) {
            return new ApiRequest("GET", null, state.link(), null, null, baseRequest.headers());
        }
        if (state.strategy() == PaginationStrategy.CURSOR && state.cursor() != null) {
            return baseRequest.withoutQuery("offset")
                    .withQuery("limit", limit)
                    .withQuery("next", state.cursor());
        }
        return baseRequest.withoutQuery("next")
                .withQuery("limit", limit)
                .withQuery("offset", String.valueOf(state.offset()));
    }

    private boolean offsetBased() {
        return state.strategy() == PaginationStrategy.OFFSET || state.strategy() == PaginationStrategy.UNKNOWN;
    }

    private void finish(ListingCompletion reason) {
        completion = reason;
        if (reason == ListingCompletion.FAILED) {
            log.warn("[CRM][PAGE] листинг прерван ошибкой endpoint={} pages={} items={} kind={}",
                    endpointPath, state.pagesFetched(), state.itemsSeen(), failure == null ? null : failure.kind());
        } else if (reason != ListingCompletion.EXHAUSTED) {
            log.info("[CRM][PAGE] листинг остановлен endpoint={} reason={} pages={} items={} position={}",
                    endpointPath, reason, state.pagesFetched(), state.itemsSeen(), state.position());
        } else {
            log.debug("[CRM][PAGE] листинг завершён endpoint={} pages={} items={}",
                    endpointPath, state.pagesFetched(), state.itemsSeen());
        }
    }

    @Override
    public ListingCompletion completion() {
        return completion;
    }

    @Override
    public Outcome.Failure failure() {
        return failure;
    }

    @Override
    public ListingPosition resumePosition() {
        return state.position();
    }

    @Override
    public long itemsSeen() {
        return state.itemsSeen();
    }

    @Override
    public int pagesFetched() {
        return state.pagesFetched();
    }

    @Override
    public PaginationStrategy strategy() {
        return state.strategy();
    }

    public PaginationState state() {
        return state;
    }
}
