package ru.aritmos.crmconnector.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.aritmos.crmconnector.core.ApiKeyAuthenticator;
import ru.aritmos.crmconnector.core.ApiRequest;
import ru.aritmos.crmconnector.core.ManualClock;
import ru.aritmos.crmconnector.core.ManualDelayScheduler;
import ru.aritmos.crmconnector.core.Outcome;
import ru.aritmos.crmconnector.core.RequestExecutor;
import ru.aritmos.crmconnector.core.RetryPolicy;
import ru.aritmos.crmconnector.core.ScriptedTransport;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class DateWindowListingTest {

    private static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");
    private static final int TOTAL = 3000;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ManualClock clock = new ManualClock(EPOCH);
    private final ScriptedTransport transport = new ScriptedTransport();
    private final PaginationEngine engine = new PaginationEngine(
            new RequestExecutor(transport, new ApiKeyAuthenticator("key", null, null),
                    RetryPolicy.of(3, Duration.ofMillis(10), Duration.ofMillis(100), 0.0),
                    new ManualDelayScheduler(clock)),
            mapper, new StrategyCache(clock, 100, Duration.ofHours(1)), new PageClassifier(), clock,
            new PaginationDefaults(100, 25, 1000, 2000));

    /**
     * Элемент {@code i} создан через {@code i} минут после {@link #EPOCH}: 1440 элементов в сутки.
     */
    private static Instant created(int i) {
        return EPOCH.plus(Duration.ofMinutes(i));
    }

    /**
     * Сервер: offset-пагинация поверх элементов, попавших в {@code [created_start, created_end)}.
     */
    private static Outcome people(ApiRequest r) {
        Instant start = r.queryValue("created_start") == null ? Instant.MIN : Instant.parse(r.queryValue("created_start"));
        Instant end = r.queryValue("created_end") == null ? Instant.MAX : Instant.parse(r.queryValue("created_end"));
        List<Integer> matching = IntStream.range(0, TOTAL)
                .filter(i -> !created(i).isBefore(start) && created(i).isBefore(end))
                .boxed()
                .toList();
        int offset = Integer.parseInt(r.queryValue("offset"));
        int limit = Integer.parseInt(r.queryValue("limit"));
        if (offset > 2000) {
            return ScriptedTransport.json(400, "{\"errorMessage\":\"offset too deep\"}");
        }
        String items = matching.stream()
                .skip(offset)
                .limit(limit)
                .map(i -> "{\"id\":" + i + ",\"created\":\"" + created(i) + "\"}")
                .collect(Collectors.joining(",", "[", "]"));
        return ScriptedTransport.json(200, "{\"_metadata\":{\"collection\":\"people\",\"offset\":" + offset
                + ",\"limit\":" + limit + ",\"total\":" + matching.size() + "},\"people\":" + items + "}");
    }

    private static ListingOptions byDay() {
        return ListingOptions.defaults().withDateWindows(
                DateWindows.created(EPOCH, EPOCH.plus(Duration.ofDays(3)), Duration.ofDays(1)));
    }

    private static List<Integer> ids(List<JsonNode> nodes) {
        return nodes.stream().map(n -> n.get("id").asInt()).toList();
    }

    @Test
    void shouldStopAtOffsetLimitWithoutWindows() {
        transport.handler(DateWindowListingTest::people);

        ListingResult result = engine.collect("/people", List.of(), ListingOptions.defaults());

        assertEquals(ListingCompletion.PAGE_CEILING_REACHED, result.completion());
        assertEquals(2000, result.items().size());
    }

    @Test
    void shouldCollectCollectionLargerThanOffsetLimitThroughWindows() {
        transport.handler(DateWindowListingTest::people);

        ListingResult result = engine.collect("/people", List.of(), byDay());

        assertEquals(ListingCompletion.EXHAUSTED, result.completion());
        assertEquals(IntStream.range(0, TOTAL).boxed().toList(), ids(result.items()));
        assertEquals(TOTAL, result.itemsSeen());
        assertEquals(15 + 15 + 2, result.pagesFetched());
        assertEquals(PaginationStrategy.OFFSET, result.strategy());
        assertTrue(transport.requests().stream()
                .allMatch(r -> Integer.parseInt(r.queryValue("offset")) < 2000));
    }

    @Test
    void shouldRestartOffsetAndSendBoundsForEachWindow() {
        transport.handler(DateWindowListingTest::people);

        engine.collect("/people", List.of(new ApiRequest.QueryParam("sort", "created")), byDay());

        List<ApiRequest> starts = transport.requests().stream()
                .filter(r -> "0".equals(r.queryValue("offset")))
                .toList();
        assertEquals(3, starts.size());
        assertEquals("2024-01-01T00:00:00Z", starts.get(0).queryValue("created_start"));
        assertEquals("2024-01-02T00:00:00Z", starts.get(0).queryValue("created_end"));
        assertEquals("2024-01-02T00:00:00Z", starts.get(1).queryValue("created_start"));
        assertEquals("2024-01-04T00:00:00Z", starts.get(2).queryValue("created_end"));
        assertTrue(transport.requests().stream().allMatch(r -> "created".equals(r.queryValue("sort"))));
    }

    @Test
    void shouldShareMaxPagesAcrossWindows() {
        transport.handler(DateWindowListingTest::people);

        Listing listing = engine.listing("/people", List.of(), byDay().withMaxPages(20));
        ListingResult result = ListingResult.drain(listing, false);

        assertEquals(ListingCompletion.PAGE_CEILING_REACHED, result.completion());
        assertEquals(20, result.pagesFetched());
        assertEquals(1440 + 500, result.items().size());
        DateWindowListing windowed = (DateWindowListing) listing;
        assertEquals(EPOCH.plus(Duration.ofDays(1)), windowed.currentWindow().start());
        assertEquals(ListingPosition.offset(500), result.resumePosition());
    }

    @Test
    void shouldPointAtNextWindowWhenCeilingFallsOnBoundary() {
        transport.handler(DateWindowListingTest::people);

        DateWindowListing listing = (DateWindowListing) engine.listing("/people", List.of(), byDay().withMaxPages(15));
        ListingResult result = ListingResult.drain(listing, false);

        assertEquals(ListingCompletion.PAGE_CEILING_REACHED, result.completion());
        assertEquals(1440, result.items().size());
        assertEquals(EPOCH.plus(Duration.ofDays(1)), listing.currentWindow().start());
        assertEquals(ListingPosition.start(), result.resumePosition());
        assertEquals(15, transport.calls());
    }

    @Test
    void shouldStopOnFailureInsideWindow() {
        transport.handler(r -> "2024-01-02T00:00:00Z".equals(r.queryValue("created_start"))
                ? ScriptedTransport.json(403, "{}")
                : people(r));

        ListingResult result = engine.collect("/people", List.of(), byDay().withPartialResults(true));

        assertEquals(ListingCompletion.FAILED, result.completion());
        assertNotNull(result.failure());
        assertEquals(1440, result.items().size());
    }

    @Test
    void shouldSplitRangeIntoHalfOpenWindows() {
        DateWindows w = DateWindows.updated(EPOCH, EPOCH.plus(Duration.ofDays(70)), DateWindows.DEFAULT_WINDOW);

        List<DateWindows.Window> windows = w.windows();

        assertEquals(3, windows.size());
        assertEquals(EPOCH, windows.get(0).start());
        assertEquals(windows.get(0).end(), windows.get(1).start());
        assertEquals(EPOCH.plus(Duration.ofDays(70)), windows.get(2).end());
        assertEquals("updated_start", w.startParam());
        assertEquals("updated_end", w.endParam());
    }

    @Test
    void shouldCoverTwoYearsByDefault() {
        DateWindows w = DateWindows.lastTwoYears("created", EPOCH);

        assertEquals(EPOCH.minus(Duration.ofDays(730)), w.from());
        assertEquals(EPOCH, w.to());
        assertEquals(25, w.windows().size());
    }

    @Test
    void shouldRejectInvalidWindows() {
        assertThrows(IllegalArgumentException.class,
                () -> new DateWindows("deleted", EPOCH, EPOCH.plusSeconds(1), Duration.ofDays(1)));
        assertThrows(IllegalArgumentException.class,
                () -> DateWindows.created(EPOCH, EPOCH, Duration.ofDays(1)));
        assertThrows(IllegalArgumentException.class,
                () -> DateWindows.created(EPOCH, EPOCH.plusSeconds(10), Duration.ZERO));
    }
}
