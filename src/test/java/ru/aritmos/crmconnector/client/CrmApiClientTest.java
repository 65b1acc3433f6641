package ru.aritmos.crmconnector.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.aritmos.crmconnector.core.ApiKeyAuthenticator;
import ru.aritmos.crmconnector.core.ApiRequest;
import ru.aritmos.crmconnector.core.CrmApiException;
import ru.aritmos.crmconnector.core.FailureKind;
import ru.aritmos.crmconnector.core.ManualClock;
import ru.aritmos.crmconnector.core.ManualDelayScheduler;
import ru.aritmos.crmconnector.core.Outcome;
import ru.aritmos.crmconnector.core.RequestExecutor;
import ru.aritmos.crmconnector.core.RetryPolicy;
import ru.aritmos.crmconnector.core.ScriptedTransport;
import ru.aritmos.crmconnector.filter.EmergencyFilter;
import ru.aritmos.crmconnector.filter.FilterCondition;
import ru.aritmos.crmconnector.filter.FilterSpec;
import ru.aritmos.crmconnector.filter.FilterSupport;
import ru.aritmos.crmconnector.filter.FilterSupportTable;
import ru.aritmos.crmconnector.filter.FilteredListingService;
import ru.aritmos.crmconnector.pagination.ListingOptions;
import ru.aritmos.crmconnector.pagination.ListingResult;
import ru.aritmos.crmconnector.pagination.PageClassifier;
import ru.aritmos.crmconnector.pagination.PaginationDefaults;
import ru.aritmos.crmconnector.pagination.PaginationEngine;
import ru.aritmos.crmconnector.pagination.StrategyCache;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CrmApiClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ManualClock clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final ScriptedTransport transport = new ScriptedTransport();
    private final FilterSupportTable table = FilterSupportTable.empty();
    private final CrmApiClient client;

    CrmApiClientTest() {
        RequestExecutor executor = new RequestExecutor(transport, new ApiKeyAuthenticator("key", null, null),
                RetryPolicy.of(3, Duration.ofMillis(10), Duration.ofMillis(100), 0.0), new ManualDelayScheduler(clock));
        PaginationEngine engine = new PaginationEngine(executor, mapper,
                new StrategyCache(clock, 10, Duration.ofHours(1)), new PageClassifier(), clock, PaginationDefaults.standard());
        client = new CrmApiClient(executor, new FilteredListingService(engine, new EmergencyFilter(20), table, null), mapper);
    }

    @Test
    void shouldReturnParsedBody() {
        transport.thenJson(200, "{\"id\":5,\"firstName\":\"Ann\"}");

        JsonNode body = client.getJson("/people/5");

        assertEquals("Ann", body.get("firstName").asText());
        assertEquals("/people/5", transport.requests().get(0).path());
    }

    @Test
    void shouldThrowWithOriginalFailure() {
        transport.thenJson(404, "{\"errorMessage\":\"Person not found\"}");

        CrmApiException e = assertThrows(CrmApiException.class, () -> client.getJson("/people/404"));

        assertEquals(FailureKind.CLIENT_ERROR, e.kind());
        assertEquals(404, e.httpStatus());
        assertTrue(e.rawBody().contains("Person not found"));
    }

    @Test
    void shouldSendWriteRequests() {
        transport.thenJson(201, "{\"id\":9}").thenJson(204, "");

        Outcome created = client.post("/notes", mapper.createObjectNode().put("body", "hi"));
        Outcome deleted = client.delete("/notes/9");

        assertTrue(created.success());
        assertTrue(deleted.success());
        ApiRequest post = transport.requests().get(0);
        assertEquals("POST", post.method());
        assertEquals("hi", post.body().get("body").asText());
        assertEquals("DELETE", transport.requests().get(1).method());
    }

    @Test
    void shouldListWithLocalFilter() {
        table.declare("/people", "stage", FilterSupport.KNOWN_BROKEN);
        transport.thenJson(200, "{\"_metadata\":{\"collection\":\"people\",\"offset\":0,\"limit\":10,\"total\":3},"
                + "\"people\":[{\"id\":1,\"stage\":\"Lead\"},{\"id\":2,\"stage\":\"Closed\"},{\"id\":3,\"stage\":\"Lead\"}]}");

        ListingResult result = client.list("/people", FilterSpec.of(FilterCondition.eq("stage", "Lead")),
                ListingOptions.defaults().withPageSize(10));

        assertEquals(List.of(1L, 3L), result.items().stream().map(n -> n.get("id").asLong()).toList());
        assertTrue(result.exhausted());
        assertNull(transport.requests().get(0).queryValue("stage"));
    }
}
