package ru.aritmos.crmconnector.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import ru.aritmos.crmconnector.core.ApiKeyAuthenticator;
import ru.aritmos.crmconnector.core.ManualClock;
import ru.aritmos.crmconnector.core.ManualDelayScheduler;
import ru.aritmos.crmconnector.core.RequestExecutor;
import ru.aritmos.crmconnector.core.RetryPolicy;
import ru.aritmos.crmconnector.core.ScriptedTransport;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RestReferenceResolverTest {

    private final ScriptedTransport transport = new ScriptedTransport();
    private final RestReferenceResolver resolver = new RestReferenceResolver(
            new RequestExecutor(transport, new ApiKeyAuthenticator("SECRET-KEY", null, null),
                    RetryPolicy.of(1, Duration.ofMillis(10), Duration.ofMillis(10), 0.0),
                    new ManualDelayScheduler(new ManualClock(Instant.parse("2024-01-01T00:00:00Z")))),
            new ObjectMapper(),
            URI.create("https://api.example.com/v1"));

    @Test
    void shouldResolveSingleResource() {
        transport.thenJson(200, "{\"id\":42,\"name\":\"Jane\"}");

        assertEquals(Optional.of(42L), resolver.resolve(URI.create("https://api.example.com/v1/people/42"), "people"));
        assertEquals(1, transport.calls());
    }

    @Test
    void shouldResolveFirstItemOfCollection() {
        transport.thenJson(200, "{\"_metadata\":{\"collection\":\"people\",\"total\":1},\"people\":[{\"id\":9}]}");

        assertEquals(Optional.of(9L), resolver.resolve(URI.create("https://api.example.com/v1/people?email=a@b.c"), "people"));
    }

    @Test
    void shouldReturnEmptyOnFailure() {
        transport.thenJson(404, "{\"errorMessage\":\"Not found\"}");

        assertTrue(resolver.resolve(URI.create("https://api.example.com/v1/people/1"), "people").isEmpty());
    }

    @Test
    void shouldReturnEmptyForEmptyCollection() {
        transport.thenJson(200, "{\"people\":[]}");

        assertTrue(resolver.resolve(URI.create("https://api.example.com/v1/people?id=5"), "people").isEmpty());
    }

    @Test
    void shouldNotCallForeignHosts() {
        assertTrue(resolver.resolve(URI.create("https://attacker.example/steal"), "people").isEmpty());
        assertTrue(resolver.resolve(URI.create("http://api.example.com/v1/people/1"), "people").isEmpty());
        assertTrue(resolver.resolve(URI.create("https://api.example.com:8443/v1/people/1"), "people").isEmpty());
        assertTrue(resolver.resolve(URI.create("https://api.example.com.attacker.example/v1/people/1"), "people").isEmpty());

        assertEquals(0, transport.calls());
    }

    @Test
    void shouldLeaveForeignReferenceUnresolvedWithoutSendingKey() {
        WebhookEvent e = new WebhookPayloadNormalizer(new ObjectMapper()).normalize(
                "{\"event\":\"peopleUpdated\",\"uri\":\"https://attacker.example/steal\"}", resolver);

        assertTrue(e.unresolvedReference());
        assertNull(e.resourceId());
        assertEquals(0, transport.calls());
    }

    @Test
    void shouldFetchResourceByCollectionAndId() {
        transport.thenJson(200, "{\"id\":77,\"personId\":315,\"message\":\"hi\"}");

        Optional<JsonNode> resource = resolver.fetch("textMessages", 77);

        assertTrue(resource.isPresent());
        assertEquals(315, resource.get().get("personId").asInt());
        assertEquals("/textMessages/77", transport.requests().get(0).path());
    }

    @Test
    void shouldReturnEmptyWhenFetchFails() {
        transport.thenJson(404, "{\"errorMessage\":\"Not found\"}");

        assertTrue(resolver.fetch("notes", 1).isEmpty());
    }
}
