package ru.aritmos.crmconnector.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RequestExecutorTest {

    private final ManualClock clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final ManualDelayScheduler scheduler = new ManualDelayScheduler(clock);
    private final RetryPolicy policy = RetryPolicy.of(4, Duration.ofMillis(100), Duration.ofSeconds(2), 0.0);

    private RequestExecutor executor(HttpTransport transport) {
        return new RequestExecutor(transport, new ApiKeyAuthenticator("key-1", "test-system", "sys-secret"), policy, scheduler);
    }

    private static Outcome.Failure failure(FailureKind kind) {
        return new Outcome.Failure(kind, null, null, "boom " + kind, "{\"errorMessage\":\"boom\"}");
    }

    @Test
    void shouldAttemptTransientFailuresUpToMaxAttempts() {
        for (FailureKind kind : EnumSet.of(FailureKind.NETWORK, FailureKind.TIMEOUT, FailureKind.SERVER_ERROR)) {
            ScriptedTransport transport = new ScriptedTransport().handler(r -> failure(kind));

            Outcome out = executor(transport).execute(ApiRequest.get("/people"));

            assertFalse(out.success());
            assertEquals(kind, ((Outcome.Failure) out).kind(), "исходный вид ошибки должен сохраняться");
            assertEquals(4, transport.calls(), "kind=" + kind);
        }
    }

    @Test
    void shouldAttemptFatalFailuresExactlyOnce() {
        for (FailureKind kind : EnumSet.of(FailureKind.CLIENT_ERROR, FailureKind.AUTH_ERROR, FailureKind.PERMISSION_ERROR)) {
            ScriptedTransport transport = new ScriptedTransport().handler(r -> failure(kind));

            Outcome out = executor(transport).execute(ApiRequest.get("/people"));

            assertEquals(kind, ((Outcome.Failure) out).kind());
            assertEquals(1, transport.calls(), "kind=" + kind);
        }
    }

    @Test
    void shouldReturnSuccessAfterTransientFailures() {
        ScriptedTransport transport = new ScriptedTransport()
                .then(failure(FailureKind.SERVER_ERROR))
                .then(failure(FailureKind.NETWORK))
                .thenJson(200, "{\"id\":1}");

        Outcome out = executor(transport).execute(ApiRequest.get("/people/1"));

        assertTrue(out.success());
        assertEquals("{\"id\":1}", ((Outcome.Success) out).body());
        assertEquals(3, transport.calls());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), scheduler.delays());
    }

    @Test
    void shouldScheduleNextAttemptNoEarlierThanRetryAfterHint() {
        AtomicInteger n = new AtomicInteger();
        Instant[] attemptTimes = new Instant[2];
        HttpTransport transport = (request, headers) -> {
            int i = n.getAndIncrement();
            attemptTimes[i] = clock.instant();
            if (i == 0) {
                return CompletableFuture.completedFuture(
                        new Outcome.Failure(FailureKind.RATE_LIMITED, 429, Duration.ofSeconds(2), "Too Many Requests", ""));
            }
            return CompletableFuture.completedFuture(new Outcome.Success(200, Map.of(), "{}"));
        };

        Outcome out = executor(transport).execute(ApiRequest.get("/people"));

        assertTrue(out.success());
        assertEquals(2, n.get());
        Duration gap = Duration.between(attemptTimes[0], attemptTimes[1]);
        assertTrue(gap.compareTo(Duration.ofSeconds(2)) >= 0, "gap=" + gap);
        assertEquals(List.of(Duration.ofSeconds(2)), scheduler.delays());
    }

    @Test
    void shouldRegenerateAuthHeadersBeforeEveryAttempt() {
        AtomicInteger generated = new AtomicInteger();
        RequestAuthenticator auth = request -> Map.of("Authorization", "Basic token-" + generated.incrementAndGet());
        ScriptedTransport transport = new ScriptedTransport()
                .then(failure(FailureKind.SERVER_ERROR))
                .thenJson(200, "{}");
        RequestExecutor executor = new RequestExecutor(transport, auth, policy, scheduler);
        ApiRequest request = ApiRequest.get("/people").withQuery("limit", "10");

        executor.execute(request);

        assertEquals(2, generated.get());
        assertEquals("Basic token-1", transport.sent().get(0).headers().get("Authorization"));
        assertEquals("Basic token-2", transport.sent().get(1).headers().get("Authorization"));
        assertSame(request, transport.sent().get(0).request());
        assertSame(request, transport.sent().get(1).request());
    }

    @Test
    void shouldSendBasicAuthAndSystemHeaders() {
        ScriptedTransport transport = new ScriptedTransport().thenJson(200, "{}");

        executor(transport).execute(ApiRequest.get("/identity"));

        Map<String, String> headers = transport.sent().get(0).headers();
        // base64("key-1:")
        assertEquals("Basic a2V5LTE6", headers.get("Authorization"));
        assertEquals("test-system", headers.get("X-System"));
        assertEquals("sys-secret", headers.get("X-System-Key"));
    }

    @Test
    void shouldMapTransportExceptionsToOutcomes() {
        AtomicInteger calls = new AtomicInteger();
        HttpTransport timeouts = (request, headers) -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new HttpTimeoutException("request timed out"));
        };
        Outcome timeout = executor(timeouts).execute(ApiRequest.get("/people"));
        assertEquals(FailureKind.TIMEOUT, ((Outcome.Failure) timeout).kind());
        assertEquals(4, calls.get());

        HttpTransport throwing = (request, headers) -> {
            throw new IllegalStateException("connection refused");
        };
        Outcome network = executor(throwing).execute(ApiRequest.get("/people"));
        assertEquals(FailureKind.NETWORK, ((Outcome.Failure) network).kind());

        HttpTransport io = (request, headers) -> CompletableFuture.failedFuture(new IOException("reset"));
        assertEquals(FailureKind.NETWORK, ((Outcome.Failure) executor(io).execute(ApiRequest.get("/people"))).kind());
    }

    @Test
    void shouldReturnAuthErrorWhenApiKeyMissing() {
        ScriptedTransport transport = new ScriptedTransport();
        RequestExecutor executor = new RequestExecutor(transport, new ApiKeyAuthenticator(" ", null, null), policy, scheduler);

        Outcome out = executor.execute(ApiRequest.get("/people"));

        assertEquals(FailureKind.AUTH_ERROR, ((Outcome.Failure) out).kind());
        assertEquals(0, transport.calls());
    }

    @Test
    void shouldPassRawBodyOfFinalFailureUnchanged() {
        String raw = "{\"title\":\"Validation\",\"errors\":[{\"field\":\"email\",\"detail\":\"invalid\"}]}";
        ScriptedTransport transport = new ScriptedTransport()
                .then(new Outcome.Failure(FailureKind.CLIENT_ERROR, 400, null, "Validation: invalid", raw));

        Outcome out = executor(transport).execute(ApiRequest.of("POST", "/people", null));

        CrmApiException e = assertThrows(CrmApiException.class, out::orElseThrow);
        assertEquals(FailureKind.CLIENT_ERROR, e.kind());
        assertEquals(400, e.httpStatus());
        assertEquals(raw, e.rawBody());
    }

    @Test
    void shouldCompleteAsyncExecutionWithoutBlockingCaller() {
        ScriptedTransport transport = new ScriptedTransport()
                .then(failure(FailureKind.NETWORK))
                .thenJson(201, "{\"id\":5}");

        CompletableFuture<Outcome> future = executor(transport).executeAsync(ApiRequest.of("POST", "/notes", null));

        assertTrue(future.join().success());
        assertEquals(201, future.join().status().orElseThrow());
    }

    @Test
    void shouldSpaceBackToBackRequestsByMinInterval() {
        List<Instant> sentAt = new ArrayList<>();
        ScriptedTransport transport = new ScriptedTransport().handler(r -> {
            sentAt.add(clock.instant());
            return ScriptedTransport.json(200, "{}");
        });
        RequestExecutor executor = new RequestExecutor(transport, new ApiKeyAuthenticator("key-1", null, null),
                policy, scheduler, Duration.ofMillis(100), clock);

        executor.execute(ApiRequest.get("/people"));
        executor.execute(ApiRequest.get("/people"));
        executor.execute(ApiRequest.get("/deals"));

        assertEquals(3, sentAt.size());
        assertEquals(Duration.ofMillis(100), Duration.between(sentAt.get(0), sentAt.get(1)));
        assertEquals(Duration.ofMillis(100), Duration.between(sentAt.get(1), sentAt.get(2)));
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(100)), scheduler.delays());
    }

    @Test
    void shouldNotDelayWhenIntervalAlreadyElapsed() {
        ScriptedTransport transport = new ScriptedTransport().handler(r -> ScriptedTransport.json(200, "{}"));
        RequestExecutor executor = new RequestExecutor(transport, new ApiKeyAuthenticator("key-1", null, null),
                policy, scheduler, Duration.ofMillis(100), clock);

        executor.execute(ApiRequest.get("/people"));
        clock.advance(Duration.ofMillis(250));
        executor.execute(ApiRequest.get("/people"));

        assertEquals(2, transport.calls());
        assertTrue(scheduler.delays().isEmpty());
    }

    @Test
    void shouldNotThrottleWithoutMinInterval() {
        ScriptedTransport transport = new ScriptedTransport().handler(r -> ScriptedTransport.json(200, "{}"));
        RequestExecutor executor = executor(transport);

        for (int i = 0; i < 5; i++) {
            executor.execute(ApiRequest.get("/people"));
        }

        assertEquals(5, transport.calls());
        assertTrue(scheduler.delays().isEmpty());
        assertEquals(Duration.ZERO, executor.minInterval());
    }

    @Test
    void shouldRejectNegativeMinInterval() {
        assertThrows(IllegalArgumentException.class, () -> new RequestExecutor(new ScriptedTransport(),
                new ApiKeyAuthenticator("key-1", null, null), policy, scheduler, Duration.ofMillis(-1), clock));
    }
}
