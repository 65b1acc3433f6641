package ru.aritmos.crmconnector.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Тестовый транспорт: отвечает заранее заданными результатами и запоминает запросы.
 * <p>
 * Если очередь ответов пуста, используется обработчик {@link #handler(Function)}.
 */
public class ScriptedTransport implements HttpTransport {

    public record Sent(ApiRequest request, Map<String, String> headers) {
    }

    private final Deque<Outcome> script = new ArrayDeque<>();
    private final List<Sent> sent = new ArrayList<>();
    private Function<ApiRequest, Outcome> handler;

    public ScriptedTransport then(Outcome outcome) {
        script.addLast(outcome);
        return this;
    }

    public ScriptedTransport thenJson(int status, String body) {
        return then(json(status, body));
    }

    public ScriptedTransport handler(Function<ApiRequest, Outcome> handler) {
        this.handler = handler;
        return this;
    }

    @Override
    public synchronized CompletableFuture<Outcome> send(ApiRequest request, Map<String, String> headers) {
        sent.add(new Sent(request, Map.copyOf(headers)));
        if (!script.isEmpty()) {
            return CompletableFuture.completedFuture(script.pollFirst());
        }
        if (handler != null) {
            return CompletableFuture.completedFuture(handler.apply(request));
        }
        throw new IllegalStateException("Неожиданный запрос: " + request.method() + " " + request.target());
    }

    public synchronized List<Sent> sent() {
        return List.copyOf(sent);
    }

    public synchronized List<ApiRequest> requests() {
        return sent.stream().map(Sent::request).toList();
    }

    public synchronized int calls() {
        return sent.size();
    }

    public static Outcome json(int status, String body) {
        if (status >= 200 && status < 300) {
            return new Outcome.Success(status, Map.of("Content-Type", List.of("application/json")), body);
        }
        return new Outcome.Failure(FailureKind.fromHttpStatus(status), status, null, "HTTP " + status, body);
    }
}
