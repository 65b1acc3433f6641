package ru.aritmos.crmconnector.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * HTTP-транспорт на базе стандартного JDK {@link java.net.http.HttpClient}.
 * <p>
 * Клиент JDK потокобезопасен и держит собственный пул соединений, поэтому один экземпляр
 * разделяется всеми параллельными операциями без дополнительных блокировок.
 * <p>
 * Таймаут задаётся на каждую попытку и не зависит от общего дедлайна операции.
 */
public class JdkHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient client;
    private final URI baseUrl;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdkHttpTransport(HttpClient client,
                            URI baseUrl,
                            Duration requestTimeout,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.client = client;
        this.baseUrl = baseUrl;
        this.requestTimeout = requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()
                ? Duration.ofSeconds(30)
                : requestTimeout;
        this.objectMapper = objectMapper;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public CompletableFuture<Outcome> send(ApiRequest request, Map<String, String> headers) {
        HttpRequest httpRequest;
        try {
            httpRequest = build(request, headers);
        } catch (Exception e) {
            return CompletableFuture.completedFuture(
                    Outcome.Failure.of(FailureKind.CLIENT_ERROR, "Некорректный запрос: " + SensitiveDataSanitizer.sanitizeText(e.getMessage())));
        }
        if (log.isDebugEnabled()) {
            log.debug("[CRM][HTTP] {} {} headers={}", httpRequest.method(), httpRequest.uri(), SensitiveDataSanitizer.sanitizeHeaders(headers));
        }
        return client.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .handle((resp, ex) -> ex == null ? toOutcome(resp) : fromThrowable(ex));
    }

    private HttpRequest build(ApiRequest request, Map<String, String> headers) throws IOException {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(resolve(request))
                .timeout(requestTimeout)
                .header("Accept", "application/json");

        boolean hasContentType = false;
        if (headers != null) {
            for (Map.Entry<String, String> e : headers.entrySet()) {
                if (e.getKey() == null || e.getKey().isBlank()) {
                    continue;
                }
                if (e.getKey().equalsIgnoreCase("Content-Type")) {
                    hasContentType = true;
                }
                b.setHeader(e.getKey(), e.getValue() == null ? "" : e.getValue());
            }
        }

        String m = request.method();
        if (request.body() == null) {
            b.method(m, HttpRequest.BodyPublishers.noBody());
        } else {
            b.method(m, HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(request.body()), StandardCharsets.UTF_8));
            if (!hasContentType) {
                b.header("Content-Type", "application/json");
            }
        }
        return b.build();
    }

    /**
     * Итоговый URI: абсолютный адрес запроса или base URL + path, плюс query-параметры запроса.
     *
     * @throws IllegalArgumentException если абсолютный адрес указывает на чужой источник
     */
    URI resolve(ApiRequest request) {
        String target;
        if (request.absoluteUri() != null) {
            if (baseUrl != null && !Origins.sameOrigin(request.absoluteUri(), baseUrl)) {
                throw new IllegalArgumentException("адрес вне источника CRM: " + request.absoluteUri().getScheme()
                        + "://" + request.absoluteUri().getHost());
            }
            target = request.absoluteUri().toString();
        } else {
            String b = baseUrl == null ? "" : baseUrl.toString();
            if (b.endsWith("/")) {
                b = b.substring(0, b.length() - 1);
            }
            String p = request.path().trim();
            if (!p.startsWith("/")) {
                p = "/" + p;
            }
            target = b + p;
        }
        if (request.query().isEmpty()) {
            return URI.create(target);
        }
        StringBuilder sb = new StringBuilder(target);
        char sep = target.contains("?") ? '&' : '?';
        for (ApiRequest.QueryParam q : request.query()) {
            sb.append(sep)
                    .append(URLEncoder.encode(q.name(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(q.value(), StandardCharsets.UTF_8));
            sep = '&';
        }
        return URI.create(sb.toString());
    }

    private Outcome toOutcome(HttpResponse<String> resp) {
        int status = resp.statusCode();
        if (status >= 200 && status < 300) {
            return new Outcome.Success(status, resp.headers().map(), resp.body());
        }
        FailureKind kind = FailureKind.fromHttpStatus(status);
        Duration retryAfter = kind == FailureKind.RATE_LIMITED
                ? resp.headers().firstValue("Retry-After").map(this::parseRetryAfter).orElse(null)
                : null;
        String message = ApiErrorEnvelope.parse(objectMapper, resp.body()).message(status);
        return new Outcome.Failure(kind, status, retryAfter, message, resp.body());
    }

    /**
     * Значение {@code Retry-After}: число секунд или HTTP-дата.
     */
    Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        try {
            double seconds = Double.parseDouble(v);
            if (seconds < 0) {
                return null;
            }
            return Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException ignored) {
            // не число, пробуем HTTP-дату
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration d = Duration.between(clock.instant(), at.toInstant());
            return d.isNegative() ? Duration.ZERO : d;
        } catch (Exception e) {
            log.debug("[CRM][HTTP] не удалось разобрать Retry-After='{}'", v);
            return null;
        }
    }

    static Outcome.Failure fromThrowable(Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        String msg = SensitiveDataSanitizer.sanitizeText(t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage());
        if (t instanceof HttpTimeoutException) {
            return Outcome.Failure.of(FailureKind.TIMEOUT, "Таймаут HTTP-вызова: " + msg);
        }
        return Outcome.Failure.of(FailureKind.NETWORK, "Сетевая ошибка HTTP-вызова: " + msg);
    }
}
