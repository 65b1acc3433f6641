package ru.aritmos.crmconnector.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Исполнитель запросов к CRM с ретраями.
 * <p>
 * Поведение:
 * <ul>
 *   <li>каждая попытка получает свежие заголовки авторизации;</li>
 *   <li>сам {@link ApiRequest} между попытками не меняется;</li>
 *   <li>пауза между попытками неблокирующая ({@link DelayScheduler});</li>
 *   <li>сетевые исключения превращаются в {@code NETWORK}/{@code TIMEOUT}, наружу не выходят;</li>
 *   <li>после исчерпания попыток возвращается последний {@link Outcome.Failure} с исходным видом ошибки;</li>
 *   <li>при заданном минимальном интервале отправки (включая повторы) разнесены не меньше чем на него.</li>
 * </ul>
 */
public class RequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

    private final HttpTransport transport;
    private final RequestAuthenticator authenticator;
    private final RetryPolicy retryPolicy;
    private final DelayScheduler delayScheduler;
    private final Duration minInterval;
    private final Clock clock;

    private Instant nextSlot;

    public RequestExecutor(HttpTransport transport,
                           RequestAuthenticator authenticator,
                           RetryPolicy retryPolicy,
                           DelayScheduler delayScheduler) {
        this(transport, authenticator, retryPolicy, delayScheduler, Duration.ZERO, Clock.systemUTC());
    }

    /**
     * @param minInterval минимальный интервал между отправками; {@code 0} отключает ограничение
     * @param clock       часы для отсчёта интервала
     */
    public RequestExecutor(HttpTransport transport,
                           RequestAuthenticator authenticator,
                           RetryPolicy retryPolicy,
                           DelayScheduler delayScheduler,
                           Duration minInterval,
                           Clock clock) {
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval не может быть отрицательным: " + minInterval);
        }
        this.transport = transport;
        this.authenticator = authenticator;
        this.retryPolicy = retryPolicy;
        this.delayScheduler = delayScheduler;
        this.minInterval = minInterval;
        this.clock = clock;
    }

    /**
     * Выполнить запрос синхронно (поток вызывающего ждёт итог, но паузы не занимают поток пула).
     */
    public Outcome execute(ApiRequest request) {
        return executeAsync(request).join();
    }

    /**
     * Выполнить запрос асинхронно. Future всегда завершается нормально.
     */
    public CompletableFuture<Outcome> executeAsync(ApiRequest request) {
        return attempt(request, 1);
    }

    private CompletableFuture<Outcome> attempt(ApiRequest request, int attemptNumber) {
        return throttled(request).thenCompose(outcome -> {
            RetryDecision decision = retryPolicy.decide(outcome, attemptNumber);
            if (!decision.retry()) {
                if (!outcome.success()) {
                    Outcome.Failure f = (Outcome.Failure) outcome;
                    log.warn("[CRM][RETRY] запрос завершён ошибкой {} {} attempts={}/{} kind={} httpStatus={} message={}",
                            request.method(), request.target(), attemptNumber, retryPolicy.maxAttempts(),
                            f.kind(), f.httpStatus(), SensitiveDataSanitizer.sanitizeText(f.message()));
                }
                return CompletableFuture.completedFuture(outcome);
            }
            Outcome.Failure f = (Outcome.Failure) outcome;
            log.debug("[CRM][RETRY] повтор {} {} attempt={}/{} kind={} delayMs={}",
                    request.method(), request.target(), attemptNumber, retryPolicy.maxAttempts(), f.kind(), decision.delay().toMillis());
            return delayScheduler.delay(decision.delay())
                    .thenCompose(ignored -> attempt(request, attemptNumber + 1));
        });
    }

    private CompletableFuture<Outcome> throttled(ApiRequest request) {
        Duration wait = reserveSlot();
        if (wait.isZero()) {
            return sendOnce(request);
        }
        log.trace("[CRM][THROTTLE] {} {} отложен на {} мс", request.method(), request.target(), wait.toMillis());
        return delayScheduler.delay(wait).thenCompose(ignored -> sendOnce(request));
    }

    /**
     * Занять ближайший свободный слот отправки и вернуть, сколько до него ждать.
     */
    private synchronized Duration reserveSlot() {
        if (minInterval.isZero()) {
            return Duration.ZERO;
        }
        Instant now = clock.instant();
        Instant slot = nextSlot == null || nextSlot.isBefore(now) ? now : nextSlot;
        nextSlot = slot.plus(minInterval);
        return Duration.between(now, slot);
    }

    private CompletableFuture<Outcome> sendOnce(ApiRequest request) {
        Map<String, String> headers;
        try {
            headers = new LinkedHashMap<>(request.headers());
            headers.putAll(authenticator.authenticate(request));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(
                    Outcome.Failure.of(FailureKind.AUTH_ERROR, SensitiveDataSanitizer.sanitizeText(e.getMessage())));
        }
        CompletableFuture<Outcome> sent;
        try {
            sent = transport.send(request, headers);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(JdkHttpTransport.fromThrowable(e));
        }
        if (sent == null) {
            return CompletableFuture.completedFuture(Outcome.Failure.of(FailureKind.NETWORK, "Транспорт не вернул результат"));
        }
        return sent.handle((o, ex) -> {
            if (ex != null) {
                return JdkHttpTransport.fromThrowable(ex);
            }
            return o == null ? Outcome.Failure.of(FailureKind.NETWORK, "Транспорт не вернул результат") : o;
        });
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public Duration minInterval() {
        return minInterval;
    }
}
