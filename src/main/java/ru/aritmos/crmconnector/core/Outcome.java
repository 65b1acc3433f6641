package ru.aritmos.crmconnector.core;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Результат HTTP-обмена с CRM: {@link Success} или {@link Failure}.
 * <p>
 * Исполнитель запросов никогда не бросает исключения наружу: вызывающий всегда получает
 * структурированный результат и сам решает, что делать с ошибкой.
 */
public sealed interface Outcome permits Outcome.Success, Outcome.Failure {

    boolean success();

    Optional<Integer> status();

    /**
     * Вернуть успешный результат или бросить {@link CrmApiException} с исходным видом ошибки.
     */
    default Success orElseThrow() {
        if (this instanceof Success s) {
            return s;
        }
        throw new CrmApiException((Failure) this);
    }

    record Success(int httpStatus, Map<String, List<String>> headers, String body) implements Outcome {

        public Success {
            headers = headers == null ? Map.of() : headers;
            body = body == null ? "" : body;
        }

        @Override
        public boolean success() {
            return true;
        }

        @Override
        public Optional<Integer> status() {
            return Optional.of(httpStatus);
        }

        /**
         * Первое значение заголовка (без учёта регистра имени).
         */
        public Optional<String> header(String name) {
            for (Map.Entry<String, List<String>> e : headers.entrySet()) {
                if (e.getKey() != null && e.getKey().equalsIgnoreCase(name) && e.getValue() != null && !e.getValue().isEmpty()) {
                    return Optional.ofNullable(e.getValue().get(0));
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Неуспешный результат.
     * <p>
     * {@code rawBody} передаётся без изменений, чтобы ресурсный слой мог показать
     * пользователю ошибки по конкретным полям.
     */
    record Failure(FailureKind kind,
                   Integer httpStatus,
                   Duration retryAfter,
                   String message,
                   String rawBody) implements Outcome {

        public Failure {
            if (kind == null) {
                throw new IllegalArgumentException("kind обязателен для Failure");
            }
            message = message == null ? "" : message;
        }

        public static Failure of(FailureKind kind, String message) {
            return new Failure(kind, null, null, message, null);
        }

        @Override
        public boolean success() {
            return false;
        }

        @Override
        public Optional<Integer> status() {
            return Optional.ofNullable(httpStatus);
        }

        public Optional<Duration> retryAfterHint() {
            return Optional.ofNullable(retryAfter);
        }
    }
}
