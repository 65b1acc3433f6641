package ru.aritmos.crmconnector.core;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Политика повторов HTTP-вызовов.
 * <p>
 * Чистая функция {@code (outcome, attempt) -> решение}:
 * <ul>
 *   <li>{@code CLIENT_ERROR}, {@code AUTH_ERROR}, {@code PERMISSION_ERROR} не повторяются никогда;</li>
 *   <li>{@code NETWORK}, {@code TIMEOUT}, {@code SERVER_ERROR} повторяются, пока {@code attempt < maxAttempts};</li>
 *   <li>{@code RATE_LIMITED} повторяется с паузой из подсказки сервера (не сокращается),
 *       а без подсказки по общей экспоненциальной схеме.</li>
 * </ul>
 * Пауза: {@code min(maxDelay, baseDelay * 2^(attempt-1))} с мультипликативным jitter
 * в диапазоне {@code [1 - jitterFraction, 1 + jitterFraction]}.
 */
public final class RetryPolicy {

    private static final Set<FailureKind> MANDATORY = EnumSet.of(
            FailureKind.NETWORK, FailureKind.TIMEOUT, FailureKind.SERVER_ERROR, FailureKind.RATE_LIMITED);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFraction;
    private final Set<FailureKind> retryableKinds;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts,
                       Duration baseDelay,
                       Duration maxDelay,
                       double jitterFraction,
                       Set<FailureKind> retryableKinds,
                       DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts должен быть >= 1, получено " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay должен быть неотрицательным");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay должен быть не меньше baseDelay");
        }
        if (jitterFraction < 0.0 || jitterFraction > 1.0) {
            throw new IllegalArgumentException("jitterFraction должен быть в диапазоне [0, 1], получено " + jitterFraction);
        }
        EnumSet<FailureKind> kinds = EnumSet.noneOf(FailureKind.class);
        if (retryableKinds != null) {
            kinds.addAll(retryableKinds);
        }
        // Фатальные виды исключаются всегда, даже если их передали явно.
        kinds.removeIf(k -> !k.isTransient());
        if (!kinds.containsAll(MANDATORY)) {
            throw new IllegalArgumentException("retryableKinds обязан содержать NETWORK, TIMEOUT, SERVER_ERROR и RATE_LIMITED");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterFraction = jitterFraction;
        this.retryableKinds = Collections.unmodifiableSet(kinds);
        this.random = random == null ? () -> ThreadLocalRandom.current().nextDouble() : random;
    }

    /**
     * Политика с набором повторяемых видов по умолчанию (все временные виды).
     */
    public static RetryPolicy of(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFraction) {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, jitterFraction,
                EnumSet.of(FailureKind.NETWORK, FailureKind.TIMEOUT, FailureKind.SERVER_ERROR, FailureKind.RATE_LIMITED),
                null);
    }

    /**
     * Решить, нужен ли повтор после попытки номер {@code attemptNumber} (нумерация с 1).
     */
    public RetryDecision decide(Outcome outcome, int attemptNumber) {
        if (outcome == null || outcome.success()) {
            return RetryDecision.stop();
        }
        Outcome.Failure failure = (Outcome.Failure) outcome;
        if (!retryableKinds.contains(failure.kind())) {
            return RetryDecision.stop();
        }
        if (attemptNumber >= maxAttempts) {
            return RetryDecision.stop();
        }
        if (failure.kind() == FailureKind.RATE_LIMITED && failure.retryAfter() != null) {
            return RetryDecision.retryAfter(failure.retryAfter());
        }
        return RetryDecision.retryAfter(jittered(unjitteredDelay(attemptNumber)));
    }

    /**
     * Пауза без jitter после попытки {@code attemptNumber}.
     */
    public Duration unjitteredDelay(int attemptNumber) {
        int exp = Math.min(30, Math.max(0, attemptNumber - 1));
        long ms = baseDelay.toMillis() * (1L << exp);
        if (ms < 0 || ms > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(ms);
    }

    private Duration jittered(Duration delay) {
        if (jitterFraction == 0.0) {
            return delay;
        }
        double factor = 1.0 - jitterFraction + (2.0 * jitterFraction * random.getAsDouble());
        return Duration.ofMillis(Math.round(delay.toMillis() * factor));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    public double jitterFraction() {
        return jitterFraction;
    }

    public Set<FailureKind> retryableKinds() {
        return retryableKinds;
    }
}
