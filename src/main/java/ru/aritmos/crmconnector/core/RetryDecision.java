package ru.aritmos.crmconnector.core;

import java.time.Duration;

/**
 * Решение политики ретраев: повторять ли запрос и через какую паузу.
 */
public record RetryDecision(boolean retry, Duration delay) {

    private static final RetryDecision STOP = new RetryDecision(false, Duration.ZERO);

    public RetryDecision {
        delay = delay == null || delay.isNegative() ? Duration.ZERO : delay;
    }

    public static RetryDecision stop() {
        return STOP;
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }
}
