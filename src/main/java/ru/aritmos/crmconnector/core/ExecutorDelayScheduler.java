package ru.aritmos.crmconnector.core;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Реализация паузы на базе {@link CompletableFuture#delayedExecutor(long, TimeUnit)}.
 * <p>
 * Поток вызывающего не блокируется: продолжение ретрая выполняется в общем пуле.
 */
public class ExecutorDelayScheduler implements DelayScheduler {

    @Override
    public CompletableFuture<Void> delay(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
        }, CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
    }
}
