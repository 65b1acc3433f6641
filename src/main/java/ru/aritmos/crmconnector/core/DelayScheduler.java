package ru.aritmos.crmconnector.core;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Неблокирующая пауза между попытками.
 * <p>
 * Внедряется извне, чтобы в тестах время можно было «проматывать» без реального ожидания.
 */
@FunctionalInterface
public interface DelayScheduler {

    /**
     * Future, который завершится не раньше чем через {@code delay}.
     */
    CompletableFuture<Void> delay(Duration delay);
}
