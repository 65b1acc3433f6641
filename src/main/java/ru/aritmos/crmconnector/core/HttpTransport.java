package ru.aritmos.crmconnector.core;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Одна HTTP-попытка без ретраев.
 * <p>
 * Вынесено в интерфейс, чтобы:
 * <ul>
 *   <li>подменять реализацию (пул соединений, прокси, TLS);</li>
 *   <li>тестировать исполнитель и пагинацию без реальной сети.</li>
 * </ul>
 * Реализация обязана сама сопоставить статус ответа {@link FailureKind}; исключения
 * уровня сети допускается возвращать через исключительно завершённый future.
 */
public interface HttpTransport {

    /**
     * Выполнить запрос.
     *
     * @param request исходный запрос (не изменяется)
     * @param headers итоговые заголовки попытки: заголовки запроса + авторизация
     * @return результат попытки
     */
    CompletableFuture<Outcome> send(ApiRequest request, Map<String, String> headers);
}
