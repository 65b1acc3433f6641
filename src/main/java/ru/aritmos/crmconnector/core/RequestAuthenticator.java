package ru.aritmos.crmconnector.core;

import java.util.Map;

/**
 * Формирование заголовков авторизации для очередной попытки.
 * <p>
 * Вызывается перед каждой попыткой, а не один раз на запрос: короткоживущие токены
 * должны перевыпускаться на ретраях.
 */
@FunctionalInterface
public interface RequestAuthenticator {

    /**
     * Заголовки, которые добавляются к заголовкам запроса (и перекрывают их).
     *
     * @throws IllegalStateException если учётные данные не заданы
     */
    Map<String, String> authenticate(ApiRequest request);
}
