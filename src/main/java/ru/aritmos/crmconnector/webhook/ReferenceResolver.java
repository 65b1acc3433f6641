package ru.aritmos.crmconnector.webhook;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.util.Optional;

/**
 * Обращения нормализатора webhook-уведомлений к API CRM.
 * <p>
 * Нормализатор вызывает {@link #resolve} не более одного раза на уведомление.
 */
@FunctionalInterface
public interface ReferenceResolver {

    /**
     * @param reference  абсолютный URI ресурса
     * @param collection коллекция ресурса, если определена ({@code null} иначе)
     * @return идентификатор или пусто, если ресурс не найден
     */
    Optional<Long> resolve(URI reference, String collection);

    /**
     * Загрузить ресурс коллекции по идентификатору. Используется для поиска {@code personId}
     * у заметок, звонков и сообщений.
     *
     * @return тело ресурса или пусто; по умолчанию загрузка не поддерживается
     */
    default Optional<JsonNode> fetch(String collection, long id) {
        return Optional.empty();
    }
}
