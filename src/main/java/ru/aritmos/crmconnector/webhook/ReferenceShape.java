package ru.aritmos.crmconnector.webhook;

/**
 * Как webhook-уведомление ссылается на ресурс.
 */
public enum ReferenceShape {
    /** Числовой идентификатор прямо в поле ({@code id}, {@code personId}, {@code resourceIds[0]}). */
    FLAT_ID,
    /** Вложенный объект с полем {@code id}. */
    NESTED_OBJECT,
    /** Абсолютный URI ресурса, идентификатор получается отдельным запросом. */
    URI_REFERENCE,
    /** Ссылка на ресурс не найдена. */
    NONE
}
