package ru.aritmos.crmconnector.webhook;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.util.List;

/**
 * Каноническое представление входящего webhook-уведомления CRM.
 *
 * @param eventName           имя события, например {@code peopleUpdated} (пустая строка, если не найдено)
 * @param resourceCollection  коллекция ресурса, например {@code people} ({@code null}, если не определена)
 * @param resourceId          идентификатор ресурса ({@code null}, если не определён)
 * @param resourceIds         все идентификаторы из уведомления (первый совпадает с {@code resourceId})
 * @param personId            человек, к которому относится событие ({@code null}, если не определён)
 * @param referenceShape      форма ссылки на ресурс в уведомлении
 * @param unresolvedReference ссылка есть, но идентификатор не получен
 * @param referenceUri        URI ресурса, если он был в уведомлении
 * @param rawPayload          исходное тело уведомления
 */
public record WebhookEvent(
        String eventName,
        String resourceCollection,
        Long resourceId,
        List<Long> resourceIds,
        Long personId,
        ReferenceShape referenceShape,
        boolean unresolvedReference,
        URI referenceUri,
        JsonNode rawPayload
) {

    public WebhookEvent {
        eventName = eventName == null ? "" : eventName;
        resourceIds = resourceIds == null ? List.of() : List.copyOf(resourceIds);
        referenceShape = referenceShape == null ? ReferenceShape.NONE : referenceShape;
    }

    public boolean hasResourceId() {
        return resourceId != null;
    }

    public boolean hasPersonId() {
        return personId != null;
    }
}
