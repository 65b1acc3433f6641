package ru.aritmos.crmconnector.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmconnector.core.ApiRequest;
import ru.aritmos.crmconnector.core.Origins;
import ru.aritmos.crmconnector.core.Outcome;
import ru.aritmos.crmconnector.core.RequestExecutor;
import ru.aritmos.crmconnector.pagination.PageEnvelope;

import java.net.URI;
import java.util.Optional;

/**
 * Резолвер URI-ссылок через API CRM: один GET по ссылке, идентификатор берётся из ресурса
 * или из первого элемента коллекции.
 * <p>
 * Ссылки на другой источник, чем базовый адрес CRM, не запрашиваются: запрос несёт ключ API.
 */
public class RestReferenceResolver implements ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(RestReferenceResolver.class);

    private final RequestExecutor executor;
    private final ObjectMapper mapper;
    private final URI trustedBase;

    /**
     * @param trustedBase базовый адрес CRM; при {@code null} URI-ссылки не запрашиваются вовсе
     */
    public RestReferenceResolver(RequestExecutor executor, ObjectMapper mapper, URI trustedBase) {
        this.executor = executor;
        this.mapper = mapper;
        this.trustedBase = trustedBase;
    }

    @Override
    public Optional<Long> resolve(URI reference, String collection) {
        if (!Origins.sameOrigin(reference, trustedBase)) {
            log.warn("[CRM][WEBHOOK] ссылка вне источника CRM не запрашивается host={}",
                    reference == null ? null : reference.getHost());
            return Optional.empty();
        }
        Outcome outcome = executor.execute(ApiRequest.get(reference));
        if (!outcome.success()) {
            Outcome.Failure f = (Outcome.Failure) outcome;
            log.warn("[CRM][WEBHOOK] ссылка не разрешена uri={} kind={} httpStatus={}", reference, f.kind(), f.httpStatus());
            return Optional.empty();
        }
        Outcome.Success s = (Outcome.Success) outcome;
        try {
            JsonNode body = mapper.readTree(s.body());
            Long direct = WebhookPayloadNormalizer.asId(body == null ? null : body.get("id"));
            if (direct != null) {
                return Optional.of(direct);
            }
            String path = collection != null ? collection : reference.getPath();
            PageEnvelope page = PageEnvelope.decode(mapper, s, path);
            if (page.items().isEmpty()) {
                log.warn("[CRM][WEBHOOK] по ссылке ресурс не найден uri={}", reference);
                return Optional.empty();
            }
            return Optional.ofNullable(WebhookPayloadNormalizer.asId(page.items().get(0).get("id")));
        } catch (JsonProcessingException e) {
            log.warn("[CRM][WEBHOOK] ответ по ссылке не разобран uri={} error={}", reference, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<JsonNode> fetch(String collection, long id) {
        if (collection == null || collection.isBlank()) {
            return Optional.empty();
        }
        String path = "/" + collection + "/" + id;
        Outcome outcome = executor.execute(ApiRequest.get(path));
        if (!outcome.success()) {
            Outcome.Failure f = (Outcome.Failure) outcome;
            log.warn("[CRM][WEBHOOK] ресурс не загружен path={} kind={} httpStatus={}", path, f.kind(), f.httpStatus());
            return Optional.empty();
        }
        try {
            JsonNode body = mapper.readTree(((Outcome.Success) outcome).body());
            return body != null && body.isObject() ? Optional.of(body) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("[CRM][WEBHOOK] ресурс не разобран path={} error={}", path, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
