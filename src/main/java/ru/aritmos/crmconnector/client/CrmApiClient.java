package ru.aritmos.crmconnector.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Singleton;
import ru.aritmos.crmconnector.core.ApiRequest;
import ru.aritmos.crmconnector.core.CrmApiException;
import ru.aritmos.crmconnector.core.FailureKind;
import ru.aritmos.crmconnector.core.Outcome;
import ru.aritmos.crmconnector.core.RequestExecutor;
import ru.aritmos.crmconnector.filter.FilterSpec;
import ru.aritmos.crmconnector.filter.FilteredListingService;
import ru.aritmos.crmconnector.pagination.Listing;
import ru.aritmos.crmconnector.pagination.ListingOptions;
import ru.aritmos.crmconnector.pagination.ListingResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Точка входа для ресурсных методов (people, deals, notes, ...).
 * <p>
 * Одиночные вызовы возвращают {@link Outcome}; для тех, кому удобнее исключения, есть
 * {@link #getJson(String)} и {@link Outcome#orElseThrow()}.
 */
@Singleton
public class CrmApiClient {

    private final RequestExecutor executor;
    private final FilteredListingService listings;
    private final ObjectMapper objectMapper;

    public CrmApiClient(RequestExecutor executor, FilteredListingService listings, ObjectMapper objectMapper) {
        this.executor = executor;
        this.listings = listings;
        this.objectMapper = objectMapper;
    }

    public Outcome get(String path, List<ApiRequest.QueryParam> query) {
        return executor.execute(ApiRequest.get(path).withQuery(query == null ? List.of() : query));
    }

    /**
     * GET с разбором тела.
     *
     * @throws CrmApiException при неуспешном ответе
     */
    public JsonNode getJson(String path) {
        return readBody(get(path, List.of()).orElseThrow());
    }

    public Outcome post(String path, JsonNode body) {
        return executor.execute(ApiRequest.of("POST", path, body));
    }

    public Outcome put(String path, JsonNode body) {
        return executor.execute(ApiRequest.of("PUT", path, body));
    }

    public Outcome delete(String path) {
        return executor.execute(ApiRequest.of("DELETE", path, null));
    }

    public CompletableFuture<Outcome> executeAsync(ApiRequest request) {
        return executor.executeAsync(request);
    }

    /**
     * Собрать коллекцию с фильтром.
     */
    public ListingResult list(String path, FilterSpec filter, ListingOptions options) {
        return listings.collect(path, List.of(), filter, options);
    }

    /**
     * Ленивый обход коллекции с фильтром.
     */
    public Listing iterate(String path, FilterSpec filter, ListingOptions options) {
        return listings.iterate(path, List.of(), filter, options);
    }

    private JsonNode readBody(Outcome.Success success) {
        try {
            return objectMapper.readTree(success.body().isBlank() ? "{}" : success.body());
        } catch (JsonProcessingException e) {
            throw new CrmApiException(new Outcome.Failure(
                    FailureKind.SERVER_ERROR, success.httpStatus(), null,
                    "Некорректный JSON в ответе: " + e.getOriginalMessage(), success.body()));
        }
    }
}
