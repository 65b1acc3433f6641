package ru.aritmos.crmconnector.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmconnector.core.ApiRequest;
import ru.aritmos.crmconnector.core.FailureKind;
import ru.aritmos.crmconnector.core.Outcome;
import ru.aritmos.crmconnector.core.RequestExecutor;
import ru.aritmos.crmconnector.pagination.PageEnvelope;

import java.util.List;

/**
 * Проверка фильтра одним небольшим запросом к живому сервису.
 * <p>
 * Сервер отвечает 400 → {@link FilterSupport#REJECTED}; доля совпадений в выборке ниже порога →
 * {@link FilterSupport#IGNORED}; иначе {@link FilterSupport#SUPPORTED}.
 * Пустая выборка или ошибка другого вида ничего не доказывают: результат {@link FilterSupport#UNKNOWN}.
 */
public class FilterProbe {

    private static final Logger log = LoggerFactory.getLogger(FilterProbe.class);

    private final RequestExecutor executor;
    private final ObjectMapper mapper;
    private final int sampleSize;
    private final double matchThreshold;

    public FilterProbe(RequestExecutor executor, ObjectMapper mapper, int sampleSize, double matchThreshold) {
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("sampleSize должен быть > 0");
        }
        if (matchThreshold < 0.0 || matchThreshold > 1.0) {
            throw new IllegalArgumentException("matchThreshold должен быть в [0, 1]");
        }
        this.executor = executor;
        this.mapper = mapper;
        this.sampleSize = sampleSize;
        this.matchThreshold = matchThreshold;
    }

    public ProbeResult probe(String path, List<ApiRequest.QueryParam> query, FilterSpec filter) {
        ApiRequest request = ApiRequest.get(path)
                .withQuery(query == null ? List.of() : query)
                .withQuery(filter.toQuery())
                .withQuery("limit", String.valueOf(sampleSize))
                .withQuery("offset", "0");
        Outcome outcome = executor.execute(request);
        if (!outcome.success()) {
            Outcome.Failure f = (Outcome.Failure) outcome;
            if (f.kind() == FailureKind.CLIENT_ERROR && Integer.valueOf(400).equals(f.httpStatus())) {
                log.info("[CRM][FILTER] сервер отклонил фильтр endpoint={} fields={}", path, filter.fields());
                return new ProbeResult(FilterSupport.REJECTED, 0, 0, f);
            }
            return new ProbeResult(FilterSupport.UNKNOWN, 0, 0, f);
        }

        PageEnvelope page;
        try {
            page = PageEnvelope.decode(mapper, (Outcome.Success) outcome, path);
        } catch (JsonProcessingException e) {
            log.warn("[CRM][FILTER] ответ пробы не разобран endpoint={} error={}", path, e.getOriginalMessage());
            return new ProbeResult(FilterSupport.UNKNOWN, 0, 0, null);
        }

        List<JsonNode> items = page.items();
        if (items.isEmpty()) {
            log.info("[CRM][FILTER] проба вернула пустую выборку endpoint={} fields={}", path, filter.fields());
            return new ProbeResult(FilterSupport.UNKNOWN, 0, 0, null);
        }
        FilterPredicate predicate = new FilterPredicate(filter);
        int matched = 0;
        for (JsonNode item : items) {
            if (predicate.test(item)) {
                matched++;
            }
        }
        ProbeResult result = new ProbeResult(FilterSupport.UNKNOWN, items.size(), matched, null);
        FilterSupport verdict = result.matchRatio() >= matchThreshold ? FilterSupport.SUPPORTED : FilterSupport.IGNORED;
        log.info("[CRM][FILTER] проба endpoint={} fields={} matched={}/{} threshold={} verdict={}",
                path, filter.fields(), matched, items.size(), matchThreshold, verdict);
        return new ProbeResult(verdict, items.size(), matched, null);
    }
}
