package ru.aritmos.crmconnector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmconnector.core.ApiKeyAuthenticator;
import ru.aritmos.crmconnector.core.DelayScheduler;
import ru.aritmos.crmconnector.core.ExecutorDelayScheduler;
import ru.aritmos.crmconnector.core.HttpTransport;
import ru.aritmos.crmconnector.core.JdkHttpTransport;
import ru.aritmos.crmconnector.core.RequestAuthenticator;
import ru.aritmos.crmconnector.core.RequestExecutor;
import ru.aritmos.crmconnector.core.RetryPolicy;
import ru.aritmos.crmconnector.filter.EmergencyFilter;
import ru.aritmos.crmconnector.filter.FilterProbe;
import ru.aritmos.crmconnector.filter.FilterSupport;
import ru.aritmos.crmconnector.filter.FilterSupportTable;
import ru.aritmos.crmconnector.filter.FilteredListingService;
import ru.aritmos.crmconnector.pagination.PageClassifier;
import ru.aritmos.crmconnector.pagination.PaginationDefaults;
import ru.aritmos.crmconnector.pagination.PaginationEngine;
import ru.aritmos.crmconnector.pagination.StrategyCache;
import ru.aritmos.crmconnector.webhook.ReferenceResolver;
import ru.aritmos.crmconnector.webhook.RestReferenceResolver;
import ru.aritmos.crmconnector.webhook.WebhookPayloadNormalizer;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Сборка компонентов клиента CRM из {@link CrmConnectorProperties}.
 */
@Factory
public class CrmConnectorFactory {

    private static final Logger log = LoggerFactory.getLogger(CrmConnectorFactory.class);

    @Singleton
    Clock clock() {
        return Clock.systemUTC();
    }

    @Singleton
    DelayScheduler delayScheduler() {
        return new ExecutorDelayScheduler();
    }

    @Singleton
    HttpTransport httpTransport(CrmConnectorProperties props, ObjectMapper objectMapper, Clock clock) {
        String baseUrl = props.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("Не задан crm-connector.base-url");
        }
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(props.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        log.info("[CRM] транспорт: baseUrl={} requestTimeout={}", baseUrl, props.getRequestTimeout());
        return new JdkHttpTransport(client, URI.create(baseUrl.trim()), props.getRequestTimeout(), objectMapper, clock);
    }

    @Singleton
    RequestAuthenticator requestAuthenticator(CrmConnectorProperties props) {
        return new ApiKeyAuthenticator(props.getApiKey(), props.getSystem(), props.getSystemKey());
    }

    @Singleton
    RetryPolicy retryPolicy(CrmConnectorProperties props) {
        CrmConnectorProperties.RetryConfig r = props.getRetry();
        return RetryPolicy.of(r.getMaxAttempts(), r.getBaseDelay(), r.getMaxDelay(), r.getJitter());
    }

    @Singleton
    RequestExecutor requestExecutor(CrmConnectorProperties props,
                                    HttpTransport transport,
                                    RequestAuthenticator authenticator,
                                    RetryPolicy retryPolicy,
                                    DelayScheduler delayScheduler,
                                    Clock clock) {
        return new RequestExecutor(transport, authenticator, retryPolicy, delayScheduler,
                props.getMinRequestInterval(), clock);
    }

    @Singleton
    StrategyCache strategyCache(CrmConnectorProperties props, Clock clock) {
        CrmConnectorProperties.PaginationConfig p = props.getPagination();
        return new StrategyCache(clock, p.getStrategyCacheMaxEntries(), p.getStrategyCacheTtl());
    }

    @Singleton
    PaginationEngine paginationEngine(CrmConnectorProperties props,
                                      RequestExecutor executor,
                                      ObjectMapper objectMapper,
                                      StrategyCache strategyCache,
                                      PageClassifier classifier,
                                      Clock clock) {
        CrmConnectorProperties.PaginationConfig p = props.getPagination();
        PaginationDefaults defaults = new PaginationDefaults(
                p.getPageSize(), p.getConservativePageSize(), p.getMaxPages(), p.getOffsetLimit());
        return new PaginationEngine(executor, objectMapper, strategyCache, classifier, clock, defaults);
    }

    @Singleton
    FilterSupportTable filterSupportTable(CrmConnectorProperties props, ObjectMapper objectMapper) {
        CrmConnectorProperties.FiltersConfig f = props.getFilters();
        FilterSupportTable table = FilterSupportTable.fromClasspath(objectMapper, f.getSupportTable());
        declare(table, f.getSupported(), FilterSupport.SUPPORTED);
        declare(table, f.getBroken(), FilterSupport.KNOWN_BROKEN);
        return table;
    }

    @Singleton
    FilteredListingService filteredListingService(CrmConnectorProperties props,
                                                  PaginationEngine engine,
                                                  FilterSupportTable table,
                                                  RequestExecutor executor,
                                                  ObjectMapper objectMapper) {
        CrmConnectorProperties.FiltersConfig f = props.getFilters();
        FilterProbe probe = f.isProbeEnabled()
                ? new FilterProbe(executor, objectMapper, f.getProbeSampleSize(), f.getProbeMatchThreshold())
                : null;
        return new FilteredListingService(engine, new EmergencyFilter(f.getEmergencyPageCeiling()), table, probe);
    }

    @Singleton
    ReferenceResolver referenceResolver(CrmConnectorProperties props, RequestExecutor executor, ObjectMapper objectMapper) {
        String baseUrl = props.getBaseUrl();
        URI trustedBase = baseUrl == null || baseUrl.isBlank() ? null : URI.create(baseUrl.trim());
        return new RestReferenceResolver(executor, objectMapper, trustedBase);
    }

    @Singleton
    WebhookPayloadNormalizer webhookPayloadNormalizer(ObjectMapper objectMapper) {
        return new WebhookPayloadNormalizer(objectMapper);
    }

    private static void declare(FilterSupportTable table, Map<String, List<String>> byEndpoint, FilterSupport support) {
        if (byEndpoint == null) {
            return;
        }
        for (Map.Entry<String, List<String>> e : byEndpoint.entrySet()) {
            table.declareAll(e.getKey(), e.getValue(), support);
        }
    }
}
