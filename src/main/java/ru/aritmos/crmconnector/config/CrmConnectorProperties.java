package ru.aritmos.crmconnector.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Introspected;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Настройки клиента CRM.
 * <p>
 * Секреты (API-ключ, ключ системы) задаются через переменные окружения и в логи не попадают.
 */
@Introspected
@ConfigurationProperties("crm-connector")
public class CrmConnectorProperties {

    /** Базовый URL API, например {@code https://api.followupboss.com/v1}. */
    private String baseUrl = "https://api.followupboss.com/v1";
    /** API-ключ (передаётся как пользователь HTTP Basic). */
    private String apiKey;
    /** Имя интегрирующей системы (заголовок X-System). */
    private String system;
    /** Ключ интегрирующей системы (заголовок X-System-Key). */
    private String systemKey;
    private Duration connectTimeout = Duration.ofSeconds(10);
    /** Таймаут одной HTTP-попытки. */
    private Duration requestTimeout = Duration.ofSeconds(30);
    /** Минимальный интервал между отправками запросов; {@code 0} отключает ограничение. */
    private Duration minRequestInterval = Duration.ofMillis(100);

    private RetryConfig retry = new RetryConfig();
    private PaginationConfig pagination = new PaginationConfig();
    private FiltersConfig filters = new FiltersConfig();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getSystem() {
        return system;
    }

    public void setSystem(String system) {
        this.system = system;
    }

    public String getSystemKey() {
        return systemKey;
    }

    public void setSystemKey(String systemKey) {
        this.systemKey = systemKey;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getMinRequestInterval() {
        return minRequestInterval;
    }

    public void setMinRequestInterval(Duration minRequestInterval) {
        this.minRequestInterval = minRequestInterval;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public void setRetry(RetryConfig retry) {
        this.retry = retry;
    }

    public PaginationConfig getPagination() {
        return pagination;
    }

    public void setPagination(PaginationConfig pagination) {
        this.pagination = pagination;
    }

    public FiltersConfig getFilters() {
        return filters;
    }

    public void setFilters(FiltersConfig filters) {
        this.filters = filters;
    }

    /**
     * Повторы запросов.
     */
    @Introspected
    public static class RetryConfig {
        /** всего попыток, включая первую */
        private int maxAttempts = 4;
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
        /** доля разброса задержки, 0..1 */
        private double jitter = 0.2;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    /**
     * Пагинация.
     */
    @Introspected
    public static class PaginationConfig {
        private int pageSize = 100;
        /** размер страницы для endpoint без метаданных пагинации */
        private int conservativePageSize = 25;
        private int maxPages = 1000;
        /** предел глубины offset; глубже сервер не отдаёт */
        private long offsetLimit = 2000;
        private Duration strategyCacheTtl = Duration.ofHours(1);
        private int strategyCacheMaxEntries = 256;

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public int getConservativePageSize() {
            return conservativePageSize;
        }

        public void setConservativePageSize(int conservativePageSize) {
            this.conservativePageSize = conservativePageSize;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        public long getOffsetLimit() {
            return offsetLimit;
        }

        public void setOffsetLimit(long offsetLimit) {
            this.offsetLimit = offsetLimit;
        }

        public Duration getStrategyCacheTtl() {
            return strategyCacheTtl;
        }

        public void setStrategyCacheTtl(Duration strategyCacheTtl) {
            this.strategyCacheTtl = strategyCacheTtl;
        }

        public int getStrategyCacheMaxEntries() {
            return strategyCacheMaxEntries;
        }

        public void setStrategyCacheMaxEntries(int strategyCacheMaxEntries) {
            this.strategyCacheMaxEntries = strategyCacheMaxEntries;
        }
    }

    /**
     * Фильтры и локальная фильтрация.
     */
    @Introspected
    public static class FiltersConfig {
        /** classpath-ресурс таблицы поддержки фильтров */
        private String supportTable = "crm-filter-support.json";
        private boolean probeEnabled = true;
        private int probeSampleSize = 10;
        /** минимальная доля совпадений в пробе, при которой фильтр считается рабочим */
        private double probeMatchThreshold = 0.5;
        /** предел страниц при локальной фильтрации */
        private int emergencyPageCeiling = 200;
        /** endpoint → заведомо сломанные поля (дополняют таблицу) */
        private Map<String, List<String>> broken = new LinkedHashMap<>();
        /** endpoint → поддерживаемые поля (дополняют таблицу) */
        private Map<String, List<String>> supported = new LinkedHashMap<>();

        public String getSupportTable() {
            return supportTable;
        }

        public void setSupportTable(String supportTable) {
            this.supportTable = supportTable;
        }

        public boolean isProbeEnabled() {
            return probeEnabled;
        }

        public void setProbeEnabled(boolean probeEnabled) {
            this.probeEnabled = probeEnabled;
        }

        public int getProbeSampleSize() {
            return probeSampleSize;
        }

        public void setProbeSampleSize(int probeSampleSize) {
            this.probeSampleSize = probeSampleSize;
        }

        public double getProbeMatchThreshold() {
            return probeMatchThreshold;
        }

        public void setProbeMatchThreshold(double probeMatchThreshold) {
            this.probeMatchThreshold = probeMatchThreshold;
        }

        public int getEmergencyPageCeiling() {
            return emergencyPageCeiling;
        }

        public void setEmergencyPageCeiling(int emergencyPageCeiling) {
            this.emergencyPageCeiling = emergencyPageCeiling;
        }

        public Map<String, List<String>> getBroken() {
            return broken;
        }

        public void setBroken(Map<String, List<String>> broken) {
            this.broken = broken;
        }

        public Map<String, List<String>> getSupported() {
            return supported;
        }

        public void setSupported(Map<String, List<String>> supported) {
            this.supported = supported;
        }
    }
}
