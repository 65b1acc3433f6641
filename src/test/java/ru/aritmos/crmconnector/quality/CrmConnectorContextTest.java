package ru.aritmos.crmconnector.quality;

import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import ru.aritmos.crmconnector.client.CrmApiClient;
import ru.aritmos.crmconnector.config.CrmConnectorProperties;
import ru.aritmos.crmconnector.core.RequestExecutor;
import ru.aritmos.crmconnector.core.RetryPolicy;
import ru.aritmos.crmconnector.filter.FilterSupport;
import ru.aritmos.crmconnector.filter.FilterSupportTable;
import ru.aritmos.crmconnector.webhook.ReferenceShape;
import ru.aritmos.crmconnector.webhook.WebhookEvent;
import ru.aritmos.crmconnector.webhook.WebhookPayloadNormalizer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Quality-gate (эвристика) и проверка сборки контекста коннектора.
 */
@MicronautTest
class CrmConnectorContextTest {

    @Inject
    CrmApiClient client;

    @Inject
    CrmConnectorProperties properties;

    @Inject
    RetryPolicy retryPolicy;

    @Inject
    RequestExecutor requestExecutor;

    @Inject
    FilterSupportTable filterSupportTable;

    @Inject
    WebhookPayloadNormalizer webhookPayloadNormalizer;

    @Test
    void shouldNotContainForbiddenPatternsInMainSources() throws Exception {
        Path root = Path.of("src/main/java");
        assertTrue(Files.exists(root), "TEST_EXPECTED: отсутствует src/main/java");

        List<Path> files;
        try (var walk = Files.walk(root)) {
            files = walk.filter(p -> p.toString().endsWith(".java")).toList();
        }
        assertFalse(files.isEmpty(), "TEST_EXPECTED: не найдено java-файлов в src/main/java");

        for (Path p : files) {
            String text = Files.readString(p);
            assertFalse(text.contains("System.out"), "TEST_EXPECTED: запрещён System.out: " + p);
            assertFalse(text.contains("System.err"), "TEST_EXPECTED: запрещён System.err: " + p);
            assertFalse(text.contains("printStackTrace"), "TEST_EXPECTED: запрещён printStackTrace: " + p);
            assertFalse(text.contains("@SuppressWarnings"), "TEST_EXPECTED: запрещён @SuppressWarnings: " + p);
        }
    }

    @Test
    void shouldBindDefaultConfiguration() {
        assertNotNull(client);
        assertFalse(properties.getBaseUrl().isBlank());
        assertEquals(4, properties.getRetry().getMaxAttempts());
        assertEquals(Duration.ofMillis(500), properties.getRetry().getBaseDelay());
        assertEquals(100, properties.getPagination().getPageSize());
        assertEquals(2000L, properties.getPagination().getOffsetLimit());
        assertEquals(10, properties.getFilters().getProbeSampleSize());
        assertEquals(4, retryPolicy.maxAttempts());
        assertEquals(Duration.ofMillis(100), requestExecutor.minInterval());
    }

    @Test
    void shouldLoadFilterSupportTable() {
        assertEquals(FilterSupport.KNOWN_BROKEN, filterSupportTable.status("/people", "pond"));
        assertEquals("ponds", filterSupportTable.itemPath("/people", "pond"));
    }

    @Test
    void shouldNormalizeWebhookWithInjectedNormalizer() {
        WebhookEvent e = webhookPayloadNormalizer.normalize("{\"event\":\"peopleUpdated\",\"resourceIds\":[12]}");

        assertEquals(12L, e.resourceId());
        assertEquals("people", e.resourceCollection());
        assertEquals(ReferenceShape.FLAT_ID, e.referenceShape());
    }
}
