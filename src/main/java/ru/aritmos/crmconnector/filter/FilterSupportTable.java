package ru.aritmos.crmconnector.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.crmconnector.core.EndpointKeys;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Таблица поддержки фильтров: endpoint → {поддерживаемые, заведомо сломанные поля, локальные пути}.
 * <p>
 * Источники в порядке приоритета:
 * <ol>
 *   <li>результаты, обнаруженные во время работы (probe, ответ 400);</li>
 *   <li>сломанные поля из ресурса и конфигурации;</li>
 *   <li>поддерживаемые поля из ресурса и конфигурации.</li>
 * </ol>
 * Формат ресурса:
 * <pre>
 * {"endpoints": {"/people": {"supported": ["stage"], "broken": ["pond"], "itemPaths": {"pond": "ponds"}}}}
 * </pre>
 * Потокобезопасна.
 */
public class FilterSupportTable {

    private static final Logger log = LoggerFactory.getLogger(FilterSupportTable.class);

    private final Map<String, FilterSupport> declared = new ConcurrentHashMap<>();
    private final Map<String, FilterSupport> discovered = new ConcurrentHashMap<>();
    private final Map<String, String> itemPaths = new ConcurrentHashMap<>();

    public static FilterSupportTable empty() {
        return new FilterSupportTable();
    }

    /**
     * Загрузить таблицу из classpath. Отсутствующий ресурс даёт пустую таблицу.
     *
     * @throws IllegalStateException если ресурс есть, но не читается
     */
    public static FilterSupportTable fromClasspath(ObjectMapper mapper, String resource) {
        FilterSupportTable table = new FilterSupportTable();
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = FilterSupportTable.class.getClassLoader();
        }
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("[CRM][FILTER] таблица поддержки фильтров не найдена: {}", resource);
                return table;
            }
            table.load(mapper.readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Не удалось прочитать таблицу фильтров " + resource + ": " + e.getMessage(), e);
        }
        return table;
    }

    void load(JsonNode root) {
        JsonNode endpoints = root == null ? null : root.get("endpoints");
        if (endpoints == null || !endpoints.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = endpoints.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String endpoint = e.getKey();
            JsonNode def = e.getValue();
            for (JsonNode f : def.path("supported")) {
                declare(endpoint, f.asText(), FilterSupport.SUPPORTED);
            }
            for (JsonNode f : def.path("broken")) {
                declare(endpoint, f.asText(), FilterSupport.KNOWN_BROKEN);
            }
            Iterator<Map.Entry<String, JsonNode>> paths = def.path("itemPaths").fields();
            while (paths.hasNext()) {
                Map.Entry<String, JsonNode> p = paths.next();
                itemPath(endpoint, p.getKey(), p.getValue().asText());
            }
        }
    }

    /**
     * Объявить поддержку поля (ресурс или конфигурация).
     * Сломанное поле не понижается до поддерживаемого.
     */
    public void declare(String endpoint, String field, FilterSupport support) {
        String key = key(endpoint, field);
        if (key == null || support == null) {
            return;
        }
        if (support == FilterSupport.SUPPORTED) {
            declared.putIfAbsent(key, support);
        } else {
            declared.put(key, support);
        }
    }

    public void declareAll(String endpoint, Collection<String> fields, FilterSupport support) {
        if (fields == null) {
            return;
        }
        for (String f : fields) {
            declare(endpoint, f, support);
        }
    }

    public void itemPath(String endpoint, String field, String path) {
        String key = key(endpoint, field);
        if (key != null && path != null && !path.isBlank()) {
            itemPaths.put(key, path.trim());
        }
    }

    /**
     * Запомнить результат, обнаруженный во время работы.
     */
    public void record(String endpoint, String field, FilterSupport support) {
        String key = key(endpoint, field);
        if (key == null || support == null || support == FilterSupport.UNKNOWN) {
            return;
        }
        FilterSupport previous = discovered.put(key, support);
        if (previous != support) {
            log.info("[CRM][FILTER] поддержка фильтра обновлена endpoint={} field={} support={}",
                    EndpointKeys.normalize(endpoint), field, support);
        }
    }

    public FilterSupport status(String endpoint, String field) {
        String key = key(endpoint, field);
        if (key == null) {
            return FilterSupport.UNKNOWN;
        }
        FilterSupport d = discovered.get(key);
        if (d != null) {
            return d;
        }
        return declared.getOrDefault(key, FilterSupport.UNKNOWN);
    }

    /**
     * Путь поля в элементе коллекции для локальной проверки, или {@code null}.
     */
    public String itemPath(String endpoint, String field) {
        String key = key(endpoint, field);
        return key == null ? null : itemPaths.get(key);
    }

    /**
     * Сбросить обнаруженные во время работы сведения (например, после обновления CRM).
     */
    public void clearDiscoveries() {
        discovered.clear();
    }

    private static String key(String endpoint, String field) {
        String e = EndpointKeys.normalize(endpoint);
        if (e == null || field == null || field.isBlank()) {
            return null;
        }
        return e + "#" + field.trim();
    }
}
