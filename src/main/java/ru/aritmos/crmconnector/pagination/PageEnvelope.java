package ru.aritmos.crmconnector.pagination;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import ru.aritmos.crmconnector.core.Outcome;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Производное представление страницы листинга: элементы и метаданные пагинации.
 * <p>
 * Тело ответа только читается, исходный JSON не меняется.
 */
public record PageEnvelope(JsonNode body, String collectionKey, List<JsonNode> items, PageMetadata metadata) {

    private static final Pattern LINK_NEXT = Pattern.compile("<([^>]+)>\\s*;[^,]*rel\\s*=\\s*\"?next\"?", Pattern.CASE_INSENSITIVE);

    public PageEnvelope {
        items = items == null ? List.of() : List.copyOf(items);
        metadata = metadata == null ? PageMetadata.empty() : metadata;
    }

    /**
     * Разобрать успешный ответ листинга.
     *
     * @param mapper       Jackson mapper
     * @param response     успешный ответ
     * @param endpointPath путь endpoint (последний сегмент используется как имя коллекции)
     * @return страница
     * @throws JsonProcessingException если тело не JSON-объект
     */
    public static PageEnvelope decode(ObjectMapper mapper, Outcome.Success response, String endpointPath)
            throws JsonProcessingException {
        String raw = response.body();
        JsonNode body = mapper.readTree(raw == null || raw.isBlank() ? "{}" : raw);
        if (body == null || !body.isObject()) {
            throw new JsonParseException(null, "Ответ листинга не является JSON-объектом");
        }

        JsonNode meta = metadataNode(body);
        String key = collectionKey(body, meta, endpointPath);
        List<JsonNode> items = new ArrayList<>();
        if (key != null) {
            for (JsonNode n : body.get(key)) {
                items.add(n);
            }
        }

        String next = text(meta, "next");
        if (next == null) {
            next = text(body, "next");
        }
        URI nextLink = uri(text(meta, "nextLink"));
        if (nextLink == null) {
            nextLink = uri(text(body, "nextLink"));
        }
        String cursor = null;
        if (next != null) {
            URI asUri = next.startsWith("http://") || next.startsWith("https://") ? uri(next) : null;
            if (asUri != null) {
                if (nextLink == null) {
                    nextLink = asUri;
                }
            } else {
                cursor = next;
            }
        }
        if (nextLink == null) {
            nextLink = response.header("Link").map(PageEnvelope::linkNext).orElse(null);
        }

        Long total = number(meta, "total");
        if (total == null) {
            total = number(meta, "totalCount");
        }
        Long offset = number(meta, "offset");
        Long limit = number(meta, "limit");
        PageMetadata metadata = new PageMetadata(
                offset,
                limit == null ? null : limit.intValue(),
                total,
                cursor,
                nextLink);
        return new PageEnvelope(body, key, items, metadata);
    }

    static URI linkNext(String linkHeader) {
        if (linkHeader == null || linkHeader.isBlank()) {
            return null;
        }
        Matcher m = LINK_NEXT.matcher(linkHeader);
        return m.find() ? uri(m.group(1).trim()) : null;
    }

    private static JsonNode metadataNode(JsonNode body) {
        for (String name : List.of("_metadata", "metadata", "meta")) {
            JsonNode n = body.get(name);
            if (n != null && n.isObject()) {
                return n;
            }
        }
        return null;
    }

    private static String collectionKey(JsonNode body, JsonNode meta, String endpointPath) {
        String declared = text(meta, "collection");
        if (declared != null && isArray(body, declared)) {
            return declared;
        }
        String segment = lastSegment(endpointPath);
        if (segment != null && isArray(body, segment)) {
            return segment;
        }
        Iterator<Map.Entry<String, JsonNode>> it = body.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getKey().startsWith("_") && e.getValue().isArray()) {
                return e.getKey();
            }
        }
        return null;
    }

    private static String lastSegment(String path) {
        if (path == null) {
            return null;
        }
        String p = path;
        int q = p.indexOf('?');
        if (q >= 0) {
            p = p.substring(0, q);
        }
        String[] parts = p.split("/");
        for (int i = parts.length - 1; i >= 0; i--) {
            if (!parts[i].isBlank()) {
                return parts[i].trim();
            }
        }
        return null;
    }

    private static boolean isArray(JsonNode body, String field) {
        JsonNode n = body.get(field);
        return n != null && n.isArray();
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || !v.isValueNode()) {
            return null;
        }
        String s = v.asText();
        return s == null || s.isBlank() ? null : s.trim();
    }

    private static Long number(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (v.isNumber()) {
            return v.asLong();
        }
        if (v.isTextual()) {
            try {
                return Long.parseLong(v.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static URI uri(String s) {
        if (s == null || s.isBlank()) {
            return null;
        }
        try {
            URI u = new URI(s.trim());
            return u.isAbsolute() ? u : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
