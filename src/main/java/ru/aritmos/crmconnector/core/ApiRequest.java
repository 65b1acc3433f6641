package ru.aritmos.crmconnector.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Неизменяемое описание HTTP-запроса к CRM.
 * <p>
 * Адрес задаётся либо относительным {@code path} (склеивается с base URL транспорта),
 * либо абсолютным {@code absoluteUri} (например, nextLink из ответа сервера).
 * Порядок query-параметров сохраняется.
 * <p>
 * Заголовки авторизации сюда не кладутся: они формируются {@link RequestAuthenticator}
 * перед каждой попыткой.
 */
public record ApiRequest(
        String method,
        String path,
        URI absoluteUri,
        List<QueryParam> query,
        JsonNode body,
        Map<String, String> headers
) {

    public ApiRequest {
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        if ((path == null || path.isBlank()) && absoluteUri == null) {
            throw new IllegalArgumentException("Не задан ни path, ни absoluteUri запроса");
        }
        query = query == null ? List.of() : List.copyOf(query);
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static ApiRequest get(String path) {
        return new ApiRequest("GET", path, null, List.of(), null, Map.of());
    }

    public static ApiRequest get(URI absoluteUri) {
        return new ApiRequest("GET", null, absoluteUri, List.of(), null, Map.of());
    }

    public static ApiRequest of(String method, String path, JsonNode body) {
        return new ApiRequest(method, path, null, List.of(), body, Map.of());
    }

    /**
     * Копия запроса, в которой параметр {@code name} заменён (или добавлен в конец).
     */
    public ApiRequest withQuery(String name, String value) {
        List<QueryParam> out = new ArrayList<>(query.size() + 1);
        boolean replaced = false;
        for (QueryParam p : query) {
            if (p.name().equals(name)) {
                if (!replaced) {
                    out.add(new QueryParam(name, value));
                    replaced = true;
                }
                continue;
            }
            out.add(p);
        }
        if (!replaced) {
            out.add(new QueryParam(name, value));
        }
        return new ApiRequest(method, path, absoluteUri, out, body, headers);
    }

    public ApiRequest withoutQuery(String name) {
        List<QueryParam> out = new ArrayList<>(query.size());
        for (QueryParam p : query) {
            if (!p.name().equals(name)) {
                out.add(p);
            }
        }
        return new ApiRequest(method, path, absoluteUri, out, body, headers);
    }

    public ApiRequest withQuery(List<QueryParam> params) {
        ApiRequest r = this;
        if (params != null) {
            for (QueryParam p : params) {
                r = r.withQuery(p.name(), p.value());
            }
        }
        return r;
    }

    /**
     * Первое значение query-параметра или null.
     */
    public String queryValue(String name) {
        for (QueryParam p : query) {
            if (p.name().equals(name)) {
                return p.value();
            }
        }
        return null;
    }

    /**
     * Человекочитаемая цель запроса для логов.
     */
    public String target() {
        return absoluteUri != null ? absoluteUri.toString() : path;
    }

    public record QueryParam(String name, String value) {
        public QueryParam {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Имя query-параметра не может быть пустым");
            }
            value = value == null ? "" : value;
        }
    }
}
