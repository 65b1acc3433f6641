package ru.aritmos.crmconnector.core;

import java.util.regex.Pattern;

/**
 * Нормализация пути endpoint для ключей кэшей и таблиц.
 */
public final class EndpointKeys {

    private static final Pattern NUMERIC = Pattern.compile("\\d+");

    private EndpointKeys() {
    }

    /**
     * Путь без query и лишних слэшей, числовые сегменты заменены на {@code {id}}.
     * Например {@code people/12/notes?limit=5} даёт {@code /people/{id}/notes}.
     *
     * @return ключ или {@code null} для пустого пути
     */
    public static String normalize(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        String p = path.trim();
        int q = p.indexOf('?');
        if (q >= 0) {
            p = p.substring(0, q);
        }
        StringBuilder sb = new StringBuilder();
        for (String part : p.split("/")) {
            if (part.isBlank()) {
                continue;
            }
            sb.append('/').append(NUMERIC.matcher(part).matches() ? "{id}" : part);
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }
}
