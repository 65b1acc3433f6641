package ru.aritmos.crmconnector.core;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Маскирование учётных данных CRM в логах и сообщениях об ошибках.
 * <p>
 * API-ключ уходит в заголовке {@code Authorization: Basic ...}, ключ системы в {@code X-System-Key};
 * оба значения не должны попадать в лог ни в каком виде.
 */
public final class SensitiveDataSanitizer {

    private SensitiveDataSanitizer() {
    }

    private static final Set<String> FORBIDDEN_KEYS = Set.of(
            "authorization",
            "proxy-authorization",
            "cookie",
            "set-cookie",
            "x-system-key",
            "x-api-key",
            "api_key",
            "apikey"
    );

    private static final String MASK = "***";

    /**
     * Санитизировать заголовки (новая карта, ключи сохраняются).
     */
    public static Map<String, String> sanitizeHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : headers.entrySet()) {
            String k = e.getKey();
            if (k == null) {
                continue;
            }
            if (FORBIDDEN_KEYS.contains(k.toLowerCase(Locale.ROOT).trim())) {
                out.put(k, MASK);
                continue;
            }
            out.put(k, sanitizeText(e.getValue()));
        }
        return out;
    }

    /**
     * Санитизировать текст: Basic/Bearer токены, {@code api_key=...}, переводы строк.
     */
    public static String sanitizeText(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }
        String t = text;
        t = t.replaceAll("(?i)(basic|bearer)\\s+[^\\s]+", "$1 " + MASK);
        t = t.replaceAll("(?i)(api_key|apikey|x-system-key)\\s*[=:]\\s*[^\\s&]+", "$1=" + MASK);
        t = t.replaceAll("[\\r\\n\\t]", " ").trim();
        return t;
    }
}
