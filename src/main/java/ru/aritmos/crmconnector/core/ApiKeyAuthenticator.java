package ru.aritmos.crmconnector.core;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Авторизация по API-ключу CRM.
 * <p>
 * Ключ передаётся как имя пользователя HTTP Basic с пустым паролем.
 * Необязательные заголовки идентификации системы ({@code X-System}, {@code X-System-Key})
 * пробрасываются без изменений в каждом запросе.
 */
public class ApiKeyAuthenticator implements RequestAuthenticator {

    public static final String X_SYSTEM = "X-System";
    public static final String X_SYSTEM_KEY = "X-System-Key";

    private final String apiKey;
    private final String system;
    private final String systemKey;

    public ApiKeyAuthenticator(String apiKey, String system, String systemKey) {
        this.apiKey = normalize(apiKey);
        this.system = normalize(system);
        this.systemKey = normalize(systemKey);
    }

    @Override
    public Map<String, String> authenticate(ApiRequest request) {
        if (apiKey == null) {
            throw new IllegalStateException("API-ключ CRM не задан (crm-connector.api-key / FOLLOW_UP_BOSS_API_KEY)");
        }
        Map<String, String> out = new LinkedHashMap<>();
        String token = Base64.getEncoder().encodeToString((apiKey + ":").getBytes(StandardCharsets.UTF_8));
        out.put("Authorization", "Basic " + token);
        if (system != null) {
            out.put(X_SYSTEM, system);
        }
        if (systemKey != null) {
            out.put(X_SYSTEM_KEY, systemKey);
        }
        return out;
    }

    private static String normalize(String s) {
        if (s == null) {
            return null;
        }
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
