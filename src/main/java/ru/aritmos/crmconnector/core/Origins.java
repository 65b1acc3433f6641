package ru.aritmos.crmconnector.core;

import java.net.URI;
import java.util.Locale;

/**
 * Сравнение источников (scheme + host + port) абсолютных URI.
 * <p>
 * Заголовки авторизации CRM уходят только на источник базового адреса: ссылки из ответов
 * ({@code nextLink}, {@code Link}) и из входящих webhook-уведомлений проверяются здесь.
 */
public final class Origins {

    private Origins() {
    }

    /**
     * @return {@code true}, если оба URI абсолютные и совпадают по схеме, хосту и порту
     */
    public static boolean sameOrigin(URI candidate, URI trusted) {
        if (candidate == null || trusted == null || !candidate.isAbsolute() || !trusted.isAbsolute()) {
            return false;
        }
        String scheme = lower(candidate.getScheme());
        if (!scheme.equals(lower(trusted.getScheme()))) {
            return false;
        }
        if (candidate.getHost() == null || !lower(candidate.getHost()).equals(lower(trusted.getHost()))) {
            return false;
        }
        return port(candidate) == port(trusted);
    }

    private static int port(URI uri) {
        if (uri.getPort() >= 0) {
            return uri.getPort();
        }
        return "https".equals(lower(uri.getScheme())) ? 443 : 80;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
