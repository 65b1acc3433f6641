package ru.aritmos.crmconnector.filter;

/**
 * Что известно о поддержке фильтра конкретным endpoint.
 */
public enum FilterSupport {
    /** Сервер применяет фильтр корректно. */
    SUPPORTED,
    /** Фильтр заведомо сломан (данные таблицы поддержки или конфигурации). */
    KNOWN_BROKEN,
    /** Сервер отвечает 400 на параметр. */
    REJECTED,
    /** Сервер принимает параметр, но возвращает нефильтрованные данные. */
    IGNORED,
    /** Сведений нет. */
    UNKNOWN;

    /**
     * Фильтр нужно применять локально.
     */
    public boolean requiresLocalFiltering() {
        return this == KNOWN_BROKEN || this == REJECTED || this == IGNORED;
    }
}
