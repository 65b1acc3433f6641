package ru.aritmos.crmconnector.filter;

/**
 * Оператор условия фильтра.
 */
public enum FilterOperator {
    /** Точное текстовое совпадение скаляра (с учётом регистра). */
    EQ,
    /** Совпадение с любым из перечисленных значений. */
    IN,
    /** Подстрока без учёта регистра для строк, вхождение элемента для массивов. */
    CONTAINS
}
