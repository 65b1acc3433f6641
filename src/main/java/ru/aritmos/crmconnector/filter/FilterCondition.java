package ru.aritmos.crmconnector.filter;

import java.util.ArrayList;
import java.util.List;

/**
 * Одно условие фильтра.
 *
 * @param field    имя query-параметра на сервере
 * @param operator оператор
 * @param values   значения (для EQ и CONTAINS ровно одно)
 * @param itemPath путь к полю в элементе коллекции для локальной проверки
 *                 (через точку, {@code null} означает совпадение с {@code field})
 */
public record FilterCondition(String field, FilterOperator operator, List<String> values, String itemPath) {

    public FilterCondition {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Поле фильтра не задано");
        }
        if (operator == null) {
            throw new IllegalArgumentException("Оператор фильтра не задан: " + field);
        }
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Значения фильтра не заданы: " + field);
        }
        for (String v : values) {
            if (v == null) {
                throw new IllegalArgumentException("Значение фильтра не может быть null: " + field);
            }
        }
        if (operator != FilterOperator.IN && values.size() != 1) {
            throw new IllegalArgumentException("Оператор " + operator + " принимает одно значение: " + field);
        }
        field = field.trim();
        values = List.copyOf(values);
        itemPath = itemPath == null || itemPath.isBlank() ? null : itemPath.trim();
    }

    public static FilterCondition eq(String field, Object value) {
        return new FilterCondition(field, FilterOperator.EQ, List.of(String.valueOf(value)), null);
    }

    public static FilterCondition in(String field, List<?> values) {
        List<String> text = new ArrayList<>(values.size());
        for (Object v : values) {
            if (v == null) {
                throw new IllegalArgumentException("Значение фильтра не может быть null: " + field);
            }
            text.add(v.toString());
        }
        return new FilterCondition(field, FilterOperator.IN, text, null);
    }

    public static FilterCondition contains(String field, Object value) {
        return new FilterCondition(field, FilterOperator.CONTAINS, List.of(String.valueOf(value)), null);
    }

    public FilterCondition atItemPath(String path) {
        return new FilterCondition(field, operator, values, path);
    }

    /**
     * Путь, по которому условие проверяется локально.
     */
    public String effectiveItemPath() {
        return itemPath == null ? field : itemPath;
    }

    /**
     * Значение query-параметра: для IN значения через запятую.
     */
    public String queryValue() {
        return String.join(",", values);
    }
}
