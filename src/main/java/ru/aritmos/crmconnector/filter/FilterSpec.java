package ru.aritmos.crmconnector.filter;

import ru.aritmos.crmconnector.core.ApiRequest;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Упорядоченный набор условий фильтра. Условия объединяются через AND.
 */
public record FilterSpec(List<FilterCondition> conditions) {

    public FilterSpec {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        Set<String> seen = new LinkedHashSet<>();
        for (FilterCondition c : conditions) {
            if (!seen.add(c.field())) {
                throw new IllegalArgumentException("Поле фильтра указано дважды: " + c.field());
            }
        }
    }

    public static FilterSpec none() {
        return new FilterSpec(List.of());
    }

    public static FilterSpec of(FilterCondition... conditions) {
        return new FilterSpec(List.of(conditions));
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public List<String> fields() {
        return conditions.stream().map(FilterCondition::field).toList();
    }

    public FilterSpec and(FilterCondition condition) {
        List<FilterCondition> out = new ArrayList<>(conditions);
        out.add(condition);
        return new FilterSpec(out);
    }

    /**
     * Проставить локальные пути условиям, у которых путь не задан явно.
     */
    public FilterSpec withItemPaths(Function<String, String> pathForField) {
        List<FilterCondition> out = new ArrayList<>(conditions.size());
        for (FilterCondition c : conditions) {
            String mapped = c.itemPath() == null ? pathForField.apply(c.field()) : null;
            out.add(mapped == null ? c : c.atItemPath(mapped));
        }
        return new FilterSpec(out);
    }

    /**
     * Кодирование условий в query-параметры запроса.
     */
    public List<ApiRequest.QueryParam> toQuery() {
        List<ApiRequest.QueryParam> out = new ArrayList<>(conditions.size());
        for (FilterCondition c : conditions) {
            out.add(new ApiRequest.QueryParam(c.field(), c.queryValue()));
        }
        return out;
    }
}
