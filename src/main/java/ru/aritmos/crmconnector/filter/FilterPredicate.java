package ru.aritmos.crmconnector.filter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Локальная проверка элемента коллекции по {@link FilterSpec}.
 * <p>
 * Правила:
 * <ul>
 *   <li>EQ: текстовое равенство скаляров с учётом регистра ({@code 134} равно {@code "134"});</li>
 *   <li>IN: EQ с любым значением из списка;</li>
 *   <li>CONTAINS: подстрока без учёта регистра; для массивов вхождение элемента (без учёта регистра);</li>
 *   <li>отсутствующее или null поле не совпадает никогда;</li>
 *   <li>поле-массив совпадает, если совпадает хотя бы один элемент;</li>
 *   <li>поле-объект сравнивается по его {@code id}.</li>
 * </ul>
 */
public final class FilterPredicate implements Predicate<JsonNode> {

    private final FilterSpec spec;

    public FilterPredicate(FilterSpec spec) {
        this.spec = spec == null ? FilterSpec.none() : spec;
    }

    @Override
    public boolean test(JsonNode item) {
        if (item == null || item.isNull()) {
            return false;
        }
        for (FilterCondition c : spec.conditions()) {
            if (!matches(item, c)) {
                return false;
            }
        }
        return true;
    }

    static boolean matches(JsonNode item, FilterCondition c) {
        JsonNode value = resolve(item, c.effectiveItemPath());
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isArray()) {
            for (JsonNode element : value) {
                if (matchesScalar(element, c, true)) {
                    return true;
                }
            }
            return false;
        }
        return matchesScalar(value, c, false);
    }

    private static boolean matchesScalar(JsonNode value, FilterCondition c, boolean arrayElement) {
        String actual = scalarText(value);
        if (actual == null) {
            return false;
        }
        return switch (c.operator()) {
            case EQ, IN -> c.values().contains(actual);
            case CONTAINS -> arrayElement
                    ? actual.equalsIgnoreCase(c.values().get(0))
                    : actual.toLowerCase(Locale.ROOT).contains(c.values().get(0).toLowerCase(Locale.ROOT));
        };
    }

    private static String scalarText(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isObject()) {
            JsonNode id = value.get("id");
            return id != null && id.isValueNode() && !id.isNull() ? id.asText() : null;
        }
        if (!value.isValueNode()) {
            return null;
        }
        if (value.isFloatingPointNumber() && value.decimalValue().stripTrailingZeros().scale() <= 0) {
            return value.decimalValue().toBigInteger().toString();
        }
        return value.asText();
    }

    /**
     * Значение по пути через точку. Промежуточный массив разворачивается в массив значений.
     */
    static JsonNode resolve(JsonNode node, String path) {
        JsonNode current = node;
        String[] parts = path.split("\\.");
        for (int i = 0; i < parts.length; i++) {
            if (current == null || current.isNull()) {
                return null;
            }
            if (current.isArray()) {
                String rest = String.join(".", Arrays.copyOfRange(parts, i, parts.length));
                ArrayNode collected = JsonNodeFactory.instance.arrayNode();
                for (JsonNode element : current) {
                    JsonNode v = resolve(element, rest);
                    if (v == null || v.isNull()) {
                        continue;
                    }
                    if (v.isArray()) {
                        collected.addAll((ArrayNode) v);
                    } else {
                        collected.add(v);
                    }
                }
                return collected;
            }
            current = current.get(parts[i]);
        }
        return current;
    }
}
