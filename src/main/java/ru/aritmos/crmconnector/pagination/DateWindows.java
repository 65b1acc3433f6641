package ru.aritmos.crmconnector.pagination;

import ru.aritmos.crmconnector.core.ApiRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Разбиение листинга на последовательные окна по дате создания или изменения.
 * <p>
 * Каждое окно обходится отдельным offset-листингом с параметрами {@code <field>_start}
 * и {@code <field>_end}, поэтому предел глубины offset действует внутри окна, а не на всю коллекцию.
 * Окна полуоткрытые: {@code [start, end)}, конец последнего окна равен {@link #to()}.
 *
 * @param field  поле даты, {@code created} или {@code updated}
 * @param from   начало первого окна
 * @param to     конец последнего окна
 * @param window длина одного окна
 */
public record DateWindows(String field, Instant from, Instant to, Duration window) {

    public static final Duration DEFAULT_WINDOW = Duration.ofDays(30);
    public static final Duration DEFAULT_LOOKBACK = Duration.ofDays(730);

    public DateWindows {
        if (!"created".equals(field) && !"updated".equals(field)) {
            throw new IllegalArgumentException("Поле окна должно быть created или updated: " + field);
        }
        if (from == null || to == null || !from.isBefore(to)) {
            throw new IllegalArgumentException("Некорректный диапазон окон: " + from + " .. " + to);
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Длина окна должна быть положительной: " + window);
        }
    }

    public static DateWindows created(Instant from, Instant to, Duration window) {
        return new DateWindows("created", from, to, window);
    }

    public static DateWindows updated(Instant from, Instant to, Duration window) {
        return new DateWindows("updated", from, to, window);
    }

    /**
     * Окна по 30 дней за последние два года до {@code now}.
     */
    public static DateWindows lastTwoYears(String field, Instant now) {
        return new DateWindows(field, now.minus(DEFAULT_LOOKBACK), now, DEFAULT_WINDOW);
    }

    public String startParam() {
        return field + "_start";
    }

    public String endParam() {
        return field + "_end";
    }

    public List<Window> windows() {
        List<Window> result = new ArrayList<>();
        Instant current = from;
        while (current.isBefore(to)) {
            Instant end = current.plus(window);
            if (end.isAfter(to)) {
                end = to;
            }
            result.add(new Window(current, end));
            current = end;
        }
        return result;
    }

    /**
     * Одно окно {@code [start, end)}.
     */
    public record Window(Instant start, Instant end) {
    }

    List<ApiRequest.QueryParam> query(Window w) {
        return List.of(new ApiRequest.QueryParam(startParam(), w.start().toString()),
                new ApiRequest.QueryParam(endParam(), w.end().toString()));
    }
}
