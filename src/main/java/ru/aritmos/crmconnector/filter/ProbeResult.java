package ru.aritmos.crmconnector.filter;

import ru.aritmos.crmconnector.core.Outcome;

/**
 * Итог пробного запроса с фильтром.
 *
 * @param verdict    вывод о поддержке ({@link FilterSupport#UNKNOWN}, если проба неубедительна)
 * @param sampleSize сколько элементов вернул сервер
 * @param matched    сколько из них удовлетворяют фильтру локально
 * @param failure    ошибка запроса, если была
 */
public record ProbeResult(FilterSupport verdict, int sampleSize, int matched, Outcome.Failure failure) {

    public double matchRatio() {
        return sampleSize == 0 ? 0.0 : (double) matched / sampleSize;
    }
}
