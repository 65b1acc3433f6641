package ru.aritmos.crmconnector.core;

/**
 * Классификация неуспешного HTTP-обмена.
 * <p>
 * Разделение на «временные» и «фатальные» виды используется {@link RetryPolicy}:
 * фатальные означают дефект запроса и никогда не повторяются.
 */
public enum FailureKind {

    /** DNS, сброс соединения, отказ в подключении. */
    NETWORK(true),
    /** Таймаут чтения/подключения или HTTP 408. */
    TIMEOUT(true),
    /** HTTP 429. */
    RATE_LIMITED(true),
    /** HTTP 5xx. */
    SERVER_ERROR(true),
    /** Прочие HTTP 4xx: некорректный запрос, фильтр, обязательное поле. */
    CLIENT_ERROR(false),
    /** HTTP 401: неверные или отсутствующие учётные данные. */
    AUTH_ERROR(false),
    /** HTTP 403: учётные данные валидны, но доступ к endpoint запрещён. */
    PERMISSION_ERROR(false);

    private final boolean transientFault;

    FailureKind(boolean transientFault) {
        this.transientFault = transientFault;
    }

    public boolean isTransient() {
        return transientFault;
    }

    /**
     * Сопоставить HTTP-статус неуспешного ответа виду ошибки.
     */
    public static FailureKind fromHttpStatus(int status) {
        if (status == 401) {
            return AUTH_ERROR;
        }
        if (status == 403) {
            return PERMISSION_ERROR;
        }
        if (status == 408) {
            return TIMEOUT;
        }
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status >= 500) {
            return SERVER_ERROR;
        }
        return CLIENT_ERROR;
    }
}
