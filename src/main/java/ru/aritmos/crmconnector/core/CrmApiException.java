package ru.aritmos.crmconnector.core;

/**
 * Исключение для вызывающих, предпочитающих исключения структурированному {@link Outcome}.
 * <p>
 * Сохраняет исходный вид ошибки, HTTP-статус и тело ответа без изменений.
 */
public class CrmApiException extends RuntimeException {

    private final transient Outcome.Failure failure;

    public CrmApiException(Outcome.Failure failure) {
        super(describe(failure));
        this.failure = failure;
    }

    public Outcome.Failure failure() {
        return failure;
    }

    public FailureKind kind() {
        return failure.kind();
    }

    public Integer httpStatus() {
        return failure.httpStatus();
    }

    public String rawBody() {
        return failure.rawBody();
    }

    private static String describe(Outcome.Failure f) {
        if (f.httpStatus() != null) {
            return "[" + f.kind() + "][HTTP " + f.httpStatus() + "] " + f.message();
        }
        return "[" + f.kind() + "] " + f.message();
    }
}
