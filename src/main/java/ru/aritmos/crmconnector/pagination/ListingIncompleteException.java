package ru.aritmos.crmconnector.pagination;

/**
 * Листинг не дошёл до конца коллекции, а вызывающий потребовал полный результат.
 */
public class ListingIncompleteException extends RuntimeException {

    private final ListingCompletion completion;
    private final ListingPosition resumePosition;

    public ListingIncompleteException(ListingCompletion completion, ListingPosition resumePosition) {
        super("Листинг не завершён: " + completion + (resumePosition == null ? "" : ", позиция=" + resumePosition));
        this.completion = completion;
        this.resumePosition = resumePosition;
    }

    public ListingCompletion completion() {
        return completion;
    }

    public ListingPosition resumePosition() {
        return resumePosition;
    }
}
