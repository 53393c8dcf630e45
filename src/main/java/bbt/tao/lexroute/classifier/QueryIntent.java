package bbt.tao.lexroute.classifier;

/**
 * Назначение запроса. Всё, кроме {@link #GENERAL}, обрабатывается особым путём в маршрутизаторе.
 */
public enum QueryIntent {
    GENERAL,
    LIST_DOCUMENTS,
    DOCUMENT_SWEEP,
    DELETE_ALL_DOCUMENTS,
    DELETE_DOCUMENT,
    FULL_TEXT_BY_CASE_NUMBER;

    public boolean isDeletion() {
        return this == DELETE_ALL_DOCUMENTS || this == DELETE_DOCUMENT;
    }
}
