package bbt.tao.lexroute.service.context;

/**
 * Все ограничения длины контекста в символах. Других литералов бюджета в коде быть не должно.
 */
public final class ContextBudgets {

    /** Склеенные чанки семантического поиска. */
    public static final int RETRIEVAL_CONTEXT = 5_000;
    /** Полный текст судебного решения. */
    public static final int CASE_FULL_TEXT = 95_000;
    /** Текст одного документа при поиске по каждому документу. */
    public static final int SWEEP_DOCUMENT = 12_000;
    /** Превью документа в списке документов. */
    public static final int DOCUMENT_PREVIEW = 300;
    /** Превью дела в результатах поиска практики. */
    public static final int CASE_PREVIEW = 200;
    /** Сколько найденных дел попадает в контекст, остальные отбрасываются. */
    public static final int CASES_IN_CONTEXT = 3;

    public static final String TRUNCATION_MARKER = "\n...[текст скорочено]";

    private ContextBudgets() {
    }
}
