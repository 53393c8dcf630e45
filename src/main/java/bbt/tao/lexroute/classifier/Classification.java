package bbt.tao.lexroute.classifier;

import java.util.Optional;

/**
 * Результат классификации запроса. Создаётся один раз на запрос и далее не меняется.
 *
 * @param useRetrieval      обращаться к локальному хранилищу документов
 * @param useLegal          обращаться к сервису судебной практики
 * @param intent            особое намерение или {@link QueryIntent#GENERAL}
 * @param hasCaseNumber     в запросе найден номер дела вида {@code 123/456/78}
 * @param caseNumber        сам номер дела, {@code null} если не найден
 * @param documentNumber    порядковый номер документа из запроса ("документ 2"), {@code null} если не указан
 * @param fullTextRequested пользователь просит полный текст решения
 */
public record Classification(
        boolean useRetrieval,
        boolean useLegal,
        QueryIntent intent,
        boolean hasCaseNumber,
        String caseNumber,
        Integer documentNumber,
        boolean fullTextRequested
) {

    public Classification {
        intent = intent == null ? QueryIntent.GENERAL : intent;
        hasCaseNumber = hasCaseNumber && caseNumber != null;
    }

    public static Classification bothSources() {
        return new Classification(true, true, QueryIntent.GENERAL, false, null, null, false);
    }

    public Optional<String> caseNumberValue() {
        return Optional.ofNullable(caseNumber);
    }

    public Optional<Integer> documentNumberValue() {
        return Optional.ofNullable(documentNumber);
    }

    public Classification withSources(boolean retrieval, boolean legal) {
        return new Classification(retrieval, legal, intent, hasCaseNumber, caseNumber, documentNumber, fullTextRequested);
    }
}
